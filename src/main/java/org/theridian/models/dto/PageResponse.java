package org.theridian.models.dto;

import org.springframework.data.domain.Page;

import java.util.List;

public record PageResponse<T>(
        long count,
        int page,
        int size,
        int totalPages,
        List<T> results
) {

    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(
                page.getTotalElements(),
                page.getNumber(),
                page.getSize(),
                page.getTotalPages(),
                page.getContent()
        );
    }
}
