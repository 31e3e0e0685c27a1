package org.theridian.controllers;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

final class PageRequests {

    static final int MAX_PAGE_SIZE = 100;

    private PageRequests() {
    }

    static Pageable of(int page, int size, Sort sort) {
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return PageRequest.of(Math.max(page, 0), safeSize, sort);
    }
}
