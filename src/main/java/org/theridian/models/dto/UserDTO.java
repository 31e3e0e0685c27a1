package org.theridian.models.dto;

import java.time.Instant;

public record UserDTO(
        String id,
        String name,
        String email,
        Instant createdAt
) {
}
