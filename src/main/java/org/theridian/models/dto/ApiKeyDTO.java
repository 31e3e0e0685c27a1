package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ApiKeyDTO(
        String id,
        String name,
        String key,
        UserDTO user,
        @JsonProperty("is_active") boolean active,
        Instant expiresAt,
        Instant lastUsedAt,
        Instant createdAt,
        Instant updatedAt
) {
}
