package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Writable fields of an API key. The key material itself is generated server side and any
 * {@code key} sent by the client is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiKeyRequest(
        String name,
        @JsonProperty("is_active") Boolean active,
        Instant expiresAt
) {
}
