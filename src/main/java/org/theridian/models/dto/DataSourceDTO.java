package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.theridian.models.enums.SourceType;

import java.time.Instant;
import java.util.Map;

// connection_string is deliberately absent: it is write-only
public record DataSourceDTO(
        String id,
        String name,
        SourceType sourceType,
        @JsonProperty("is_active") boolean active,
        Map<String, Object> metadata,
        long etlJobsCount,
        Instant createdAt,
        Instant updatedAt
) {
}
