package org.theridian.models.dto;

import org.theridian.models.enums.JobStatus;

import java.time.Instant;
import java.util.Map;

/**
 * @param duration seconds between start and completion, {@code null} while either is unset
 */
public record EtlJobDTO(
        String id,
        String name,
        JobStatus status,
        DataSourceDTO dataSource,
        Instant startedAt,
        Instant completedAt,
        long recordsProcessed,
        String errorMessage,
        Map<String, Object> configuration,
        Double duration,
        int attempt,
        Instant createdAt,
        Instant updatedAt
) {
}
