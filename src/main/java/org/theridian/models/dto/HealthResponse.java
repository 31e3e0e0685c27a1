package org.theridian.models.dto;

import java.time.Instant;

/**
 * @param celery whether the job worker pool is up and consuming; the name is kept so existing probes keep working
 * @param uptime seconds since application start
 */
public record HealthResponse(
        String status,
        Instant timestamp,
        String version,
        boolean database,
        boolean cache,
        boolean celery,
        Long uptime
) {
}
