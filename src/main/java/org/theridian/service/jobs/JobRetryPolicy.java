package org.theridian.service.jobs;

import lombok.RequiredArgsConstructor;
import org.theridian.configuration.EtlJobProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff: attempt {@code n} (zero based) waits {@code retryBackoff * 2^n}.
 */
@Component
@RequiredArgsConstructor
public class JobRetryPolicy {

    private final EtlJobProperties properties;

    public boolean shouldRetry(int attempt) {
        return attempt < properties.maxRetries();
    }

    public Duration backoffFor(int attempt) {
        return properties.retryBackoff().multipliedBy(1L << Math.min(attempt, 30));
    }
}
