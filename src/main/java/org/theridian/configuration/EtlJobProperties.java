package org.theridian.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Job lifecycle tuning, bound from {@code etl.jobs.*}.
 *
 * @param maxRetries      automatic retries after the first failed attempt
 * @param retryBackoff    delay before the first retry; doubled for each later one
 * @param stuckThreshold  age after which a running job is force-failed by the reaper
 * @param workerPoolSize  threads pulling from the job queue
 */
@ConfigurationProperties("etl.jobs")
public record EtlJobProperties(
        @DefaultValue("3") int maxRetries,
        @DefaultValue("60s") Duration retryBackoff,
        @DefaultValue("2h") Duration stuckThreshold,
        @DefaultValue("4") int workerPoolSize
) {
}
