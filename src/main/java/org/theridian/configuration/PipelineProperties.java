package org.theridian.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Offline asset pipeline settings, bound from {@code pipeline.*}.
 */
@ConfigurationProperties("pipeline")
public record PipelineProperties(
        @DefaultValue("offline_etl") String name,
        @DefaultValue("1000") int batchSize,
        @DefaultValue("raw_data") String sourceTable,
        @DefaultValue("processed_data") String targetTable,
        @DefaultValue("true") boolean dailyScheduleEnabled,
        @DefaultValue("false") boolean frequentScheduleEnabled,
        @DefaultValue("true") boolean sensorsEnabled,
        @DefaultValue("1h") Duration sourceUpdateWindow,
        @DefaultValue("4h") Duration failureRecoveryWindow
) {
}
