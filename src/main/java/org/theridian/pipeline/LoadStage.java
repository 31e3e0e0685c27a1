package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.PipelineProperties;
import org.theridian.service.metrics.MetricRecorder;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes the numeric aggregates as {@code etl_*} gauges. A persistence failure is logged and
 * reported through the return value rather than thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoadStage {

    private final MetricRecorder metricRecorder;
    private final PipelineProperties properties;

    public boolean load(AggregatedMetrics metrics) {
        log.info("Starting data load into {}", properties.targetTable());
        Map<String, String> labels = Map.of(
                "pipeline", properties.name(),
                "table", properties.targetTable());
        try {
            metrics.numericValues().forEach((key, value) -> metricRecorder.gauge("etl_" + key, value, labels));
        } catch (DataAccessException exception) {
            log.error("Data load failed: {}", exception.getMessage());
            return false;
        }
        log.info("Data load completed successfully, {} records", metrics.totalRecords());
        return true;
    }
}
