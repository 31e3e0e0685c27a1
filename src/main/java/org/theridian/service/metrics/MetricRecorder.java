package org.theridian.service.metrics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.models.entity.MetricData;
import org.theridian.models.enums.MetricType;
import org.theridian.repository.MetricDataRepository;
import org.theridian.utils.AppUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only writer for the metric store. Every call inserts exactly one row; rows are never
 * updated afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricRecorder {

    private final MetricDataRepository metricDataRepository;
    private final Clock clock;

    public MetricData counter(String name, Map<String, String> labels) {
        return record(name, 1, MetricType.COUNTER, labels);
    }

    public MetricData gauge(String name, double value, Map<String, String> labels) {
        return record(name, value, MetricType.GAUGE, labels);
    }

    public MetricData record(String name, double value, MetricType type, Map<String, String> labels) {
        Instant now = clock.instant();
        MetricData metric = new MetricData();
        metric.setMetricUid(AppUtils.generateUUID());
        metric.setMetricName(name);
        metric.setMetricValue(value);
        metric.setMetricType(type != null ? type : MetricType.GAUGE);
        metric.setLabels(labels != null ? new LinkedHashMap<>(labels) : new LinkedHashMap<>());
        metric.setTimestamp(now);
        metric.setCreatedAt(now);
        log.debug("Recording metric {}={} ({})", name, value, metric.getMetricType().getValue());
        return metricDataRepository.save(metric);
    }
}
