package org.theridian.models.dto;

import org.theridian.models.enums.MetricType;

import java.time.Instant;
import java.util.Map;

public record MetricDataDTO(
        String id,
        String metricName,
        double metricValue,
        MetricType metricType,
        Map<String, String> labels,
        Instant timestamp,
        Instant createdAt
) {
}
