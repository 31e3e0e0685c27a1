package org.theridian.models.dto;

import org.theridian.models.enums.MetricType;
import org.springframework.util.StringUtils;

import java.time.Instant;

public record MetricFilter(
        String metricName,
        MetricType metricType,
        Instant timestampAfter,
        Instant timestampBefore,
        Double minValue,
        Double maxValue,
        Boolean hasLabels,
        String labelKey,
        String labelValue
) {

    public static MetricFilter empty() {
        return new MetricFilter(null, null, null, null, null, null, null, null, null);
    }

    public boolean filtersOnLabels() {
        return hasLabels != null || StringUtils.hasText(labelKey) || StringUtils.hasText(labelValue);
    }
}
