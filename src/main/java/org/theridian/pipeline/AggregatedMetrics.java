package org.theridian.pipeline;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record AggregatedMetrics(
        long totalRecords,
        double avgValue,
        long maxValue,
        long minValue,
        Map<String, Long> valueDistribution,
        Map<String, Long> statusDistribution,
        Instant processedAt
) {

    /**
     * The scalar aggregates, keyed by name. Distributions and the timestamp are not numeric and are
     * left out.
     */
    public Map<String, Double> numericValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("total_records", (double) totalRecords);
        values.put("avg_value", avgValue);
        values.put("max_value", (double) maxValue);
        values.put("min_value", (double) minValue);
        return values;
    }
}
