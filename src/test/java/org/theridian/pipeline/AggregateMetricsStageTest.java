package org.theridian.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AggregateMetricsStage Tests")
class AggregateMetricsStageTest {

    private static final Instant NOW = Instant.parse("2024-05-01T02:00:00Z");

    @Test
    @DisplayName("Should summarise the synthetic batch of 1000 records")
    void testAggregate_DefaultBatch() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        List<RawRecord> raw = new RawDataExtractStage(PipelineTestSupport.properties(1000)).extract();
        List<CleanRecord> cleaned = new CleanDataStage(clock).clean(raw);

        AggregatedMetrics metrics = new AggregateMetricsStage(clock).aggregate(cleaned);

        assertEquals(1000, metrics.totalRecords());
        assertEquals(5005.0, metrics.avgValue());
        assertEquals(10000, metrics.maxValue());
        assertEquals(10, metrics.minValue());
        assertEquals(Map.of("low", 10L, "medium", 40L, "high", 950L), metrics.valueDistribution());
        assertEquals(Map.of("active", 1000L), metrics.statusDistribution());
        assertEquals(NOW, metrics.processedAt());
        assertEquals(List.of("total_records", "avg_value", "max_value", "min_value"),
                List.copyOf(metrics.numericValues().keySet()));
    }
}
