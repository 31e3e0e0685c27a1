package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class AggregateMetricsStage {

    private final Clock clock;

    public AggregatedMetrics aggregate(List<CleanRecord> cleaned) {
        log.info("Starting data aggregation of {} records", cleaned.size());
        LongSummaryStatistics stats = cleaned.stream().mapToLong(CleanRecord::value).summaryStatistics();

        AggregatedMetrics metrics = new AggregatedMetrics(
                stats.getCount(),
                stats.getAverage(),
                stats.getCount() == 0 ? 0 : stats.getMax(),
                stats.getCount() == 0 ? 0 : stats.getMin(),
                countBy(cleaned, record -> record.valueCategory().getValue()),
                countBy(cleaned, CleanRecord::status),
                clock.instant()
        );
        log.info("Data aggregation completed: {}", metrics.numericValues());
        return metrics;
    }

    private static Map<String, Long> countBy(List<CleanRecord> records, Function<CleanRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }
}
