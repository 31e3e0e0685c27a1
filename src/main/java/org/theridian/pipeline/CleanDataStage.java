package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.PipelineValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops incomplete rows and derives the value category. Fails the run when nothing survives or
 * when ids repeat.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanDataStage {

    private final Clock clock;

    public List<CleanRecord> clean(List<RawRecord> raw) {
        log.info("Starting data transformation of {} records", raw.size());
        Instant processedAt = clock.instant();

        List<CleanRecord> cleaned = raw.stream()
                .filter(RawRecord::isComplete)
                .map(record -> new CleanRecord(record.id(), record.name(), record.value(), record.status(),
                        processedAt, ValueCategory.of(record.value())))
                .toList();

        if (cleaned.isEmpty()) {
            throw new PipelineValidationException("No records after cleaning");
        }
        Set<Long> seen = new HashSet<>();
        for (CleanRecord record : cleaned) {
            if (!seen.add(record.id())) {
                throw new PipelineValidationException("Duplicate IDs found");
            }
        }

        log.info("Data transformation completed with {} records", cleaned.size());
        return cleaned;
    }
}
