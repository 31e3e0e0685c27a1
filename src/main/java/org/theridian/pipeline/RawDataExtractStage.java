package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates a synthetic batch standing in for rows read from the configured source table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawDataExtractStage {

    private final PipelineProperties properties;

    public List<RawRecord> extract() {
        return extract(properties.batchSize());
    }

    public List<RawRecord> extract(int batchSize) {
        log.info("Starting data extraction from {}", properties.sourceTable());
        List<RawRecord> records = new ArrayList<>(Math.max(batchSize, 0));
        for (long i = 1; i <= batchSize; i++) {
            records.add(new RawRecord(i, "Record_" + i, i * 10, "active"));
        }
        log.info("Data extraction completed with {} records", records.size());
        return records;
    }
}
