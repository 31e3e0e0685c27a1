package org.theridian.pipeline;

import java.time.Instant;

public record CleanRecord(
        long id,
        String name,
        long value,
        String status,
        Instant processedAt,
        ValueCategory valueCategory
) {
}
