package org.theridian.adapters;

import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.utils.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class StreamSourceAdapter extends AbstractSimulatedAdapter {

    static final long DEFAULT_DURATION_SECONDS = 10;
    static final long DEFAULT_RECORDS_PER_SECOND = 100;
    static final long MAX_WAIT_SECONDS = 5;

    public StreamSourceAdapter(Sleeper sleeper) {
        super(SourceType.STREAM, sleeper);
    }

    @Override
    public long process(DataSource source, JobConfiguration configuration) {
        long durationSeconds = configuration.getLong("duration_seconds", DEFAULT_DURATION_SECONDS);
        long recordsPerSecond = configuration.getLong("records_per_second", DEFAULT_RECORDS_PER_SECOND);
        // the wait is capped, the record count is not
        simulateWork(source, Duration.ofSeconds(Math.min(durationSeconds, MAX_WAIT_SECONDS)));
        return Math.multiplyExact(durationSeconds, recordsPerSecond);
    }
}
