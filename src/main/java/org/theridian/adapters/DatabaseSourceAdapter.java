package org.theridian.adapters;

import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.utils.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class DatabaseSourceAdapter extends AbstractSimulatedAdapter {

    static final long DEFAULT_BATCH_SIZE = 1000;

    public DatabaseSourceAdapter(Sleeper sleeper) {
        super(SourceType.DATABASE, sleeper);
    }

    @Override
    public long process(DataSource source, JobConfiguration configuration) {
        long batchSize = configuration.getLong("batch_size", DEFAULT_BATCH_SIZE);
        simulateWork(source, Duration.ofSeconds(2));
        return batchSize;
    }
}
