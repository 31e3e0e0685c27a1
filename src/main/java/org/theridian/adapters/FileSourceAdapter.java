package org.theridian.adapters;

import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.utils.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class FileSourceAdapter extends AbstractSimulatedAdapter {

    static final long DEFAULT_ESTIMATED_RECORDS = 5000;

    public FileSourceAdapter(Sleeper sleeper) {
        super(SourceType.FILE, sleeper);
    }

    @Override
    public long process(DataSource source, JobConfiguration configuration) {
        long estimated = configuration.getLong("estimated_records", DEFAULT_ESTIMATED_RECORDS);
        simulateWork(source, Duration.ofSeconds(3));
        return estimated;
    }
}
