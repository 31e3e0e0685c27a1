package org.theridian.adapters;

import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.utils.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ApiSourceAdapter extends AbstractSimulatedAdapter {

    static final long DEFAULT_PAGE_SIZE = 100;
    static final long DEFAULT_PAGES = 5;

    public ApiSourceAdapter(Sleeper sleeper) {
        super(SourceType.API, sleeper);
    }

    @Override
    public long process(DataSource source, JobConfiguration configuration) {
        long pageSize = configuration.getLong("page_size", DEFAULT_PAGE_SIZE);
        long pages = configuration.getLong("pages", DEFAULT_PAGES);
        simulateWork(source, Duration.ofMillis(1500));
        return Math.multiplyExact(pageSize, pages);
    }
}
