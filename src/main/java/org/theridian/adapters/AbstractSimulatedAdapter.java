package org.theridian.adapters;

import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.JobProcessingException;
import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.utils.Sleeper;

import java.time.Duration;

@Slf4j
abstract class AbstractSimulatedAdapter implements DataSourceAdapter {

    private final SourceType sourceType;
    private final Sleeper sleeper;

    protected AbstractSimulatedAdapter(SourceType sourceType, Sleeper sleeper) {
        this.sourceType = sourceType;
        this.sleeper = sleeper;
    }

    @Override
    public boolean supportsSource(DataSource source) {
        return source != null && source.getSourceType() == sourceType;
    }

    protected void simulateWork(DataSource source, Duration duration) {
        log.debug("Simulating {} work on {} for {} ms", sourceType.getValue(), source.getName(), duration.toMillis());
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new JobProcessingException("Interrupted while processing " + source.getName(), exception);
        }
    }
}
