package org.theridian.adapters;

import org.theridian.models.entity.DataSource;

/**
 * Simulated processing for one kind of data source. Implementations block for a bounded time and
 * return the number of records the job "processed".
 */
public interface DataSourceAdapter {
    long process(DataSource source, JobConfiguration configuration);
    boolean supportsSource(DataSource source);
}
