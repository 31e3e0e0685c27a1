package org.theridian.service.jobs;

import lombok.RequiredArgsConstructor;
import org.theridian.adapters.DataSourceAdapter;
import org.theridian.adapters.JobConfiguration;
import org.theridian.exceptions.UnsupportedSourceTypeException;
import org.theridian.models.entity.DataSource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JobProcessor {

    private final List<DataSourceAdapter> adapters;

    public long process(DataSource source, Map<String, Object> configuration) {
        DataSourceAdapter adapter = adapters.stream()
                .filter(candidate -> candidate.supportsSource(source))
                .findFirst()
                .orElseThrow(() -> new UnsupportedSourceTypeException(
                        source.getSourceType() != null ? source.getSourceType().getValue() : null));
        return adapter.process(source, JobConfiguration.of(configuration));
    }
}
