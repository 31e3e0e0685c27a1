package org.theridian.models.dto;

import org.theridian.models.enums.JobStatus;

import java.time.Instant;
import java.util.List;

public record EtlJobFilter(
        List<JobStatus> statuses,
        String dataSourceUid,
        String dataSourceName,
        String name,
        String nameContains,
        Instant createdAfter,
        Instant createdBefore,
        Instant startedAfter,
        Instant startedBefore,
        Instant completedAfter,
        Instant completedBefore,
        Long minRecords,
        Long maxRecords,
        Boolean hasErrors,
        String search
) {

    public static EtlJobFilter empty() {
        return new EtlJobFilter(List.of(), null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }
}
