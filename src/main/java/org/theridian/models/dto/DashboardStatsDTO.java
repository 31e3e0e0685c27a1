package org.theridian.models.dto;

import java.util.List;

public record DashboardStatsDTO(
        long totalDataSources,
        long activeDataSources,
        long totalEtlJobs,
        long runningJobs,
        long completedJobsToday,
        long failedJobsToday,
        List<EtlJobDTO> recentJobs
) {
}
