package org.theridian.service;

import lombok.RequiredArgsConstructor;
import org.theridian.models.dto.DashboardStatsDTO;
import org.theridian.models.dto.EtlJobDTO;
import org.theridian.models.enums.JobStatus;
import org.theridian.repository.DataSourceRepository;
import org.theridian.repository.EtlJobRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final DataSourceRepository dataSourceRepository;
    private final EtlJobRepository etlJobRepository;
    private final EtlJobService etlJobService;
    private final Clock clock;

    /**
     * "Today" is the current UTC calendar day, matched against the completion timestamp.
     */
    @Transactional(readOnly = true)
    public DashboardStatsDTO getStats() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant dayStart = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant dayEnd = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<EtlJobDTO> recentJobs = etlJobRepository.findTop5ByOrderByCreatedAtDesc().stream()
                .map(etlJobService::toDto)
                .toList();

        return new DashboardStatsDTO(
                dataSourceRepository.count(),
                dataSourceRepository.countByActiveTrue(),
                etlJobRepository.count(),
                etlJobRepository.countByStatus(JobStatus.RUNNING),
                etlJobRepository.countByStatusAndCompletedAtGreaterThanEqualAndCompletedAtLessThan(
                        JobStatus.COMPLETED, dayStart, dayEnd),
                etlJobRepository.countByStatusAndCompletedAtGreaterThanEqualAndCompletedAtLessThan(
                        JobStatus.FAILED, dayStart, dayEnd),
                recentJobs
        );
    }
}
