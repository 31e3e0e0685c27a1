package org.theridian.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.repository.EtlJobRepository;
import org.theridian.service.metrics.MetricRecorder;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Summarises the previous UTC day's jobs (by creation time) into {@code daily_report_*} gauges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyReportTask {

    private final EtlJobRepository etlJobRepository;
    private final MetricRecorder metricRecorder;
    private final Clock clock;

    @Scheduled(cron = "${etl.tasks.daily-report-cron:0 5 0 * * *}", zone = "UTC")
    public void run() {
        generate(LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1));
    }

    @Transactional
    public DailyReport generate(LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<EtlJob> jobs = etlJobRepository.findAllByCreatedAtGreaterThanEqualAndCreatedAtLessThan(from, to);

        long completed = jobs.stream().filter(job -> job.getStatus() == JobStatus.COMPLETED).count();
        long failed = jobs.stream().filter(job -> job.getStatus() == JobStatus.FAILED).count();
        long records = jobs.stream()
                .filter(job -> job.getStatus() == JobStatus.COMPLETED)
                .mapToLong(EtlJob::getRecordsProcessed)
                .sum();
        double successRate = jobs.isEmpty() ? 0 : completed * 100.0 / jobs.size();

        DailyReport report = new DailyReport(day, jobs.size(), completed, failed, records, successRate);
        log.info("Daily ETL report generated for {}: {} jobs, {} completed, {} failed, {} records",
                day, report.totalJobs(), completed, failed, records);

        Map<String, String> labels = Map.of("date", day.toString());
        report.numericValues().forEach((key, value) -> metricRecorder.gauge("daily_report_" + key, value, labels));
        return report;
    }
}
