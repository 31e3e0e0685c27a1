package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.PipelineProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Cron triggers for the offline pipeline. Run keys are derived from the execution time, so a
 * schedule fires at most once per slot even across restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineSchedules {

    private static final DateTimeFormatter DAILY_KEY = DateTimeFormatter.ofPattern("yyyy_MM_dd");
    private static final DateTimeFormatter HOURLY_KEY = DateTimeFormatter.ofPattern("yyyy_MM_dd_HH");
    private static final DateTimeFormatter EXECUTION_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter EXECUTION_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final PipelineRunLauncher launcher;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${pipeline.daily-cron:0 0 2 * * *}", zone = "UTC")
    public void dailyEtl() {
        if (!properties.dailyScheduleEnabled()) {
            log.debug("Daily pipeline schedule is disabled");
            return;
        }
        launcher.launch(dailyRequest(executionTime()));
    }

    @Scheduled(cron = "${pipeline.frequent-cron:0 0 */6 * * *}", zone = "UTC")
    public void frequentExtract() {
        if (!properties.frequentScheduleEnabled()) {
            return;
        }
        launcher.launch(frequentRequest(executionTime()));
    }

    static RunRequest dailyRequest(ZonedDateTime executionTime) {
        return new RunRequest(
                "daily_etl_" + DAILY_KEY.format(executionTime),
                PipelineJob.ETL_PIPELINE,
                Map.of("schedule", "daily",
                        "execution_date", EXECUTION_DATE.format(executionTime)));
    }

    static RunRequest frequentRequest(ZonedDateTime executionTime) {
        return new RunRequest(
                "extract_" + HOURLY_KEY.format(executionTime),
                PipelineJob.EXTRACT_ONLY,
                Map.of("schedule", "frequent",
                        "execution_time", EXECUTION_TIME.format(executionTime)));
    }

    private ZonedDateTime executionTime() {
        return ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).truncatedTo(ChronoUnit.MINUTES);
    }
}
