package org.theridian.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.service.jobs.JobLifecycleService;
import org.theridian.service.metrics.MetricRecorder;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Periodic health sweep: records a heartbeat metric and fails jobs stuck in {@code running}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StuckJobReaper {

    private final JobLifecycleService jobLifecycleService;
    private final MetricRecorder metricRecorder;

    @Scheduled(fixedRateString = "${etl.tasks.reaper-interval:60000}", initialDelayString = "${etl.tasks.reaper-initial-delay:30000}")
    public void sweep() {
        log.debug("Running periodic health check");
        metricRecorder.counter("system_health_check", Map.of("component", "worker"));

        int reaped = jobLifecycleService.reapStuckJobs();
        if (reaped > 0) {
            log.warn("Health check completed. Timed out {} stuck jobs", reaped);
        }
    }
}
