package org.theridian.tasks;

import lombok.RequiredArgsConstructor;
import org.theridian.service.metrics.MetricService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MetricRetentionTask {

    private final MetricService metricService;

    @Scheduled(cron = "${etl.tasks.retention-cron:0 0 * * * *}", zone = "UTC")
    public void purge() {
        metricService.purgeExpired();
    }
}
