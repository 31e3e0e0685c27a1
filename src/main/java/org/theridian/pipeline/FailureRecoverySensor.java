package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.PipelineProperties;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.repository.EtlJobRepository;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Watches for jobs that recently failed with a temporary error and launches a pipeline run for the
 * oldest of them. The failed job itself is left as is; retrying it stays an explicit API call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailureRecoverySensor {

    static final String RECOVERABLE_MARKER = "temporary";

    private final EtlJobRepository etlJobRepository;
    private final PipelineRunLauncher launcher;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pipeline.sensor-interval:30000}", initialDelayString = "${pipeline.sensor-interval:30000}")
    public void tick() {
        if (!properties.sensorsEnabled()) {
            return;
        }
        SensorResult result = evaluate();
        result.request().ifPresentOrElse(launcher::launch,
                () -> log.debug("Failure recovery sensor skipped: {}", result.skipReason()));
    }

    public SensorResult evaluate() {
        try {
            Instant now = clock.instant();
            Optional<EtlJob> candidate = etlJobRepository
                    .findFirstByStatusAndCompletedAtGreaterThanEqualAndErrorMessageContainingIgnoreCaseOrderByCompletedAtAsc(
                            JobStatus.FAILED, now.minus(properties.failureRecoveryWindow()), RECOVERABLE_MARKER);
            if (candidate.isEmpty()) {
                return SensorResult.skip("No failed jobs requiring automatic retry");
            }

            EtlJob job = candidate.get();
            return SensorResult.run(new RunRequest(
                    "retry_" + job.getJobUid() + "_" + DataAvailabilitySensor.KEY_TIME.format(now),
                    PipelineJob.ETL_PIPELINE,
                    Map.of("trigger", "retry",
                            "original_job_id", job.getJobUid(),
                            "retry_reason", "automatic_recovery")));
        } catch (RuntimeException exception) {
            log.error("Error in failure recovery sensor: {}", exception.getMessage());
            return SensorResult.skip("Recovery sensor error: " + exception.getMessage());
        }
    }
}
