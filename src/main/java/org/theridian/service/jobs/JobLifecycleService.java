package org.theridian.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.EtlJobProperties;
import org.theridian.exceptions.InvalidJobStateException;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.repository.EtlJobRepository;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives jobs through their lifecycle: one execution attempt per queue delivery, the automatic
 * retry loop, explicit retries from the API and the stuck-job reaper.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleService {

    private final JobTransitionService transitions;
    private final JobProcessor jobProcessor;
    private final JobRetryPolicy retryPolicy;
    private final JobDispatcher jobDispatcher;
    private final EtlJobRepository etlJobRepository;
    private final EtlJobProperties properties;
    private final Clock clock;

    /**
     * Runs one attempt of a pending job. Never throws for processing problems; the outcome is
     * visible on the job row. Deliveries for a job that moved on, or for an older attempt, are
     * dropped.
     */
    public void execute(JobTask task) {
        String jobUid = task.jobUid();
        EtlJob job;
        try {
            job = transitions.markRunning(jobUid, task.attempt());
        } catch (ResourceNotFoundException exception) {
            log.error("ETL job {} not found", jobUid);
            return;
        } catch (InvalidJobStateException | ObjectOptimisticLockingFailureException exception) {
            log.warn("Skipping delivery of job {}: {}", jobUid, exception.getMessage());
            return;
        }

        long recordsProcessed;
        try {
            recordsProcessed = jobProcessor.process(job.getDataSource(), job.getConfiguration());
        } catch (RuntimeException exception) {
            log.error("ETL job {} failed: {}", jobUid, exception.getMessage());
            handleFailure(job, exception);
            return;
        }

        try {
            transitions.markCompleted(jobUid, recordsProcessed);
        } catch (InvalidJobStateException | ObjectOptimisticLockingFailureException exception) {
            // the reaper or another writer got there first
            log.warn("Could not complete job {}: {}", jobUid, exception.getMessage());
        }
    }

    /**
     * Explicit retry of a failed or cancelled job.
     *
     * @throws ResourceNotFoundException when the job does not exist
     * @throws InvalidJobStateException  when the job is not failed or cancelled
     */
    public EtlJob retry(String jobUid) {
        EtlJob job = transitions.resetForRetry(jobUid);
        jobDispatcher.dispatch(job);
        return job;
    }

    /**
     * Fails every job that has been running longer than the stuck threshold.
     *
     * @return number of jobs timed out by this sweep
     */
    public int reapStuckJobs() {
        Instant cutoff = clock.instant().minus(properties.stuckThreshold());
        List<EtlJob> stuck = etlJobRepository.findAllByStatusAndStartedAtLessThan(JobStatus.RUNNING, cutoff);
        int reaped = 0;
        for (EtlJob job : stuck) {
            log.warn("Found stuck ETL job {} started at {}", job.getJobUid(), job.getStartedAt());
            try {
                transitions.markTimedOut(job.getJobUid(), cutoff);
                reaped++;
            } catch (InvalidJobStateException exception) {
                log.info("Job {} is {} now, skipped", job.getJobUid(), exception.getCurrentStatus().getValue());
            } catch (ObjectOptimisticLockingFailureException exception) {
                log.info("Job {} changed while reaping, skipped", job.getJobUid());
            }
        }
        return reaped;
    }

    private void handleFailure(EtlJob job, RuntimeException cause) {
        int attempt = job.getAttempt();
        try {
            if (retryPolicy.shouldRetry(attempt)) {
                Duration backoff = retryPolicy.backoffFor(attempt);
                transitions.markRetryScheduled(job.getJobUid(), cause);
                log.info("Retrying ETL job {} in {}s (retry {})", job.getJobUid(), backoff.toSeconds(), attempt + 1);
                jobDispatcher.dispatch(new JobTask(job.getJobUid(), attempt + 1), backoff);
            } else {
                transitions.markFailed(job.getJobUid(), cause);
            }
        } catch (InvalidJobStateException | ObjectOptimisticLockingFailureException exception) {
            log.warn("Could not record failure of job {}: {}", job.getJobUid(), exception.getMessage());
        }
    }
}
