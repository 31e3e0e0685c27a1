package org.theridian.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.EtlJobProperties;
import org.theridian.exceptions.InvalidJobStateException;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.repository.EtlJobRepository;
import org.theridian.service.metrics.MetricRecorder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Every status change of an {@link EtlJob} goes through here. Each method runs in its own
 * transaction, re-reads the job, checks the transition against {@link JobStatus} and writes the
 * matching metrics in the same commit. Concurrent writers lose on the entity version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTransitionService {

    private final EtlJobRepository etlJobRepository;
    private final MetricRecorder metricRecorder;
    private final EtlJobProperties properties;
    private final Clock clock;

    /**
     * Starts the attempt a queue delivery was issued for. A delivery whose attempt no longer
     * matches the job is stale and rejected.
     */
    @Transactional
    public EtlJob markRunning(String jobUid, int attempt) {
        EtlJob job = load(jobUid);
        if (job.getAttempt() != attempt) {
            throw new InvalidJobStateException(job.getStatus(),
                    "Delivery for attempt " + attempt + " of job " + jobUid + " is stale, job is at attempt " + job.getAttempt());
        }
        moveTo(job, JobStatus.RUNNING);
        job.setStartedAt(clock.instant());
        job.setCompletedAt(null);
        EtlJob saved = etlJobRepository.save(job);

        metricRecorder.counter("etl_jobs_started", Map.of(
                "job_name", job.getName(),
                "data_source", job.getDataSource().getName()));
        log.info("Job {} ({}) started, attempt {}", job.getJobUid(), job.getName(), job.getAttempt());
        return saved;
    }

    @Transactional
    public EtlJob markCompleted(String jobUid, long recordsProcessed) {
        EtlJob job = loadRunning(jobUid, JobStatus.COMPLETED);
        moveTo(job, JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setRecordsProcessed(recordsProcessed);
        job.setErrorMessage("");
        job.setAttempt(0);
        EtlJob saved = etlJobRepository.save(job);

        Duration duration = job.getDuration();
        double seconds = duration != null ? duration.toMillis() / 1000.0 : 0;
        metricRecorder.gauge("etl_job_duration_seconds", seconds, Map.of(
                "job_name", job.getName(),
                "status", JobStatus.COMPLETED.getValue()));
        metricRecorder.gauge("etl_records_processed", recordsProcessed, Map.of(
                "job_name", job.getName(),
                "data_source", job.getDataSource().getName()));
        log.info("Job {} completed: {} records in {}s", job.getJobUid(), recordsProcessed, seconds);
        return saved;
    }

    @Transactional
    public EtlJob markFailed(String jobUid, Throwable cause) {
        EtlJob job = loadRunning(jobUid, JobStatus.FAILED);
        moveTo(job, JobStatus.FAILED);
        job.setCompletedAt(clock.instant());
        job.setErrorMessage(describe(cause));
        EtlJob saved = etlJobRepository.save(job);

        recordFailure(job, cause);
        log.warn("Job {} failed after {} retries: {}", job.getJobUid(), job.getAttempt(), job.getErrorMessage());
        return saved;
    }

    /**
     * Puts a failed attempt back to pending with the error kept and the attempt counter bumped.
     * Only a running job qualifies; failed to pending is reserved for {@link #resetForRetry}.
     * The caller is responsible for re-enqueueing.
     */
    @Transactional
    public EtlJob markRetryScheduled(String jobUid, Throwable cause) {
        EtlJob job = loadRunning(jobUid, JobStatus.PENDING);
        moveTo(job, JobStatus.PENDING);
        job.setErrorMessage(describe(cause));
        job.setStartedAt(null);
        job.setCompletedAt(null);
        job.setAttempt(job.getAttempt() + 1);
        EtlJob saved = etlJobRepository.save(job);

        recordFailure(job, cause);
        log.info("Job {} failed attempt {}, retry scheduled", job.getJobUid(), job.getAttempt());
        return saved;
    }

    @Transactional
    public EtlJob resetForRetry(String jobUid) {
        EtlJob job = load(jobUid);
        if (!job.getStatus().isRetryable()) {
            throw new InvalidJobStateException(job.getStatus(), "Job can only be retried if it failed or was cancelled");
        }
        moveTo(job, JobStatus.PENDING);
        job.setErrorMessage("");
        job.setStartedAt(null);
        job.setCompletedAt(null);
        job.setAttempt(0);
        log.info("Job {} reset for retry", job.getJobUid());
        return etlJobRepository.save(job);
    }

    /**
     * Force-fails a job that has been running since before {@code cutoff}. The age is checked again
     * against the freshly loaded row.
     */
    @Transactional
    public EtlJob markTimedOut(String jobUid, Instant cutoff) {
        EtlJob job = load(jobUid);
        if (job.getStatus() != JobStatus.RUNNING || job.getStartedAt() == null || !job.getStartedAt().isBefore(cutoff)) {
            throw new InvalidJobStateException(job.getStatus(), "Job " + jobUid + " is no longer stuck");
        }
        moveTo(job, JobStatus.FAILED);
        job.setErrorMessage(timeoutMessage());
        job.setCompletedAt(clock.instant());
        EtlJob saved = etlJobRepository.save(job);

        metricRecorder.counter("etl_jobs_timeout", Map.of("job_name", job.getName()));
        log.warn("Job {} timed out, running since {}", job.getJobUid(), job.getStartedAt());
        return saved;
    }

    String timeoutMessage() {
        long hours = properties.stuckThreshold().toHours();
        if (hours > 0 && properties.stuckThreshold().equals(Duration.ofHours(hours))) {
            return "Job timed out after " + hours + (hours == 1 ? " hour" : " hours");
        }
        return "Job timed out after " + properties.stuckThreshold().toMinutes() + " minutes";
    }

    private EtlJob load(String jobUid) {
        return etlJobRepository.findByJobUid(jobUid)
                .orElseThrow(() -> new ResourceNotFoundException("ETL job", jobUid));
    }

    /**
     * Loads a job that a worker is about to finish. The reaper may have failed it meanwhile.
     */
    private EtlJob loadRunning(String jobUid, JobStatus target) {
        EtlJob job = load(jobUid);
        if (job.getStatus() != JobStatus.RUNNING) {
            throw InvalidJobStateException.transition(jobUid, job.getStatus(), target);
        }
        return job;
    }

    private void moveTo(EtlJob job, JobStatus target) {
        if (!job.getStatus().canTransitionTo(target)) {
            throw InvalidJobStateException.transition(job.getJobUid(), job.getStatus(), target);
        }
        job.setStatus(target);
        job.setUpdatedAt(clock.instant());
    }

    private void recordFailure(EtlJob job, Throwable cause) {
        metricRecorder.counter("etl_jobs_failed", Map.of(
                "job_name", job.getName(),
                "error_type", cause.getClass().getSimpleName()));
    }

    static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
