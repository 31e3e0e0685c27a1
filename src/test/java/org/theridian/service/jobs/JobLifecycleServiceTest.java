package org.theridian.service.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.theridian.configuration.EtlJobProperties;
import org.theridian.exceptions.InvalidJobStateException;
import org.theridian.exceptions.JobProcessingException;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.models.enums.SourceType;
import org.theridian.repository.EtlJobRepository;
import org.theridian.support.TestData;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("JobLifecycleService Tests")
class JobLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private JobTransitionService transitions;

    @Mock
    private JobProcessor jobProcessor;

    @Mock
    private JobDispatcher jobDispatcher;

    @Mock
    private EtlJobRepository etlJobRepository;

    private JobLifecycleService service;
    private EtlJob job;

    @BeforeEach
    void setUp() {
        EtlJobProperties properties = new EtlJobProperties(3, Duration.ofSeconds(60), Duration.ofHours(2), 4);
        service = new JobLifecycleService(transitions, jobProcessor, new JobRetryPolicy(properties),
                jobDispatcher, etlJobRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        job = TestData.job("J1", TestData.source("S1", SourceType.DATABASE), JobStatus.RUNNING, Map.of("batch_size", 10));
    }

    @Test
    @DisplayName("Should complete the job with the adapter's record count")
    void testExecute_Success() {
        when(transitions.markRunning(job.getJobUid(), 0)).thenReturn(job);
        when(jobProcessor.process(job.getDataSource(), job.getConfiguration())).thenReturn(10L);

        service.execute(new JobTask(job.getJobUid(), 0));

        verify(transitions).markCompleted(job.getJobUid(), 10L);
        verify(transitions, never()).markFailed(any(), any());
        verifyNoInteractions(jobDispatcher);
    }

    @Test
    @DisplayName("Should schedule the first retry after the base backoff")
    void testExecute_FirstFailureRetries() {
        JobProcessingException failure = new JobProcessingException("connection refused");
        when(transitions.markRunning(job.getJobUid(), 0)).thenReturn(job);
        when(jobProcessor.process(any(), anyMap())).thenThrow(failure);

        service.execute(new JobTask(job.getJobUid(), 0));

        verify(transitions).markRetryScheduled(job.getJobUid(), failure);
        verify(jobDispatcher).dispatch(new JobTask(job.getJobUid(), 1), Duration.ofSeconds(60));
        verify(transitions, never()).markCompleted(any(), anyLong());
    }

    @Test
    @DisplayName("Should double the backoff on later retries")
    void testExecute_ThirdFailureBacksOff() {
        job.setAttempt(2);
        when(transitions.markRunning(job.getJobUid(), 2)).thenReturn(job);
        when(jobProcessor.process(any(), anyMap())).thenThrow(new JobProcessingException("timeout"));

        service.execute(new JobTask(job.getJobUid(), 2));

        verify(jobDispatcher).dispatch(new JobTask(job.getJobUid(), 3), Duration.ofSeconds(240));
    }

    @Test
    @DisplayName("Should fail the job once retries are exhausted")
    void testExecute_RetriesExhausted() {
        job.setAttempt(3);
        IllegalArgumentException failure = new IllegalArgumentException("bad batch_size");
        when(transitions.markRunning(job.getJobUid(), 3)).thenReturn(job);
        when(jobProcessor.process(any(), anyMap())).thenThrow(failure);

        service.execute(new JobTask(job.getJobUid(), 3));

        verify(transitions).markFailed(job.getJobUid(), failure);
        verify(transitions, never()).markRetryScheduled(any(), any());
        verifyNoInteractions(jobDispatcher);
    }

    @Test
    @DisplayName("Should drop deliveries for jobs that are missing or not pending")
    void testExecute_SkipsStaleDeliveries() {
        when(transitions.markRunning("missing", 0)).thenThrow(new ResourceNotFoundException("ETL job", "missing"));
        when(transitions.markRunning("done", 0)).thenThrow(
                InvalidJobStateException.transition("done", JobStatus.COMPLETED, JobStatus.RUNNING));
        when(transitions.markRunning("raced", 0)).thenThrow(
                new ObjectOptimisticLockingFailureException(EtlJob.class, 1L));
        when(transitions.markRunning("superseded", 1)).thenThrow(
                new InvalidJobStateException(JobStatus.PENDING, "Delivery for attempt 1 of job superseded is stale"));

        assertDoesNotThrow(() -> service.execute(new JobTask("missing", 0)));
        assertDoesNotThrow(() -> service.execute(new JobTask("done", 0)));
        assertDoesNotThrow(() -> service.execute(new JobTask("raced", 0)));
        assertDoesNotThrow(() -> service.execute(new JobTask("superseded", 1)));
        verifyNoInteractions(jobProcessor, jobDispatcher);
    }

    @Test
    @DisplayName("Should not fail when the reaper completed the job first")
    void testExecute_CompletionLostRace() {
        when(transitions.markRunning(job.getJobUid(), 0)).thenReturn(job);
        when(jobProcessor.process(any(), anyMap())).thenReturn(10L);
        when(transitions.markCompleted(job.getJobUid(), 10L)).thenThrow(
                InvalidJobStateException.transition(job.getJobUid(), JobStatus.FAILED, JobStatus.COMPLETED));

        assertDoesNotThrow(() -> service.execute(new JobTask(job.getJobUid(), 0)));
    }

    @Test
    @DisplayName("Should leave a reaped job failed when its attempt raises afterwards")
    void testExecute_ReapedThenFails() {
        JobProcessingException failure = new JobProcessingException("boom");
        when(transitions.markRunning(job.getJobUid(), 0)).thenReturn(job);
        when(jobProcessor.process(any(), anyMap())).thenThrow(failure);
        when(transitions.markRetryScheduled(job.getJobUid(), failure)).thenThrow(
                InvalidJobStateException.transition(job.getJobUid(), JobStatus.FAILED, JobStatus.PENDING));

        assertDoesNotThrow(() -> service.execute(new JobTask(job.getJobUid(), 0)));

        verifyNoInteractions(jobDispatcher);
    }

    @Test
    @DisplayName("Should reset and re-dispatch a retried job")
    void testRetry() {
        EtlJob reset = TestData.job("J1", job.getDataSource(), JobStatus.PENDING, Map.of());
        when(transitions.resetForRetry(reset.getJobUid())).thenReturn(reset);

        EtlJob result = service.retry(reset.getJobUid());

        assertSame(reset, result);
        verify(jobDispatcher).dispatch(reset);
    }

    @Test
    @DisplayName("Should not dispatch when the retry is rejected")
    void testRetry_Rejected() {
        when(transitions.resetForRetry("job-J1")).thenThrow(
                new InvalidJobStateException(JobStatus.COMPLETED, "Job can only be retried if it failed or was cancelled"));

        assertThrows(InvalidJobStateException.class, () -> service.retry("job-J1"));
        verifyNoInteractions(jobDispatcher);
    }

    @Test
    @DisplayName("Should time out stuck jobs and skip the ones that moved on")
    void testReapStuckJobs() {
        Instant cutoff = NOW.minus(Duration.ofHours(2));
        EtlJob stuck = TestData.job("old", job.getDataSource(), JobStatus.RUNNING, Map.of());
        EtlJob finished = TestData.job("finished", job.getDataSource(), JobStatus.RUNNING, Map.of());
        when(etlJobRepository.findAllByStatusAndStartedAtLessThan(JobStatus.RUNNING, cutoff))
                .thenReturn(List.of(stuck, finished));
        when(transitions.markTimedOut(finished.getJobUid(), cutoff)).thenThrow(
                new ObjectOptimisticLockingFailureException(EtlJob.class, 2L));

        int reaped = service.reapStuckJobs();

        assertEquals(1, reaped);
        verify(transitions).markTimedOut(eq(stuck.getJobUid()), eq(cutoff));
    }
}
