package org.theridian.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.models.entity.EtlJob;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;

/**
 * Fire-and-forget submission of jobs to the {@link JobQueue}. Inside a transaction the enqueue waits
 * for commit so a worker never loads a row that is not visible yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatcher {

    private final JobQueue jobQueue;

    public void dispatch(EtlJob job) {
        dispatch(new JobTask(job.getJobUid(), job.getAttempt()), Duration.ZERO);
    }

    public void dispatch(JobTask task, Duration delay) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(task, delay);
                }
            });
            return;
        }
        submit(task, delay);
    }

    private void submit(JobTask task, Duration delay) {
        log.info("Dispatching job {} (attempt {})", task.jobUid(), task.attempt());
        jobQueue.enqueue(task, delay);
    }
}
