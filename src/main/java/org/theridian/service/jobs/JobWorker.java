package org.theridian.service.jobs;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobWorker {

    static final String MDC_JOB_ID = "jobId";

    private final JobQueue jobQueue;
    private final JobLifecycleService jobLifecycleService;

    @PostConstruct
    public void register() {
        jobQueue.registerConsumer(this::handle);
    }

    void handle(JobTask task) {
        MDC.put(MDC_JOB_ID, task.jobUid());
        try {
            jobLifecycleService.execute(task);
        } catch (RuntimeException exception) {
            log.error("Worker failed on job {}", task.jobUid(), exception);
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }
}
