package org.theridian.service.jobs;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.EtlJobProperties;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.function.Consumer;

/**
 * In-process {@link JobQueue} backed by a fixed pool of scheduler threads. Delayed deliveries
 * (retry backoff) sit in the scheduler's delay queue.
 */
@Slf4j
@Component
public class ExecutorJobQueue implements JobQueue {

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;
    private volatile Consumer<JobTask> consumer;

    public ExecutorJobQueue(EtlJobProperties properties, Clock clock) {
        this.clock = clock;
        this.scheduler = new ThreadPoolTaskScheduler();
        this.scheduler.setPoolSize(Math.max(1, properties.workerPoolSize()));
        this.scheduler.setThreadNamePrefix("etl-worker-");
        this.scheduler.setWaitForTasksToCompleteOnShutdown(false);
    }

    @PostConstruct
    public void start() {
        scheduler.initialize();
        log.info("Job queue started with {} workers",
                scheduler.getScheduledThreadPoolExecutor().getCorePoolSize());
    }

    @PreDestroy
    public void stop() {
        scheduler.shutdown();
    }

    @Override
    public void enqueue(JobTask task) {
        scheduler.execute(() -> deliver(task));
    }

    @Override
    public void enqueue(JobTask task, Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            enqueue(task);
            return;
        }
        log.debug("Scheduling job {} (attempt {}) in {}s", task.jobUid(), task.attempt(), delay.toSeconds());
        scheduler.schedule(() -> deliver(task), clock.instant().plus(delay));
    }

    @Override
    public void registerConsumer(Consumer<JobTask> consumer) {
        this.consumer = consumer;
    }

    @Override
    public QueueStats stats() {
        ScheduledThreadPoolExecutor executor = scheduler.getScheduledThreadPoolExecutor();
        return new QueueStats(
                !executor.isShutdown(),
                consumer != null,
                executor.getCorePoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size()
        );
    }

    private void deliver(JobTask task) {
        Consumer<JobTask> current = consumer;
        if (current == null) {
            log.warn("No consumer registered, dropping job {}", task.jobUid());
            return;
        }
        current.accept(task);
    }
}
