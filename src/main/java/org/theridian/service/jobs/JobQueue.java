package org.theridian.service.jobs;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Hand-off point between request threads and the job workers. Delivery is at-most-once and
 * unordered across jobs.
 */
public interface JobQueue {

    void enqueue(JobTask task);

    void enqueue(JobTask task, Duration delay);

    void registerConsumer(Consumer<JobTask> consumer);

    QueueStats stats();
}
