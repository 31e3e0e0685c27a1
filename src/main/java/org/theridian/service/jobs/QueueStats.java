package org.theridian.service.jobs;

public record QueueStats(
        boolean running,
        boolean consumerRegistered,
        int poolSize,
        int activeWorkers,
        int queuedTasks
) {

    public boolean healthy() {
        return running && consumerRegistered;
    }
}
