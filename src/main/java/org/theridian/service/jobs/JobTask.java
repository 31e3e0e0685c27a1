package org.theridian.service.jobs;

/**
 * Queue message: which job to run and which attempt this delivery belongs to.
 */
public record JobTask(String jobUid, int attempt) {
}
