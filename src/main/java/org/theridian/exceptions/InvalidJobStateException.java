package org.theridian.exceptions;

import org.theridian.models.enums.JobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidJobStateException extends ResponseStatusException {

    private final JobStatus currentStatus;

    public InvalidJobStateException(JobStatus currentStatus, String message) {
        super(HttpStatus.BAD_REQUEST, message);
        this.currentStatus = currentStatus;
    }

    public static InvalidJobStateException transition(String jobUid, JobStatus from, JobStatus to) {
        return new InvalidJobStateException(from,
                "Job " + jobUid + " cannot move from " + from.getValue() + " to " + to.getValue());
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }
}
