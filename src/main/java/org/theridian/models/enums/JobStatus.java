package org.theridian.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an ETL job.
 *
 * <pre>
 * pending ──► running ──► completed
 *    ▲           │
 *    │           ├──► failed ────┐
 *    └───────────┘ (retry)       │
 *    ▲                           │
 *    └──── failed / cancelled ◄──┘ (explicit retry)
 * </pre>
 *
 * {@code cancelled} has no inbound transition; it is kept as a valid stored value and retry precondition.
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, PENDING);
            case FAILED, CANCELLED -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }
}
