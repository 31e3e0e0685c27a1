package org.theridian.pipeline;

import java.util.Optional;

/**
 * Outcome of one sensor tick: either a run to launch or the reason nothing was launched.
 */
public record SensorResult(RunRequest runRequest, String skipReason) {

    public static SensorResult run(RunRequest runRequest) {
        return new SensorResult(runRequest, null);
    }

    public static SensorResult skip(String reason) {
        return new SensorResult(null, reason);
    }

    public Optional<RunRequest> request() {
        return Optional.ofNullable(runRequest);
    }
}
