package org.theridian.utils;

import java.time.Duration;

/**
 * Blocking wait used for simulated work.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
