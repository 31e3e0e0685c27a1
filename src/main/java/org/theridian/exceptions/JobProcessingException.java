package org.theridian.exceptions;

/**
 * Raised by a data source adapter when simulated work cannot complete.
 */
public class JobProcessingException extends RuntimeException {

    public JobProcessingException(String message) {
        super(message);
    }

    public JobProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
