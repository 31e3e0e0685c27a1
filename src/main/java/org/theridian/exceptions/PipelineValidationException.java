package org.theridian.exceptions;

/**
 * Hard precondition violated inside an offline pipeline stage.
 */
public class PipelineValidationException extends IllegalStateException {

    public PipelineValidationException(String message) {
        super(message);
    }
}
