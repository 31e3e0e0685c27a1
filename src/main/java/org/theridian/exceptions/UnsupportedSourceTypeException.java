package org.theridian.exceptions;

public class UnsupportedSourceTypeException extends JobProcessingException {

    public UnsupportedSourceTypeException(Object sourceType) {
        super("Unsupported data source type: " + sourceType);
    }
}
