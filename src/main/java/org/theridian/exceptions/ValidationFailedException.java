package org.theridian.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Malformed or conflicting input, e.g. a duplicate data source name or a job referencing an
 * inactive data source. Carries the offending field so the error body can name it.
 */
public class ValidationFailedException extends ResponseStatusException {

    private final String field;

    public ValidationFailedException(String field, String message) {
        super(HttpStatus.BAD_REQUEST, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
