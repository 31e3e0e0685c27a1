package org.theridian.controllers;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.ApiError;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * Renders every error raised by a controller as {@link ApiError}. Unexpected exceptions are logged
 * and reported as a bare 500 without internals.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException exception, HttpServletRequest request) {
        String field = exception instanceof ValidationFailedException validation ? validation.getField() : null;
        if (exception.getStatusCode().is5xxServerError()) {
            log.error("Request to {} failed", request.getRequestURI(), exception);
        } else {
            log.debug("Request to {} rejected: {}", request.getRequestURI(), exception.getReason());
        }
        return build(exception.getStatusCode(), exception.getReason(), request, field);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException exception, HttpServletRequest request) {
        FieldError fieldError = exception.getBindingResult().getFieldError();
        if (fieldError == null) {
            return build(HttpStatus.BAD_REQUEST, "Request validation failed", request, null);
        }
        return build(HttpStatus.BAD_REQUEST, fieldError.getDefaultMessage(), request, toSnakeCase(fieldError.getField()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException exception, HttpServletRequest request) {
        Throwable cause = exception.getMostSpecificCause();
        String message = cause instanceof IllegalArgumentException ? cause.getMessage() : "Malformed request body";
        return build(HttpStatus.BAD_REQUEST, message, request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException exception, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + exception.getName() + "'",
                request, exception.getName());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException exception,
                                                           HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, exception.getMessage(), request, exception.getParameterName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException exception, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, exception.getMessage(), request, null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleConcurrentUpdate(ObjectOptimisticLockingFailureException exception,
                                                           HttpServletRequest request) {
        log.warn("Concurrent update on {}: {}", request.getRequestURI(), exception.getMessage());
        return build(HttpStatus.CONFLICT, "The resource was modified concurrently, please retry", request, null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(DataIntegrityViolationException exception,
                                                             HttpServletRequest request) {
        log.warn("Integrity violation on {}: {}", request.getRequestURI(), exception.getMostSpecificCause().getMessage());
        return build(HttpStatus.CONFLICT, "The request conflicts with existing data", request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception exception, HttpServletRequest request) {
        // framework errors such as 405 or unknown static resources carry their own status
        if (exception instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            return build(errorResponse.getStatusCode(), errorResponse.getBody().getDetail(), request, null);
        }
        log.error("Unhandled error on {}", request.getRequestURI(), exception);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", request, null);
    }

    private static ResponseEntity<ApiError> build(HttpStatusCode status, String message, HttpServletRequest request,
                                                  String field) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        ApiError body = new ApiError(
                Instant.now(),
                status.value(),
                resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()),
                message,
                request.getRequestURI(),
                field
        );
        return ResponseEntity.status(status).body(body);
    }

    static String toSnakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
