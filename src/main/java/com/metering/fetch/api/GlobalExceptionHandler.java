package com.metering.fetch.api;

import com.metering.fetch.exception.FetchException;
import com.metering.fetch.exception.InvalidRequestException;
import com.metering.fetch.exception.JobNotFoundException;
import com.metering.fetch.exception.JobNotReadyException;
import com.metering.fetch.exception.JobResultExpiredException;
import com.metering.fetch.exception.QueueTransportException;
import com.metering.fetch.exception.UpstreamException;
import com.metering.fetch.exception.UpstreamTimeoutException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the service's exception hierarchy onto HTTP statuses and a uniform {@link ErrorResponse}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Invalid request on {}: {}", path, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), path);
    }

    /**
     * Handle validation constraint violations.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                getFieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()
            ))
            .collect(Collectors.toList());

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle missing required parameters.
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getParameterName(),
                null,
                "This parameter is required"
            ))
        );

        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., text where a number is expected).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)
            ))
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), path);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex, WebRequest request) {
        return respond(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", ex.getMessage(), pathOf(request));
    }

    @ExceptionHandler(JobNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleJobNotReady(JobNotReadyException ex, WebRequest request) {
        return respond(HttpStatus.CONFLICT, "JOB_NOT_READY", ex.getMessage(), pathOf(request));
    }

    @ExceptionHandler(JobResultExpiredException.class)
    public ResponseEntity<ErrorResponse> handleResultExpired(JobResultExpiredException ex, WebRequest request) {
        return respond(HttpStatus.GONE, "RESULT_EXPIRED", ex.getMessage(), pathOf(request));
    }

    @ExceptionHandler(UpstreamTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamTimeout(UpstreamTimeoutException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Upstream timeout on {}: {}", path, ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "UPSTREAM_TIMEOUT", ex.getMessage(), path);
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Upstream error on {} (category={}, status={}): {}",
            path, ex.getCategory(), ex.getStatusCode(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR", ex.getMessage(), path);
    }

    /**
     * The job was never durably created; the caller may retry the request.
     */
    @ExceptionHandler(QueueTransportException.class)
    public ResponseEntity<ErrorResponse> handleQueueTransport(QueueTransportException ex, WebRequest request) {
        String path = pathOf(request);
        log.error("Queue transport failure on {}: {}", path, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "QUEUE_UNAVAILABLE",
            "The request could not be queued. Please retry shortly.", path);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ErrorResponse> handleFetchException(FetchException ex, WebRequest request) {
        String path = pathOf(request);
        log.error("Service exception on {} (category={}): {}", path, ex.getCategory(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "SERVICE_ERROR",
            "A service error occurred. Our team has been notified.", path);
    }

    /**
     * Handle all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        String path = pathOf(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.", path);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, String path) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message, path));
    }

    private static String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
