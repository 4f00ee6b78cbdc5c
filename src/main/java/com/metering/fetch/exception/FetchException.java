package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

/**
 * Root of the service's unchecked exception hierarchy. Every subclass carries the
 * {@link ErrorCategory} assigned where the failure originated.
 */
public class FetchException extends RuntimeException {

    private final ErrorCategory category;

    public FetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category == null ? ErrorCategory.UNKNOWN : category;
    }

    public FetchException(String message, ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.category = category == null ? ErrorCategory.UNKNOWN : category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Wrap any throwable so callers can branch on a category.
     */
    public static FetchException wrap(Throwable error) {
        if (error instanceof FetchException fetchException) {
            return fetchException;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new FetchException(message, ErrorCategory.UNKNOWN, error);
    }
}
