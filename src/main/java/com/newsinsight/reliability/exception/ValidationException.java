package com.newsinsight.reliability.exception;

/**
 * Malformed caller input: bad date, out-of-range limit, empty required field.
 */
public class ValidationException extends ReliabilityException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("VALIDATION_ERROR", message, cause);
    }

    public static ValidationException required(String field) {
        return new ValidationException(field + " is required");
    }

    public static ValidationException outOfRange(String field, Object value, int min, int max) {
        return new ValidationException(field + " must be between " + min + " and " + max + ", got " + value);
    }
}
