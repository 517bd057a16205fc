package com.newsinsight.reliability.exception;

/**
 * Base class for reliability engine errors.
 */
public class ReliabilityException extends RuntimeException {

    private final String errorCode;

    public ReliabilityException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReliabilityException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
