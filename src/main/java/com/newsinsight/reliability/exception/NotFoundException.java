package com.newsinsight.reliability.exception;

import com.newsinsight.reliability.entity.UseCase;

/**
 * No snapshot was ever computed for the requested domain and use case.
 */
public class NotFoundException extends ReliabilityException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static NotFoundException noSnapshots(String domain, UseCase useCase) {
        return new NotFoundException("No reliability data for domain '" + domain + "' and use case '"
                + useCase.getValue() + "'. Run the score computation worker first.");
    }
}
