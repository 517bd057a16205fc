package com.newsinsight.reliability.exception;

import com.newsinsight.reliability.entity.UseCase;

/**
 * Scoring or storing a single (source, domain, use case) item failed.
 * The batch worker counts these and moves on.
 */
public class ComputationException extends ReliabilityException {

    private final String sourceName;
    private final String domain;
    private final UseCase useCase;

    public ComputationException(String sourceName, String domain, UseCase useCase, Throwable cause) {
        super("COMPUTATION_ERROR",
                "Failed to score " + sourceName + " | " + domain + " | " + useCase.getValue() + ": " + cause.getMessage(),
                cause);
        this.sourceName = sourceName;
        this.domain = domain;
        this.useCase = useCase;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getDomain() {
        return domain;
    }

    public UseCase getUseCase() {
        return useCase;
    }
}
