package com.tradeadvisor.common.exception;

/**
 * A stage output violates a data-model invariant. Indicates a fault in the upstream
 * reasoning, so it is never retried. The offending artifact (or raw draft) is kept
 * for diagnosis.
 */
public class ValidationException extends PlannerException {

    private final transient Object offendingArtifact;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Object offendingArtifact) {
        super(message);
        this.offendingArtifact = offendingArtifact;
    }

    public Object getOffendingArtifact() {
        return offendingArtifact;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
