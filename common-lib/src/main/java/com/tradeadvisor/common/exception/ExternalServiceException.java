package com.tradeadvisor.common.exception;

/**
 * A capability call (vision, search, scrape, account, reasoning) failed.
 *
 * <p>{@code transientFailure} marks failures worth retrying: timeouts, connection
 * errors, HTTP 429 and 5xx. Client errors and missing credentials are permanent.
 */
public class ExternalServiceException extends PlannerException {

    private final ExternalCapability capability;
    private final boolean transientFailure;

    public ExternalServiceException(ExternalCapability capability, String message,
                                    boolean transientFailure) {
        super("[" + capability + "] " + message);
        this.capability = capability;
        this.transientFailure = transientFailure;
    }

    public ExternalServiceException(ExternalCapability capability, String message,
                                    boolean transientFailure, Throwable cause) {
        super("[" + capability + "] " + message, cause);
        this.capability = capability;
        this.transientFailure = transientFailure;
    }

    public ExternalCapability getCapability() {
        return capability;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.EXTERNAL_SERVICE;
    }
}
