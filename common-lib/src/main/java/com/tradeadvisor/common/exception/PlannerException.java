package com.tradeadvisor.common.exception;

/**
 * Base type for the typed failures a stage is allowed to raise.
 * Raw transport exceptions are classified into one of the subclasses at the
 * capability boundary and never reach the orchestrator unwrapped.
 */
public abstract class PlannerException extends RuntimeException {

    protected PlannerException(String message) {
        super(message);
    }

    protected PlannerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
