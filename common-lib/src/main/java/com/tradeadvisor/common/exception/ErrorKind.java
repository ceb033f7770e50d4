package com.tradeadvisor.common.exception;

/**
 * Failure categories a pipeline run can surface to its caller.
 *
 * <ul>
 *   <li>{@code INPUT}            : malformed or missing caller input; never retried</li>
 *   <li>{@code EXTERNAL_SERVICE} : a capability call failed or timed out after retries</li>
 *   <li>{@code VALIDATION}       : a stage produced an artifact that violates an invariant</li>
 *   <li>{@code CANCELLED}        : the run was cancelled between stages</li>
 * </ul>
 */
public enum ErrorKind {
    INPUT,
    EXTERNAL_SERVICE,
    VALIDATION,
    CANCELLED
}
