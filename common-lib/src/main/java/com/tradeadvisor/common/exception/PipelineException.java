package com.tradeadvisor.common.exception;

import com.tradeadvisor.common.model.StageArtifacts;

/**
 * Terminal failure of a trade-plan run.
 *
 * <p>Names the stage that failed and the error kind, the capability when the failure
 * came from an external call, and carries the artifacts of the stages that had already
 * completed. Those artifacts are for diagnosis only.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;
    private final ErrorKind kind;
    private final ExternalCapability capability;
    private final String traceId;
    private final transient StageArtifacts completed;

    public PipelineException(PipelineStage stage, ErrorKind kind, ExternalCapability capability,
                             String traceId, StageArtifacts completed, String message, Throwable cause) {
        super("[" + stage + "/" + kind + "] " + message, cause);
        this.stage = stage;
        this.kind = kind;
        this.capability = capability;
        this.traceId = traceId;
        this.completed = completed != null ? completed : StageArtifacts.empty();
    }

    /** Wraps a typed stage failure, carrying over its kind and capability. */
    public static PipelineException fromStage(PipelineStage stage, PlannerException cause,
                                              String traceId, StageArtifacts completed) {
        ExternalCapability capability = cause instanceof ExternalServiceException ese
            ? ese.getCapability() : null;
        return new PipelineException(stage, cause.kind(), capability, traceId, completed,
                                     cause.getMessage(), cause);
    }

    /** Run stopped at a stage boundary because its cancellation token was signalled. */
    public static PipelineException cancelled(PipelineStage nextStage, String traceId,
                                              StageArtifacts completed) {
        return new PipelineException(nextStage, ErrorKind.CANCELLED, null, traceId, completed,
                                     "Run cancelled before stage " + nextStage, null);
    }

    public PipelineStage getStage() {
        return stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ExternalCapability getCapability() {
        return capability;
    }

    public String getTraceId() {
        return traceId;
    }

    public StageArtifacts getCompleted() {
        return completed;
    }
}
