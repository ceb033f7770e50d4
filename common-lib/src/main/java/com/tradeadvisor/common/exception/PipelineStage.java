package com.tradeadvisor.common.exception;

/** Stages of a trade-plan run, in execution order. */
public enum PipelineStage {
    INPUT,
    ANALYST,
    TRADER,
    RISK,
    ASSEMBLER
}
