package com.nosota.xswap.api.model;

/**
 * Result of a single saga step invocation.
 */
public enum StepOutcome {
    /**
     * The step succeeded and the swap moved to the next state.
     */
    ADVANCED,

    /**
     * The step failed and the swap moved to FAILED.
     */
    FAILED,

    /**
     * Another caller already performed (or is performing) this step. No work was done.
     */
    ALREADY_TRANSITIONED,

    /**
     * No attestation yet. The swap keeps its state and the step can be retried until the deadline.
     */
    PENDING,

    /**
     * The step result was rejected (duplicate attestation). The swap keeps its state.
     */
    REJECTED,

    /**
     * The deadline passed before the step could run; the swap moved to EXPIRED.
     */
    EXPIRED
}
