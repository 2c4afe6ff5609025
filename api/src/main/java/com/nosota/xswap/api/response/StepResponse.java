package com.nosota.xswap.api.response;

import com.nosota.xswap.api.model.StepOutcome;
import com.nosota.xswap.api.model.SwapState;

/**
 * Result of invoking a saga step.
 *
 * @param swapId   Swap id
 * @param outcome  What the step did
 * @param state    Swap state after the step
 * @param message  Failure reason or diagnostic, may be null
 */
public record StepResponse(
        Long swapId,
        StepOutcome outcome,
        SwapState state,
        String message
) {
}
