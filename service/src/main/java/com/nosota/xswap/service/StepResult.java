package com.nosota.xswap.service;

import com.nosota.xswap.api.model.StepOutcome;
import com.nosota.xswap.api.model.SwapState;

/**
 * Outcome of one saga step together with the state the swap holds afterwards.
 */
public record StepResult(
        Long swapId,
        StepOutcome outcome,
        SwapState state,
        String message
) {
}
