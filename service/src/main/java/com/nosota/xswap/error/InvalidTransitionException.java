package com.nosota.xswap.error;

import com.nosota.xswap.api.model.SwapState;
import lombok.Getter;

/**
 * Attempt to move a swap along an edge that is not part of the state graph,
 * e.g. a step requested before the swap reached the step's start state.
 */
@Getter
public class InvalidTransitionException extends IllegalStateException {

    private final Long swapId;
    private final SwapState fromState;
    private final SwapState toState;

    public InvalidTransitionException(Long swapId, SwapState fromState, SwapState toState, String message) {
        super(message);
        this.swapId = swapId;
        this.fromState = fromState;
        this.toState = toState;
    }
}
