package com.nosota.xswap.support;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.service.SwapLedger;
import com.nosota.xswap.service.TransitionOutcome;

import java.util.Optional;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Stubs a mocked {@link SwapLedger} so that it keeps one swap in memory and applies
 * compare-and-set transitions to it the way the real ledger does.
 */
public final class LedgerStubs {

    private LedgerStubs() {
    }

    @SuppressWarnings("unchecked")
    public static void backedBy(SwapLedger swapLedger, Swap swap) {
        Long swapId = swap.getId();
        when(swapLedger.getSwap(swapId)).thenAnswer(invocation -> swap);
        when(swapLedger.findSwap(swapId)).thenAnswer(invocation -> Optional.of(swap));
        when(swapLedger.claimStep(eq(swapId), any()))
                .thenAnswer(invocation -> swap.getState() == invocation.getArgument(1));
        when(swapLedger.findByAttestationRef(anyString())).thenReturn(Optional.empty());
        when(swapLedger.recordTransition(eq(swapId), any(SwapState.class), any(SwapState.class), anyString(), any()))
                .thenAnswer(invocation -> {
                    SwapState expected = invocation.getArgument(1);
                    SwapState target = invocation.getArgument(2);
                    if (swap.getState() == target) {
                        return TransitionOutcome.ALREADY_APPLIED;
                    }
                    if (swap.getState() != expected) {
                        return TransitionOutcome.ALREADY_TRANSITIONED;
                    }
                    if (target == SwapState.FAILED || target == SwapState.EXPIRED) {
                        swap.setPreFailureState(swap.getState());
                    }
                    if (target == SwapState.FAILED) {
                        swap.setFailureReason(invocation.getArgument(3));
                    }
                    Consumer<Swap> changes = invocation.getArgument(4);
                    if (changes != null) {
                        changes.accept(swap);
                    }
                    swap.setState(target);
                    return TransitionOutcome.APPLIED;
                });
    }
}
