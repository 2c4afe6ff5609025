package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.InvalidTransitionException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating SwapState transitions.
 *
 * <p>State diagram:
 * <pre>
 * INITIATED → SOURCE_EXCHANGE_DONE → BRIDGE_SENT → BRIDGE_CONFIRMED → COMPLETED
 *     |               |                   |               |
 *     +---------------+-------------------+---------------+--→ FAILED  ──→ REFUNDED
 *     |               |                   |               |
 *     +---------------+-------------------+---------------+--→ EXPIRED ──→ REFUNDED
 * </pre>
 *
 * <p>COMPLETED and REFUNDED are final. No transition ever leads back to an earlier state.
 */
@Component
public class SwapStateMachine {

    /**
     * Map of allowed transitions: fromState → Set of valid toState values.
     */
    private static final Map<SwapState, Set<SwapState>> ALLOWED_TRANSITIONS = Map.of(
            SwapState.INITIATED, EnumSet.of(
                    SwapState.SOURCE_EXCHANGE_DONE,
                    SwapState.FAILED,
                    SwapState.EXPIRED
            ),
            // FAILED here: the bridge send failed, the intermediate asset is still in custody
            SwapState.SOURCE_EXCHANGE_DONE, EnumSet.of(
                    SwapState.BRIDGE_SENT,
                    SwapState.FAILED,
                    SwapState.EXPIRED
            ),
            // FAILED here: the attestation service reported the transfer as permanently failed
            SwapState.BRIDGE_SENT, EnumSet.of(
                    SwapState.BRIDGE_CONFIRMED,
                    SwapState.FAILED,
                    SwapState.EXPIRED
            ),
            SwapState.BRIDGE_CONFIRMED, EnumSet.of(
                    SwapState.COMPLETED,
                    SwapState.FAILED,
                    SwapState.EXPIRED
            ),
            SwapState.FAILED, EnumSet.of(SwapState.REFUNDED),
            SwapState.EXPIRED, EnumSet.of(SwapState.REFUNDED)
            // COMPLETED, REFUNDED are final states - no transitions allowed
    );

    /**
     * Validates if a state transition is allowed.
     *
     * @param fromState Current state
     * @param toState   Target state
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(SwapState fromState, SwapState toState) {
        if (fromState == null || toState == null) {
            return false;
        }

        // Same state is always allowed (no-op)
        if (fromState == toState) {
            return true;
        }

        Set<SwapState> allowedTargets = ALLOWED_TRANSITIONS.get(fromState);
        return allowedTargets != null && allowedTargets.contains(toState);
    }

    /**
     * Validates if a state transition is allowed, throwing exception if not.
     *
     * @param swapId    Swap the transition belongs to
     * @param fromState Current state
     * @param toState   Target state
     * @throws InvalidTransitionException if transition is not allowed
     */
    public void validateTransition(Long swapId, SwapState fromState, SwapState toState) {
        if (!isTransitionAllowed(fromState, toState)) {
            throw new InvalidTransitionException(swapId, fromState, toState,
                    String.format("Invalid swap state transition for swap %d: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            swapId, fromState, toState, fromState,
                            ALLOWED_TRANSITIONS.getOrDefault(fromState, Set.of()))
            );
        }
    }

    /**
     * Checks if a state is final (no further transitions allowed).
     */
    public boolean isFinalState(SwapState state) {
        return state != null && state.isFinal();
    }

    /**
     * Gets all allowed target states from a given state.
     *
     * @param fromState Current state
     * @return Set of allowed target states (empty if none allowed)
     */
    public Set<SwapState> getAllowedTransitions(SwapState fromState) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromState, Set.of());
    }
}
