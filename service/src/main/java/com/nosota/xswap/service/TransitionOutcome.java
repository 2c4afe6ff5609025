package com.nosota.xswap.service;

/**
 * Result of a ledger transition request.
 */
public enum TransitionOutcome {
    /**
     * The swap moved to the requested state.
     */
    APPLIED,

    /**
     * The swap already was in the requested state; nothing changed.
     */
    ALREADY_APPLIED,

    /**
     * The swap left the expected state before the request was applied; nothing changed.
     */
    ALREADY_TRANSITIONED;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
