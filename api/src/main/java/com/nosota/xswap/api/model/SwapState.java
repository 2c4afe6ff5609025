package com.nosota.xswap.api.model;

/**
 * Lifecycle state of a cross-chain swap.
 *
 * <p>Happy path:
 * <pre>
 * INITIATED → SOURCE_EXCHANGE_DONE → BRIDGE_SENT → BRIDGE_CONFIRMED → COMPLETED
 * </pre>
 * Failures end in FAILED, abandoned swaps in EXPIRED; both are settled by a REFUNDED transition.
 */
public enum SwapState {
    /**
     * INITIATED: Swap record created, no funds have been exchanged yet.
     */
    INITIATED,

    /**
     * SOURCE_EXCHANGE_DONE: Input asset exchanged for the bridge asset on the source chain.
     */
    SOURCE_EXCHANGE_DONE,

    /**
     * BRIDGE_SENT: Bridge transfer initiated, transfer handle recorded.
     */
    BRIDGE_SENT,

    /**
     * BRIDGE_CONFIRMED: Attestation for the bridge transfer obtained and recorded.
     */
    BRIDGE_CONFIRMED,

    /**
     * COMPLETED: Destination asset delivered to the target address.
     * This is a final state.
     */
    COMPLETED,

    /**
     * FAILED: A step failed. Waiting for the owner to request a refund.
     */
    FAILED,

    /**
     * REFUNDED: Funds returned to the owner.
     * This is a final state.
     */
    REFUNDED,

    /**
     * EXPIRED: Deadline passed before completion. Waiting for the owner to request a refund.
     */
    EXPIRED;

    public boolean isFinal() {
        return this == COMPLETED || this == REFUNDED;
    }

    /**
     * States in which the saga can still make forward progress.
     */
    public boolean isActive() {
        return this == INITIATED
                || this == SOURCE_EXCHANGE_DONE
                || this == BRIDGE_SENT
                || this == BRIDGE_CONFIRMED;
    }
}
