package com.nosota.xswap.gateway;

import com.nosota.xswap.error.CollaboratorFailureException;

/**
 * Coordinator custody: pays refunds out to owners and moves fees to the fee collector.
 * Both calls are idempotent on their key.
 */
public interface CustodyGateway {

    void release(Long swapId, String recipient, String asset, long amount, String idempotencyKey)
            throws CollaboratorFailureException;

    void collectFee(Long swapId, String asset, long amount, String idempotencyKey)
            throws CollaboratorFailureException;
}
