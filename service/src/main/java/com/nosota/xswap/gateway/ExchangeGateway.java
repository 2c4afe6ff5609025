package com.nosota.xswap.gateway;

import com.nosota.xswap.error.CollaboratorFailureException;

/**
 * Source-side exchange collaborator (price discovery and liquidity routing live behind it).
 */
public interface ExchangeGateway {

    /**
     * Executes the exchange. Repeating an order with the same idempotency key returns the
     * original result instead of exchanging twice.
     *
     * @param order Exchange order
     * @return Amount obtained and execution proof
     * @throws CollaboratorFailureException if the exchange failed; the reason is recorded on the swap
     */
    ExchangeResult exchange(ExchangeOrder order) throws CollaboratorFailureException;
}
