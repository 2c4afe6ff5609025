package com.nosota.xswap.gateway;

/**
 * Exchange order sent to the source-chain exchange collaborator.
 *
 * @param swapId          Swap the order belongs to
 * @param chain           Chain on which the exchange executes
 * @param sourceAsset     Asset sold
 * @param destAsset       Asset bought
 * @param amountIn        Amount sold
 * @param minAmountOut    Minimum amount bought, otherwise the exchange must fail
 * @param idempotencyKey  Correlation id; the collaborator executes an order with a given key at most once
 */
public record ExchangeOrder(
        Long swapId,
        String chain,
        String sourceAsset,
        String destAsset,
        long amountIn,
        long minAmountOut,
        String idempotencyKey
) {
}
