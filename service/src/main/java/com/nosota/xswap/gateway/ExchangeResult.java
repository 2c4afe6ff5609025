package com.nosota.xswap.gateway;

/**
 * @param amountOut       Amount of the bought asset
 * @param executionProof  Transaction hash or receipt id of the executed exchange
 */
public record ExchangeResult(
        long amountOut,
        String executionProof
) {
}
