package com.nosota.xswap.service;

/**
 * @param refundAmount Amount returned to the owner, in source asset units
 * @param feeAmount    Amount kept for the fee collector
 */
public record RefundQuote(
        long refundAmount,
        long feeAmount
) {
}
