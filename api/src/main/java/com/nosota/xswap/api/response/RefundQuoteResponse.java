package com.nosota.xswap.api.response;

/**
 * Refund preview for a swap (nothing is executed).
 *
 * @param swapId        Swap id
 * @param refundable    Whether a refund may be requested now
 * @param refundAmount  Amount that would be returned
 * @param feeAmount     Amount that would be kept as fee
 */
public record RefundQuoteResponse(
        Long swapId,
        boolean refundable,
        Long refundAmount,
        Long feeAmount
) {
}
