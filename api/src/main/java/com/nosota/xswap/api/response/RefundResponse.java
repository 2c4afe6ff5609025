package com.nosota.xswap.api.response;

import com.nosota.xswap.api.model.SwapState;

import java.time.LocalDateTime;

/**
 * Response DTO for an executed refund.
 *
 * @param swapId        Refunded swap
 * @param owner         Refund recipient
 * @param inputAmount   Original input amount
 * @param refundAmount  Amount returned to the owner
 * @param feeAmount     Amount routed to the fee collector
 * @param state         Swap state after the refund (REFUNDED)
 * @param refundedAt    Timestamp of the refund transition
 */
public record RefundResponse(
        Long swapId,
        String owner,
        Long inputAmount,
        Long refundAmount,
        Long feeAmount,
        SwapState state,
        LocalDateTime refundedAt
) {
}
