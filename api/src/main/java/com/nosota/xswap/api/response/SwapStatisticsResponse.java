package com.nosota.xswap.api.response;

import com.nosota.xswap.api.model.SwapState;

import java.util.Map;

/**
 * Aggregate counters of the coordinator.
 *
 * @param feeCollectorBalance  Total fees kept from refunds
 * @param completedVolume      Sum of delivered amounts of completed swaps
 * @param refundedVolume       Sum of refunded amounts
 * @param swapsByState         Number of swaps per state
 */
public record SwapStatisticsResponse(
        Long feeCollectorBalance,
        Long completedVolume,
        Long refundedVolume,
        Map<SwapState, Long> swapsByState
) {
}
