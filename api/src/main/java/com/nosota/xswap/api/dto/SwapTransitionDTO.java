package com.nosota.xswap.api.dto;

import com.nosota.xswap.api.model.SwapState;

import java.time.LocalDateTime;

/**
 * One accepted ledger transition.
 *
 * @param swapId      Swap id
 * @param fromState   State before the transition (null for creation)
 * @param toState     State after the transition
 * @param reason      Why the transition happened
 * @param occurredAt  When the transition was recorded
 */
public record SwapTransitionDTO(
        Long swapId,
        SwapState fromState,
        SwapState toState,
        String reason,
        LocalDateTime occurredAt
) {
}
