package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.InvalidTransitionException;
import com.nosota.xswap.model.Swap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Forces abandoned swaps to EXPIRED.
 *
 * <p>Permissionless and repeatable: a swap is expired only if it is still active and its
 * deadline has passed. Swaps with a step in flight are skipped; the step itself observes
 * the deadline, or the next sweep picks the swap up once the claim went stale.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpiryReconciler {

    private final SwapLedger swapLedger;
    private final Clock clock;

    /**
     * Expires the given swaps where due. Unknown ids and swaps not due are ignored.
     *
     * @param swapIds Swap ids to check
     * @return Ids expired by this call
     */
    public List<Long> sweep(List<Long> swapIds) {
        List<Long> expired = new ArrayList<>();
        for (Long swapId : swapIds) {
            if (expireIfDue(swapId)) {
                expired.add(swapId);
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} of {} swaps: {}", expired.size(), swapIds.size(), expired);
        }
        return expired;
    }

    /**
     * Expires every active swap past its deadline.
     *
     * @return Ids expired by this call
     */
    public List<Long> sweepAll() {
        List<Long> due = swapLedger.findIdsDueForExpiry();
        log.debug("Swaps due for expiry: {}", due.size());
        return sweep(due);
    }

    private boolean expireIfDue(Long swapId) {
        Optional<Swap> found = swapLedger.findSwap(swapId);
        if (found.isEmpty()) {
            log.debug("Sweep skipped unknown swap: swapId={}", swapId);
            return false;
        }

        Swap swap = found.get();
        SwapState state = swap.getState();
        if (!state.isActive() || LocalDateTime.now(clock).isBefore(swap.getDeadline())) {
            return false;
        }

        if (!swapLedger.claimStep(swapId, state)) {
            log.debug("Sweep skipped swap with step in flight: swapId={}, state={}", swapId, state);
            return false;
        }

        try {
            TransitionOutcome outcome = swapLedger.recordTransition(swapId, state, SwapState.EXPIRED,
                    "deadline " + swap.getDeadline() + " passed", null);
            return outcome.isApplied();
        } catch (InvalidTransitionException e) {
            swapLedger.releaseClaim(swapId);
            log.warn("Sweep could not expire swap: swapId={}, error={}", swapId, e.getMessage());
            return false;
        }
    }
}
