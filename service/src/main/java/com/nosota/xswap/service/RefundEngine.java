package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.error.RefundForbiddenException;
import com.nosota.xswap.error.RefundIneligibleException;
import com.nosota.xswap.error.RefundUnsupportedException;
import com.nosota.xswap.gateway.CustodyGateway;
import com.nosota.xswap.model.Swap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Service for swap refunds.
 *
 * <p>Refund rules:
 * <ul>
 *   <li>Only the swap owner can request a refund</li>
 *   <li>Refundable: FAILED, EXPIRED, past deadline, or INITIATED longer than the grace period</li>
 *   <li>Nothing exchanged yet: the full input amount is returned</li>
 *   <li>Otherwise a fee of {@code feeRateBps} basis points is kept (refund rounded down)</li>
 *   <li>Stranded swaps and bridged swaps of unrecoverable directions are not refunded automatically</li>
 * </ul>
 *
 * <p>Refund workflow:
 * <pre>
 * 1. Check owner, eligibility, recoverability
 * 2. INITIATED / past-deadline swap → FAILED / EXPIRED
 * 3. Claim the swap
 * 4. Custody: release refund to owner, move fee to fee collector (idempotent keys)
 * 5. FAILED / EXPIRED → REFUNDED, counters updated in the same transaction
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundEngine {

    private static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);

    private final SwapLedger swapLedger;
    private final CustodyGateway custodyGateway;
    private final SwapStatisticService swapStatisticService;
    private final Clock clock;

    @Value("${swap.refund.fee-bps:30}")
    private int feeRateBps;

    @Value("${swap.refund.grace-period:PT30M}")
    private Duration gracePeriod;

    @Value("${swap.refund.unrecoverable-directions:B_TO_A}")
    private Set<SwapDirection> unrecoverableDirections;

    /**
     * Checks whether the swap may be refunded now.
     *
     * @param swap Swap to check
     * @return true if FAILED, EXPIRED, past its deadline, or INITIATED past the grace period
     */
    public boolean isRefundable(Swap swap) {
        SwapState state = swap.getState();
        if (state.isFinal()) {
            return false;
        }
        if (state == SwapState.FAILED || state == SwapState.EXPIRED) {
            return true;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (!now.isBefore(swap.getDeadline())) {
            return true;
        }
        return state == SwapState.INITIATED && now.isAfter(swap.getCreatedAt().plus(gracePeriod));
    }

    /**
     * Computes refund and fee.
     *
     * <p>Example: inputAmount=100, feeRateBps=30 → refund 99, fee 1.
     */
    public RefundQuote computeRefund(Swap swap) {
        long input = swap.getInputAmount();
        boolean nothingExchanged = swap.getState() == SwapState.INITIATED
                || swap.getPreFailureState() == SwapState.INITIATED;
        if (nothingExchanged) {
            return new RefundQuote(input, 0L);
        }

        long refund = BigDecimal.valueOf(input)
                .multiply(BPS_DENOMINATOR.subtract(BigDecimal.valueOf(feeRateBps)))
                .divide(BPS_DENOMINATOR, 0, RoundingMode.FLOOR)
                .longValueExact();
        return new RefundQuote(refund, input - refund);
    }

    /**
     * Refunds a swap to its owner.
     *
     * @param swapId Swap id
     * @param caller Principal requesting the refund
     * @return Refunded swap
     * @throws RefundForbiddenException     if the caller is not the owner
     * @throws RefundIneligibleException    if the swap is not refundable (including already refunded)
     * @throws RefundUnsupportedException   if the funds cannot be recovered automatically
     * @throws CollaboratorFailureException if custody failed; the swap stays refundable
     */
    public Swap refund(Long swapId, String caller) throws RefundForbiddenException, RefundIneligibleException,
            RefundUnsupportedException, CollaboratorFailureException {
        Swap swap = swapLedger.getSwap(swapId);
        log.info("Refund requested: swapId={}, caller={}, state={}", swapId, caller, swap.getState());

        // 1. Owner check
        if (caller == null || !caller.equals(swap.getOwner())) {
            throw new RefundForbiddenException("Only the owner of swap " + swapId + " can request a refund");
        }

        // 2. Eligibility
        if (!isRefundable(swap)) {
            throw new RefundIneligibleException(String.format(
                    "Swap %d in state %s is not refundable (deadline %s)", swapId, swap.getState(), swap.getDeadline()));
        }

        // 3. Recoverability
        if (swap.isStranded()) {
            throw new RefundUnsupportedException(
                    "Swap " + swapId + " has stranded bridge funds and needs manual resolution");
        }
        if (swap.getBridgeHandle() != null && unrecoverableDirections.contains(swap.getDirection())) {
            throw new RefundUnsupportedException(
                    "Refund of bridged " + swap.getDirection() + " swaps is not supported, swap " + swapId);
        }

        // 4. Close the saga if it is still active
        SwapState closing = swap.getState();
        if (closing.isActive()) {
            closing = closeActiveSwap(swap);
        }

        // 5. Pay out under the claim
        if (!swapLedger.claimStep(swapId, closing)) {
            throw new RefundIneligibleException("Refund of swap " + swapId + " is already in progress");
        }
        Swap closed = swapLedger.getSwap(swapId);
        RefundQuote quote = computeRefund(closed);

        try {
            custodyGateway.release(swapId, closed.getOwner(), closed.getSourceAsset(), quote.refundAmount(),
                    SagaExecutor.idempotencyKey(swapId, "refund"));
            if (quote.feeAmount() > 0) {
                custodyGateway.collectFee(swapId, closed.getSourceAsset(), quote.feeAmount(),
                        SagaExecutor.idempotencyKey(swapId, "fee"));
            }
        } catch (CollaboratorFailureException | RuntimeException e) {
            swapLedger.releaseClaim(swapId);
            log.error("Refund payout failed: swapId={}, error={}", swapId, e.getMessage());
            throw e;
        }

        TransitionOutcome outcome = swapLedger.recordTransition(swapId, closing, SwapState.REFUNDED,
                "refunded to owner", s -> {
                    s.setOutputAmount(quote.refundAmount());
                    s.setRefundAmount(quote.refundAmount());
                    s.setFeeAmount(quote.feeAmount());
                    swapStatisticService.recordRefund(quote.refundAmount(), quote.feeAmount());
                });
        if (!outcome.isApplied()) {
            throw new RefundIneligibleException("Swap " + swapId + " was already refunded");
        }

        log.info("Refund completed: swapId={}, owner={}, refund={}, fee={}",
                swapId, closed.getOwner(), quote.refundAmount(), quote.feeAmount());
        return swapLedger.getSwap(swapId);
    }

    private SwapState closeActiveSwap(Swap swap) throws RefundIneligibleException {
        Long swapId = swap.getId();
        SwapState current = swap.getState();
        boolean pastDeadline = !LocalDateTime.now(clock).isBefore(swap.getDeadline());
        SwapState target = pastDeadline ? SwapState.EXPIRED : SwapState.FAILED;
        String reason = pastDeadline ? "deadline passed, closed for refund" : "early refund requested by owner";

        if (!swapLedger.claimStep(swapId, current)) {
            throw new RefundIneligibleException("Swap " + swapId + " has a step in progress");
        }
        TransitionOutcome outcome = swapLedger.recordTransition(swapId, current, target, reason, null);
        if (outcome == TransitionOutcome.ALREADY_TRANSITIONED) {
            throw new RefundIneligibleException("Swap " + swapId + " changed state concurrently, retry the refund");
        }
        return target;
    }
}
