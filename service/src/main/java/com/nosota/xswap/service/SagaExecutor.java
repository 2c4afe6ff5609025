package com.nosota.xswap.service;

import com.nosota.xswap.api.model.StepOutcome;
import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.AttestationFailedException;
import com.nosota.xswap.error.AttestationTimeoutException;
import com.nosota.xswap.error.BridgeTransportException;
import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.error.InvalidRequestException;
import com.nosota.xswap.error.InvalidTransitionException;
import com.nosota.xswap.gateway.AttestationProof;
import com.nosota.xswap.gateway.BridgeTransfer;
import com.nosota.xswap.gateway.BridgeTransport;
import com.nosota.xswap.gateway.DestinationExecutor;
import com.nosota.xswap.gateway.ExchangeGateway;
import com.nosota.xswap.gateway.ExchangeOrder;
import com.nosota.xswap.gateway.ExchangeResult;
import com.nosota.xswap.model.Swap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.nosota.xswap.config.AsyncConfig.SWAP_TASK_EXECUTOR;

/**
 * Drives swaps through the saga steps.
 *
 * <p>Every step follows the same pattern:
 * <ol>
 *   <li>Check the swap holds the step's start state and its deadline has not passed</li>
 *   <li>Claim the step in the ledger; a second concurrent caller gets ALREADY_TRANSITIONED</li>
 *   <li>Call the collaborator outside any database transaction</li>
 *   <li>Record the result with a compare-and-set transition</li>
 * </ol>
 *
 * <p>Collaborator failures and attestation timeouts never leave this class: they end up
 * as a FAILED transition or a PENDING outcome. Idempotency keys and the bridge nonce are
 * derived from the swap id, so a retried step cannot spend twice.
 */
@Service
@Slf4j
public class SagaExecutor {

    private final SwapLedger swapLedger;
    private final ChainRegistry chainRegistry;
    private final ExchangeGateway exchangeGateway;
    private final BridgeTransport bridgeTransport;
    private final AttestationWaiter attestationWaiter;
    private final DestinationExecutor destinationExecutor;
    private final SwapStatisticService swapStatisticService;
    private final Clock clock;
    private final Executor swapTaskExecutor;

    @Value("${attestation.per-attempt-timeout:PT15S}")
    private Duration perAttemptTimeout;

    @Value("${attestation.overall-timeout:PT5M}")
    private Duration overallTimeout;

    @Value("${swap.bridge.relayer-fee:0}")
    private long defaultRelayerFee;

    @Value("${swap.bridge.native-drop-off:0}")
    private long defaultNativeDropOff;

    public SagaExecutor(SwapLedger swapLedger,
                        ChainRegistry chainRegistry,
                        ExchangeGateway exchangeGateway,
                        BridgeTransport bridgeTransport,
                        AttestationWaiter attestationWaiter,
                        DestinationExecutor destinationExecutor,
                        SwapStatisticService swapStatisticService,
                        Clock clock,
                        @Qualifier(SWAP_TASK_EXECUTOR) Executor swapTaskExecutor) {
        this.swapLedger = swapLedger;
        this.chainRegistry = chainRegistry;
        this.exchangeGateway = exchangeGateway;
        this.bridgeTransport = bridgeTransport;
        this.attestationWaiter = attestationWaiter;
        this.destinationExecutor = destinationExecutor;
        this.swapStatisticService = swapStatisticService;
        this.clock = clock;
        this.swapTaskExecutor = swapTaskExecutor;
    }

    /**
     * Validates the request and records a new swap in INITIATED state.
     *
     * @return Created swap
     * @throws InvalidRequestException if any parameter is invalid
     */
    public Swap create(String owner, SwapDirection direction, Long inputAmount, Long minOutputAmount,
                       String targetAddress, Integer targetDomain, LocalDateTime deadline) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidRequestException("Owner is required");
        }
        if (direction == null) {
            throw new InvalidRequestException("Direction is required");
        }
        if (inputAmount == null || inputAmount <= 0) {
            throw new InvalidRequestException("Input amount must be positive, got " + inputAmount);
        }
        if (minOutputAmount == null || minOutputAmount <= 0) {
            throw new InvalidRequestException("Minimum output amount must be positive, got " + minOutputAmount);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (deadline == null || !deadline.isAfter(now)) {
            throw new InvalidRequestException("Deadline must be in the future, got " + deadline);
        }

        ChainProfile source = chainRegistry.source(direction);
        ChainProfile destination = chainRegistry.destination(direction);
        if (targetDomain == null || targetDomain != destination.domain()) {
            throw new InvalidRequestException(String.format(
                    "Target domain %s does not match destination chain %s (domain %d)",
                    targetDomain, destination.name(), destination.domain()));
        }
        if (!destination.isValidAddress(targetAddress)) {
            throw new InvalidRequestException(String.format(
                    "Target address '%s' is not a valid %s address", targetAddress, destination.name()));
        }

        Swap swap = new Swap();
        swap.setOwner(owner);
        swap.setDirection(direction);
        swap.setSourceAsset(source.nativeAsset());
        swap.setIntermediateAsset(chainRegistry.bridgeAsset());
        swap.setDestinationAsset(destination.nativeAsset());
        swap.setInputAmount(inputAmount);
        swap.setMinOutputAmount(minOutputAmount);
        swap.setTargetAddress(targetAddress.trim());
        swap.setTargetDomain(targetDomain);
        swap.setDeadline(deadline);
        return swapLedger.open(swap);
    }

    // ==================== Step 1: source exchange ====================

    /**
     * Exchanges the input asset for the bridge asset on the source chain.
     */
    public StepResult sourceExchange(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        Optional<StepResult> skipped = checkStep(swap, SwapState.INITIATED, SwapState.SOURCE_EXCHANGE_DONE);
        if (skipped.isPresent()) {
            return skipped.get();
        }

        ExchangeOrder order = new ExchangeOrder(
                swapId,
                chainRegistry.source(swap.getDirection()).name(),
                swap.getSourceAsset(),
                swap.getIntermediateAsset(),
                swap.getInputAmount(),
                swap.getMinOutputAmount(),
                idempotencyKey(swapId, "exchange"));

        ExchangeResult result;
        try {
            result = exchangeGateway.exchange(order);
        } catch (CollaboratorFailureException e) {
            log.warn("Source exchange failed: swapId={}, error={}", swapId, e.getMessage());
            return fail(swapId, SwapState.INITIATED, "Source exchange failed: " + e.getMessage());
        } catch (RuntimeException e) {
            swapLedger.releaseClaim(swapId);
            throw e;
        }

        if (result == null || result.amountOut() <= 0) {
            return fail(swapId, SwapState.INITIATED, "Source exchange returned no output");
        }

        TransitionOutcome outcome = swapLedger.recordTransition(swapId, SwapState.INITIATED,
                SwapState.SOURCE_EXCHANGE_DONE, "source exchange executed", s -> {
                    s.setIntermediateAmount(result.amountOut());
                    s.setExchangeProof(result.executionProof());
                });
        return toStepResult(swapId, outcome, "Exchanged " + swap.getInputAmount() + " " + swap.getSourceAsset()
                + " for " + result.amountOut() + " " + swap.getIntermediateAsset());
    }

    // ==================== Step 2: bridge send ====================

    public StepResult bridgeSend(Long swapId) {
        return bridgeSend(swapId, null, null);
    }

    /**
     * Hands the bridge asset to the transport.
     *
     * <p>If the transport fails after the funds left custody, a recall is attempted. The swap
     * moves to FAILED either way and is flagged stranded when the recall fails too.
     *
     * @param relayerFee    Relayer fee, configured default when null
     * @param nativeDropOff Destination gas drop-off, configured default when null
     */
    public StepResult bridgeSend(Long swapId, Long relayerFee, Long nativeDropOff) {
        Swap swap = swapLedger.getSwap(swapId);
        Optional<StepResult> skipped = checkStep(swap, SwapState.SOURCE_EXCHANGE_DONE, SwapState.BRIDGE_SENT);
        if (skipped.isPresent()) {
            return skipped.get();
        }

        String nonce = idempotencyKey(swapId, "bridge");
        BridgeTransfer transfer = new BridgeTransfer(
                swap.getIntermediateAsset(),
                swap.getIntermediateAmount(),
                swap.getTargetDomain(),
                swap.getTargetAddress(),
                nonce,
                relayerFee != null ? relayerFee : defaultRelayerFee,
                nativeDropOff != null ? nativeDropOff : defaultNativeDropOff);

        String handle;
        try {
            handle = bridgeTransport.send(transfer);
        } catch (BridgeTransportException e) {
            if (!e.isFundsMoved()) {
                log.warn("Bridge send failed before funds moved: swapId={}, error={}", swapId, e.getMessage());
                return fail(swapId, SwapState.SOURCE_EXCHANGE_DONE, "Bridge send failed: " + e.getMessage());
            }
            return recallStrandedTransfer(swapId, nonce, e.getMessage());
        } catch (RuntimeException e) {
            swapLedger.releaseClaim(swapId);
            throw e;
        }

        if (handle == null || handle.isBlank()) {
            return recallStrandedTransfer(swapId, nonce, "transport returned no transfer handle");
        }

        TransitionOutcome outcome = swapLedger.recordTransition(swapId, SwapState.SOURCE_EXCHANGE_DONE,
                SwapState.BRIDGE_SENT, "bridge transfer sent", s -> {
                    s.setBridgeNonce(nonce);
                    s.setBridgeHandle(handle);
                });
        return toStepResult(swapId, outcome, "Bridge transfer sent, handle " + handle);
    }

    private StepResult recallStrandedTransfer(Long swapId, String nonce, String error) {
        log.error("Bridge send failed after funds moved: swapId={}, nonce={}, error={}", swapId, nonce, error);

        boolean stranded;
        String reason;
        try {
            bridgeTransport.recall(nonce);
            stranded = false;
            reason = "Bridge send failed after funds moved, funds recalled: " + error;
            log.info("Stranded bridge transfer recalled: swapId={}, nonce={}", swapId, nonce);
        } catch (CollaboratorFailureException e) {
            stranded = true;
            reason = "Bridge send failed after funds moved, recall failed: " + e.getMessage();
            log.error("Recall failed, swap needs manual resolution: swapId={}, nonce={}, error={}",
                    swapId, nonce, e.getMessage());
        }

        boolean strandedFlag = stranded;
        TransitionOutcome outcome = swapLedger.recordTransition(swapId, SwapState.SOURCE_EXCHANGE_DONE,
                SwapState.FAILED, reason, s -> {
                    s.setBridgeNonce(nonce);
                    s.setStranded(strandedFlag);
                });
        return toStepResult(swapId, outcome, StepOutcome.FAILED, reason);
    }

    // ==================== Step 3: bridge confirmation ====================

    /**
     * Waits for the attestation of the bridge transfer on the calling thread.
     *
     * <p>A timeout leaves the swap in BRIDGE_SENT (PENDING outcome); the step can be retried
     * until the deadline. An attestation already recorded for another swap is rejected.
     */
    public StepResult confirmBridge(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        Optional<StepResult> skipped = checkStep(swap, SwapState.BRIDGE_SENT, SwapState.BRIDGE_CONFIRMED);
        if (skipped.isPresent()) {
            return skipped.get();
        }

        AttestationProof proof;
        try {
            proof = attestationWaiter.waitForAttestation(swap.getBridgeHandle(), perAttemptTimeout, overallTimeout,
                    swap.getDeadline());
        } catch (AttestationTimeoutException e) {
            if (e.isDeadlineReached()) {
                return expire(swapId, SwapState.BRIDGE_SENT, e.getMessage());
            }
            swapLedger.releaseClaim(swapId);
            log.info("Attestation not available yet: swapId={}, {}", swapId, e.getMessage());
            return new StepResult(swapId, StepOutcome.PENDING, SwapState.BRIDGE_SENT, e.getMessage());
        } catch (AttestationFailedException e) {
            log.warn("Attestation failed: swapId={}, error={}", swapId, e.getMessage());
            return fail(swapId, SwapState.BRIDGE_SENT, e.getMessage());
        } catch (RuntimeException e) {
            swapLedger.releaseClaim(swapId);
            throw e;
        }

        Optional<Swap> owner = swapLedger.findByAttestationRef(proof.attestationRef());
        if (owner.isPresent() && !owner.get().getId().equals(swapId)) {
            return rejectAttestation(swapId, proof.attestationRef(), owner.get().getId());
        }

        TransitionOutcome outcome;
        try {
            outcome = swapLedger.recordTransition(swapId, SwapState.BRIDGE_SENT, SwapState.BRIDGE_CONFIRMED,
                    "attestation recorded", s -> {
                        s.setAttestationRef(proof.attestationRef());
                        s.setAttestationMessage(proof.message());
                        s.setAttestationSignature(proof.signature());
                    });
        } catch (DataIntegrityViolationException e) {
            // Lost the race against another swap recording the same reference
            return rejectAttestation(swapId, proof.attestationRef(), null);
        }
        return toStepResult(swapId, outcome, "Attestation " + proof.attestationRef() + " recorded");
    }

    /**
     * Runs {@link #confirmBridge} on the swap task executor.
     */
    public CompletableFuture<StepResult> confirmBridgeAsync(Long swapId) {
        return CompletableFuture.supplyAsync(() -> confirmBridge(swapId), swapTaskExecutor);
    }

    private StepResult rejectAttestation(Long swapId, String attestationRef, Long otherSwapId) {
        swapLedger.releaseClaim(swapId);
        String message = "Attestation " + attestationRef + " already recorded"
                + (otherSwapId != null ? " for swap " + otherSwapId : " for another swap");
        log.warn("Attestation rejected: swapId={}, {}", swapId, message);
        return new StepResult(swapId, StepOutcome.REJECTED, SwapState.BRIDGE_SENT, message);
    }

    // ==================== Step 4: destination ====================

    /**
     * Redeems the attested transfer on the destination chain and records the delivered amount.
     */
    public StepResult executeDestination(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        Optional<StepResult> skipped = checkStep(swap, SwapState.BRIDGE_CONFIRMED, SwapState.COMPLETED);
        if (skipped.isPresent()) {
            return skipped.get();
        }

        AttestationProof proof = new AttestationProof(
                swap.getAttestationRef(), swap.getAttestationMessage(), swap.getAttestationSignature());
        long finalAmount;
        try {
            finalAmount = destinationExecutor.execute(swapId, proof, swap.getTargetAddress(), swap.getDestinationAsset());
        } catch (CollaboratorFailureException e) {
            log.warn("Destination execution failed: swapId={}, error={}", swapId, e.getMessage());
            return fail(swapId, SwapState.BRIDGE_CONFIRMED, "Destination execution failed: " + e.getMessage());
        } catch (RuntimeException e) {
            swapLedger.releaseClaim(swapId);
            throw e;
        }
        return completeDestination(swap, finalAmount);
    }

    /**
     * Records a destination outcome reported from outside.
     *
     * @param finalAmount   Delivered amount, required unless a failure reason is given
     * @param failureReason Destination failure, null on success
     */
    public StepResult destinationComplete(Long swapId, Long finalAmount, String failureReason) {
        Swap swap = swapLedger.getSwap(swapId);
        if (swap.getState() != SwapState.BRIDGE_CONFIRMED) {
            return notInStepState(swap, SwapState.BRIDGE_CONFIRMED, SwapState.COMPLETED);
        }

        if (failureReason != null && !failureReason.isBlank()) {
            return fail(swapId, SwapState.BRIDGE_CONFIRMED, "Destination failed: " + failureReason);
        }
        if (finalAmount == null || finalAmount <= 0) {
            throw new InvalidRequestException("Final amount must be positive when no failure reason is given");
        }
        return completeDestination(swap, finalAmount);
    }

    private StepResult completeDestination(Swap swap, long finalAmount) {
        Long swapId = swap.getId();
        if (finalAmount < swap.getMinOutputAmount()) {
            return fail(swapId, SwapState.BRIDGE_CONFIRMED, String.format(
                    "Destination delivered %d %s, below minimum %d",
                    finalAmount, swap.getDestinationAsset(), swap.getMinOutputAmount()));
        }

        TransitionOutcome outcome = swapLedger.recordTransition(swapId, SwapState.BRIDGE_CONFIRMED,
                SwapState.COMPLETED, "destination delivered", s -> {
                    s.setOutputAmount(finalAmount);
                    swapStatisticService.recordCompletion(finalAmount);
                });
        return toStepResult(swapId, outcome, "Delivered " + finalAmount + " " + swap.getDestinationAsset());
    }

    // ==================== Whole saga ====================

    /**
     * Runs the remaining steps in order until the swap is terminal or a step does not advance.
     *
     * @return Swap after the last step
     */
    public Swap run(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        while (swap.getState().isActive()) {
            StepResult result = switch (swap.getState()) {
                case INITIATED -> sourceExchange(swapId);
                case SOURCE_EXCHANGE_DONE -> bridgeSend(swapId);
                case BRIDGE_SENT -> confirmBridge(swapId);
                case BRIDGE_CONFIRMED -> executeDestination(swapId);
                default -> throw new IllegalStateException("Unexpected active state " + swap.getState());
            };
            log.debug("Saga step finished: swapId={}, outcome={}, state={}", swapId, result.outcome(), result.state());
            if (result.outcome() != StepOutcome.ADVANCED) {
                break;
            }
            swap = swapLedger.getSwap(swapId);
        }
        return swapLedger.getSwap(swapId);
    }

    /**
     * Runs {@link #run} on the swap task executor.
     */
    public CompletableFuture<Swap> runAsync(Long swapId) {
        return CompletableFuture.supplyAsync(() -> run(swapId), swapTaskExecutor)
                .whenComplete((swap, error) -> {
                    if (error != null) {
                        log.error("Saga run failed: swapId={}, error={}", swapId, error.getMessage(), error);
                    }
                });
    }

    // ==================== Helpers ====================

    /**
     * Common step preamble.
     *
     * @return empty if the caller owns the step now, otherwise the result to return
     */
    private Optional<StepResult> checkStep(Swap swap, SwapState expected, SwapState target) {
        if (swap.getState() != expected) {
            return Optional.of(notInStepState(swap, expected, target));
        }

        Long swapId = swap.getId();
        if (!swapLedger.claimStep(swapId, expected)) {
            Swap current = swapLedger.getSwap(swapId);
            return Optional.of(new StepResult(swapId, StepOutcome.ALREADY_TRANSITIONED, current.getState(),
                    "Step towards " + target + " already in progress or done"));
        }

        // Expire only while holding the claim
        if (!LocalDateTime.now(clock).isBefore(swap.getDeadline())) {
            return Optional.of(expire(swapId, expected, "Deadline " + swap.getDeadline() + " passed before "
                    + target + " step"));
        }
        return Optional.empty();
    }

    private StepResult notInStepState(Swap swap, SwapState expected, SwapState target) {
        SwapState current = swap.getState();
        // A swap still behind the step's start state cannot skip ahead
        if (current.isActive() && current.ordinal() < expected.ordinal()) {
            throw new InvalidTransitionException(swap.getId(), current, target,
                    String.format("Swap %d is in state %s, step towards %s requires %s",
                            swap.getId(), current, target, expected));
        }
        return new StepResult(swap.getId(), StepOutcome.ALREADY_TRANSITIONED, current,
                "Swap already in state " + current);
    }

    private StepResult fail(Long swapId, SwapState expected, String reason) {
        TransitionOutcome outcome = swapLedger.recordTransition(swapId, expected, SwapState.FAILED, reason, null);
        return toStepResult(swapId, outcome, StepOutcome.FAILED, reason);
    }

    private StepResult expire(Long swapId, SwapState expected, String reason) {
        TransitionOutcome outcome = swapLedger.recordTransition(swapId, expected, SwapState.EXPIRED, reason, null);
        return toStepResult(swapId, outcome, StepOutcome.EXPIRED, reason);
    }

    private StepResult toStepResult(Long swapId, TransitionOutcome outcome, String message) {
        return toStepResult(swapId, outcome, StepOutcome.ADVANCED, message);
    }

    private StepResult toStepResult(Long swapId, TransitionOutcome outcome, StepOutcome onApplied, String message) {
        SwapState state = swapLedger.getSwap(swapId).getState();
        if (outcome == TransitionOutcome.ALREADY_TRANSITIONED) {
            return new StepResult(swapId, StepOutcome.ALREADY_TRANSITIONED, state, "Swap already in state " + state);
        }
        return new StepResult(swapId, onApplied, state, message);
    }

    static String idempotencyKey(Long swapId, String step) {
        return "swap-" + swapId + "-" + step;
    }
}
