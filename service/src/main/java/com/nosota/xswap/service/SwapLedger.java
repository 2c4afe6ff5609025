package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.InvalidTransitionException;
import com.nosota.xswap.event.SwapTransitionEvent;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.model.SwapTransition;
import com.nosota.xswap.repository.SwapRepository;
import com.nosota.xswap.repository.SwapTransitionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative store of swap records.
 *
 * <p>All state changes go through {@link #recordTransition}. Each call runs in its own
 * transaction, locks the swap row, compares the observed state with the expected one,
 * validates the edge with {@link SwapStateMachine}, applies the field changes and the new
 * state together, and writes a {@link SwapTransition} audit row. After that a
 * {@link SwapTransitionEvent} is published.
 *
 * <p>The ledger never calls collaborators. External work is done by the callers between
 * {@link #claimStep} and the transition that records its result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapLedger {

    private static final int MAX_REASON_LENGTH = 1000;

    private final SwapRepository swapRepository;
    private final SwapTransitionRepository swapTransitionRepository;
    private final SwapStateMachine swapStateMachine;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Claims older than this are treated as abandoned (process crashed mid-step).
     */
    @Value("${swap.step-claim-ttl:PT10M}")
    private Duration stepClaimTtl;

    /**
     * Persists a new swap in INITIATED state.
     *
     * @param swap Swap with all creation fields set
     * @return Saved swap with its id
     */
    @Transactional
    public Swap open(Swap swap) {
        LocalDateTime now = LocalDateTime.now(clock);
        swap.setState(SwapState.INITIATED);
        swap.setCreatedAt(now);
        swap.setUpdatedAt(now);
        Swap saved = swapRepository.save(swap);

        writeTransition(saved.getId(), null, SwapState.INITIATED, "swap created", now);
        log.info("Swap opened: swapId={}, owner={}, direction={}, inputAmount={}, deadline={}",
                saved.getId(), saved.getOwner(), saved.getDirection(), saved.getInputAmount(), saved.getDeadline());
        return saved;
    }

    /**
     * Moves the swap to {@code newState} from whatever state it holds.
     * Repeating the current state is a no-op.
     *
     * @param swapId   Swap id
     * @param newState Target state
     * @param reason   Reason recorded with the transition (failure reason for FAILED)
     * @return APPLIED or ALREADY_APPLIED
     * @throws InvalidTransitionException if the edge is not legal
     * @throws EntityNotFoundException    if the swap does not exist
     */
    @Transactional
    public TransitionOutcome recordTransition(Long swapId, SwapState newState, String reason) {
        return applyTransition(swapId, null, newState, reason, null);
    }

    /**
     * Compare-and-set transition: applies only if the swap still holds {@code expectedState}.
     *
     * @param swapId        Swap id
     * @param expectedState State the caller observed before doing its work
     * @param newState      Target state
     * @param reason        Reason recorded with the transition
     * @param changes       Field updates applied atomically with the state change, may be null
     * @return APPLIED, ALREADY_APPLIED, or ALREADY_TRANSITIONED when another caller won
     * @throws InvalidTransitionException if the edge is not legal
     * @throws EntityNotFoundException    if the swap does not exist
     */
    @Transactional
    public TransitionOutcome recordTransition(Long swapId, SwapState expectedState, SwapState newState,
                                              String reason, Consumer<Swap> changes) {
        return applyTransition(swapId, expectedState, newState, reason, changes);
    }

    /**
     * Marks a step as in flight. Only one caller can hold the claim of a swap at a time;
     * the next transition (or {@link #releaseClaim}) clears it.
     *
     * @param swapId        Swap id
     * @param expectedState State the step starts from
     * @return true if this caller owns the step now
     */
    @Transactional
    public boolean claimStep(Long swapId, SwapState expectedState) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = swapRepository.claimStep(swapId, expectedState, now, now.minus(stepClaimTtl));
        if (updated == 0) {
            log.debug("Step claim refused: swapId={}, expectedState={}", swapId, expectedState);
        }
        return updated == 1;
    }

    /**
     * Drops the claim without a transition (step outcome left the state unchanged).
     */
    @Transactional
    public void releaseClaim(Long swapId) {
        swapRepository.releaseClaim(swapId);
    }

    public Swap getSwap(Long swapId) {
        return swapRepository.findById(swapId)
                .orElseThrow(() -> new EntityNotFoundException("Swap with ID " + swapId + " not found"));
    }

    public Page<Swap> getSwapsByOwner(String owner, int page, int size) {
        return swapRepository.findByOwnerOrderByCreatedAtDesc(owner, PageRequest.of(page, size));
    }

    public List<Long> getSwapIdsByOwner(String owner) {
        return swapRepository.findIdsByOwner(owner);
    }

    public Optional<Swap> findByAttestationRef(String attestationRef) {
        return swapRepository.findByAttestationRef(attestationRef);
    }

    public List<SwapTransition> getTransitions(Long swapId) {
        // Distinguish an unknown swap from one without history
        getSwap(swapId);
        return swapTransitionRepository.findBySwapIdOrderByIdAsc(swapId);
    }

    public Optional<Swap> findSwap(Long swapId) {
        return swapRepository.findById(swapId);
    }

    public List<Swap> getSwapsByState(SwapState state) {
        return swapRepository.findByStateOrderByIdAsc(state);
    }

    /**
     * Ids of swaps that can still progress but whose deadline has passed.
     */
    public List<Long> findIdsDueForExpiry() {
        return swapRepository.findIdsDueForExpiry(
                EnumSet.of(SwapState.INITIATED, SwapState.SOURCE_EXCHANGE_DONE,
                        SwapState.BRIDGE_SENT, SwapState.BRIDGE_CONFIRMED),
                LocalDateTime.now(clock));
    }

    /**
     * Ids of BRIDGE_SENT swaps before their deadline with no step in flight.
     */
    public List<Long> findIdsAwaitingAttestation() {
        LocalDateTime now = LocalDateTime.now(clock);
        return swapRepository.findIdsUnclaimedBeforeDeadline(SwapState.BRIDGE_SENT, now, now.minus(stepClaimTtl));
    }

    private TransitionOutcome applyTransition(Long swapId, SwapState expectedState, SwapState newState,
                                              String rawReason, Consumer<Swap> changes) {
        // Collaborator error bodies can be arbitrarily long
        String reason = rawReason != null && rawReason.length() > MAX_REASON_LENGTH
                ? rawReason.substring(0, MAX_REASON_LENGTH)
                : rawReason;
        Swap swap = swapRepository.getOneForUpdate(swapId);
        if (swap == null) {
            throw new EntityNotFoundException("Swap with ID " + swapId + " not found");
        }

        SwapState current = swap.getState();
        if (current == newState) {
            log.debug("Transition already applied: swapId={}, state={}", swapId, current);
            return TransitionOutcome.ALREADY_APPLIED;
        }
        if (expectedState != null && current != expectedState) {
            log.info("Transition skipped, swap already moved on: swapId={}, expected={}, actual={}, requested={}",
                    swapId, expectedState, current, newState);
            return TransitionOutcome.ALREADY_TRANSITIONED;
        }

        swapStateMachine.validateTransition(swapId, current, newState);

        LocalDateTime now = LocalDateTime.now(clock);
        if (newState == SwapState.FAILED || newState == SwapState.EXPIRED) {
            swap.setPreFailureState(current);
        }
        if (newState == SwapState.FAILED) {
            swap.setFailureReason(reason);
        }
        if (changes != null) {
            changes.accept(swap);
        }
        swap.setState(newState);
        swap.setStepClaimedAt(null);
        swap.setUpdatedAt(now);
        // Flush here so a duplicate attestationRef fails inside this call
        swapRepository.saveAndFlush(swap);

        writeTransition(swapId, current, newState, reason, now);
        log.info("Swap transition: swapId={}, {} → {}, reason={}", swapId, current, newState, reason);
        return TransitionOutcome.APPLIED;
    }

    private void writeTransition(Long swapId, SwapState fromState, SwapState toState, String reason,
                                 LocalDateTime occurredAt) {
        SwapTransition transition = new SwapTransition();
        transition.setSwapId(swapId);
        transition.setFromState(fromState);
        transition.setToState(toState);
        transition.setReason(reason);
        transition.setOccurredAt(occurredAt);
        swapTransitionRepository.save(transition);

        applicationEventPublisher.publishEvent(
                new SwapTransitionEvent(this, swapId, fromState, toState, reason, occurredAt));
    }
}
