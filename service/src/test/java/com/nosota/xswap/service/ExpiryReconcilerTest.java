package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.error.InvalidTransitionException;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.support.LedgerStubs;
import com.nosota.xswap.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExpiryReconcilerTest {

    private static final Long SWAP_ID = 11L;

    @Mock
    SwapLedger swapLedger;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));

    private ExpiryReconciler expiryReconciler;
    private Swap swap;

    @BeforeEach
    void setUp() {
        expiryReconciler = new ExpiryReconciler(swapLedger, clock);

        swap = new Swap();
        swap.setId(SWAP_ID);
        swap.setOwner("alice");
        swap.setDirection(SwapDirection.A_TO_B);
        swap.setState(SwapState.BRIDGE_SENT);
        swap.setInputAmount(100L);
        swap.setMinOutputAmount(90L);
        swap.setCreatedAt(LocalDateTime.now(clock));
        swap.setDeadline(LocalDateTime.now(clock).plusHours(1));

        LedgerStubs.backedBy(swapLedger, swap);
        when(swapLedger.findSwap(404L)).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("active swap past its deadline is expired")
    void expiresDueSwap() {
        clock.advance(Duration.ofHours(2));

        List<Long> expired = expiryReconciler.sweep(List.of(SWAP_ID));

        assertThat(expired).containsExactly(SWAP_ID);
        assertThat(swap.getState()).isEqualTo(SwapState.EXPIRED);
        assertThat(swap.getPreFailureState()).isEqualTo(SwapState.BRIDGE_SENT);
    }

    @Test
    @DisplayName("swap before its deadline is left alone")
    void notDueUntouched() {
        List<Long> expired = expiryReconciler.sweep(List.of(SWAP_ID));

        assertThat(expired).isEmpty();
        assertThat(swap.getState()).isEqualTo(SwapState.BRIDGE_SENT);
        verify(swapLedger, never()).claimStep(any(), any());
    }

    @Test
    @DisplayName("terminal and failed swaps are skipped")
    void terminalSkipped() {
        clock.advance(Duration.ofHours(2));

        for (SwapState state : List.of(SwapState.COMPLETED, SwapState.FAILED, SwapState.REFUNDED, SwapState.EXPIRED)) {
            swap.setState(state);
            assertThat(expiryReconciler.sweep(List.of(SWAP_ID))).isEmpty();
            assertThat(swap.getState()).isEqualTo(state);
        }
    }

    @Test
    @DisplayName("swap with a step in flight is skipped")
    void claimedSwapSkipped() {
        clock.advance(Duration.ofHours(2));
        when(swapLedger.claimStep(SWAP_ID, SwapState.BRIDGE_SENT)).thenReturn(false);

        List<Long> expired = expiryReconciler.sweep(List.of(SWAP_ID));

        assertThat(expired).isEmpty();
        assertThat(swap.getState()).isEqualTo(SwapState.BRIDGE_SENT);
    }

    @Test
    @DisplayName("unknown ids are ignored and repeated sweeps are no-ops")
    void unknownAndRepeated() {
        clock.advance(Duration.ofHours(2));

        assertThat(expiryReconciler.sweep(List.of(404L, SWAP_ID))).containsExactly(SWAP_ID);
        assertThat(expiryReconciler.sweep(List.of(404L, SWAP_ID))).isEmpty();
    }

    @Test
    @DisplayName("rejected transition releases the claim")
    void rejectedTransitionReleasesClaim() {
        clock.advance(Duration.ofHours(2));
        when(swapLedger.recordTransition(eq(SWAP_ID), any(SwapState.class), eq(SwapState.EXPIRED), anyString(), any()))
                .thenThrow(new InvalidTransitionException(SWAP_ID, SwapState.BRIDGE_SENT, SwapState.EXPIRED, "rejected"));

        assertThat(expiryReconciler.sweep(List.of(SWAP_ID))).isEmpty();
        verify(swapLedger).releaseClaim(SWAP_ID);
    }

    @Test
    @DisplayName("sweepAll expires what the ledger reports as due")
    void sweepAll() {
        clock.advance(Duration.ofHours(2));
        when(swapLedger.findIdsDueForExpiry()).thenReturn(List.of(SWAP_ID));

        assertThat(expiryReconciler.sweepAll()).containsExactly(SWAP_ID);
    }
}
