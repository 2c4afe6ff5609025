package com.nosota.xswap.model;

import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Swap entity - authoritative record of one cross-chain swap.
 *
 * <p>Swap workflow:
 * <pre>
 * 1. Swap created (INITIATED)
 * 2. Source chain: input asset → bridge asset (SOURCE_EXCHANGE_DONE)
 * 3. Bridge transfer initiated (BRIDGE_SENT)
 * 4. Attestation obtained (BRIDGE_CONFIRMED)
 * 5. Destination chain: bridge asset → output asset delivered (COMPLETED)
 * </pre>
 *
 * <p>Any failed step leads to FAILED, a passed deadline to EXPIRED; both are
 * closed by a REFUNDED transition. Swaps are never deleted.
 *
 * <p>All amounts are in minimum currency units of their asset.
 */
@Entity
@Table(name = "swap")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Swap {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Principal who created the swap. Only the owner may request a refund.
     */
    @Column(name = "owner", nullable = false, updatable = false)
    private String owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, updatable = false, length = 10)
    private SwapDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private SwapState state;

    /**
     * State held when the swap entered FAILED or EXPIRED.
     * INITIATED here means nothing was exchanged and the refund is fee-free.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "pre_failure_state", length = 32)
    private SwapState preFailureState;

    @Column(name = "source_asset", nullable = false, length = 16)
    private String sourceAsset;

    @Column(name = "intermediate_asset", nullable = false, length = 16)
    private String intermediateAsset;

    @Column(name = "destination_asset", nullable = false, length = 16)
    private String destinationAsset;

    @Column(name = "input_amount", nullable = false)
    private Long inputAmount;

    /**
     * Bridge asset obtained by the source exchange. Null before step 1.
     */
    @Column(name = "intermediate_amount")
    private Long intermediateAmount;

    /**
     * Delivered amount for COMPLETED swaps, refunded amount for REFUNDED swaps.
     * Set only by the transition into one of those states.
     */
    @Column(name = "output_amount")
    private Long outputAmount;

    @Column(name = "min_output_amount", nullable = false)
    private Long minOutputAmount;

    @Column(name = "target_address", nullable = false)
    private String targetAddress;

    @Column(name = "target_domain", nullable = false)
    private Integer targetDomain;

    /**
     * Absolute expiry timestamp (UTC), independent of state.
     */
    @Column(name = "deadline", nullable = false)
    private LocalDateTime deadline;

    /**
     * Execution proof (transaction hash) returned by the source exchange.
     */
    @Column(name = "exchange_proof")
    private String exchangeProof;

    /**
     * Nonce passed to the bridge transport. Deterministic per swap so that
     * a retried send is recognised by the transport.
     */
    @Column(name = "bridge_nonce", length = 64)
    private String bridgeNonce;

    /**
     * Transfer handle returned by the bridge transport.
     */
    @Column(name = "bridge_handle")
    private String bridgeHandle;

    /**
     * Attestation correlation key. Set at most once, unique across all swaps.
     */
    @Column(name = "attestation_ref", unique = true)
    private String attestationRef;

    /**
     * Attested message and its signature, handed to the destination executor.
     */
    @Column(name = "attestation_message", columnDefinition = "TEXT")
    private String attestationMessage;

    @Column(name = "attestation_signature", columnDefinition = "TEXT")
    private String attestationSignature;

    /**
     * Diagnostic text, set only when entering FAILED.
     */
    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    /**
     * True when bridged funds left custody without a usable handle and the
     * compensating recall failed. Such swaps need manual resolution.
     */
    @Column(name = "stranded", nullable = false)
    private boolean stranded;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "fee_amount")
    private Long feeAmount;

    /**
     * Set while a step is in flight for this swap. Cleared by every transition.
     */
    @Column(name = "step_claimed_at")
    private LocalDateTime stepClaimedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
