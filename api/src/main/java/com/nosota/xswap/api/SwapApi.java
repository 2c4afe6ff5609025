package com.nosota.xswap.api;

import com.nosota.xswap.api.dto.PagedResponse;
import com.nosota.xswap.api.dto.SwapTransitionDTO;
import com.nosota.xswap.api.request.BridgeSendRequest;
import com.nosota.xswap.api.request.CreateSwapRequest;
import com.nosota.xswap.api.request.DestinationCompleteRequest;
import com.nosota.xswap.api.request.SweepRequest;
import com.nosota.xswap.api.response.RefundQuoteResponse;
import com.nosota.xswap.api.response.RefundResponse;
import com.nosota.xswap.api.response.StepResponse;
import com.nosota.xswap.api.response.SwapResponse;
import com.nosota.xswap.api.response.SwapStatisticsResponse;
import com.nosota.xswap.api.response.SweepResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Swap API interface for the cross-chain swap coordinator.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Swap creation and read-only queries</li>
 *   <li>Saga steps (source exchange, bridge send, bridge confirmation, destination completion)</li>
 *   <li>Refunds and expiry sweeps</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>SwapController - in service module (server-side implementation)</li>
 *   <li>SwapClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/swaps")
public interface SwapApi {

    String CALLER_HEADER = "X-Swap-Caller";

    // ==================== Swap Records ====================

    /**
     * Creates a swap in INITIATED state.
     *
     * @param request Swap parameters
     * @return Created swap
     */
    @PostMapping
    ResponseEntity<SwapResponse> createSwap(@Valid @RequestBody CreateSwapRequest request);

    /**
     * Gets the full swap record.
     *
     * @param swapId Swap id
     * @return Swap record
     */
    @GetMapping("/{swapId}")
    ResponseEntity<SwapResponse> getSwap(@PathVariable("swapId") Long swapId);

    /**
     * Lists swaps created by an owner, newest first.
     *
     * @param owner Owner principal
     * @param page  Page number (0-indexed)
     * @param size  Page size
     * @return Paginated swaps
     */
    @GetMapping("/owners/{owner}")
    ResponseEntity<PagedResponse<SwapResponse>> getSwapsByOwner(
            @PathVariable("owner") String owner,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Finds the swap correlated with a bridge attestation.
     *
     * @param attestationRef Attestation correlation key
     * @return Swap record
     */
    @GetMapping("/attestations/{attestationRef}")
    ResponseEntity<SwapResponse> getSwapByAttestation(
            @PathVariable("attestationRef") String attestationRef);

    /**
     * Gets the transition history of a swap, oldest first.
     *
     * @param swapId Swap id
     * @return Accepted transitions
     */
    @GetMapping("/{swapId}/transitions")
    ResponseEntity<List<SwapTransitionDTO>> getTransitions(@PathVariable("swapId") Long swapId);

    // ==================== Saga Steps ====================

    /**
     * Drives the swap through all remaining steps in the background.
     *
     * @param swapId Swap id
     * @return Swap record at submission time
     */
    @PostMapping("/{swapId}/run")
    ResponseEntity<SwapResponse> runSwap(@PathVariable("swapId") Long swapId);

    @PostMapping("/{swapId}/source-exchange")
    ResponseEntity<StepResponse> sourceExchange(@PathVariable("swapId") Long swapId);

    @PostMapping("/{swapId}/bridge-send")
    ResponseEntity<StepResponse> bridgeSend(
            @PathVariable("swapId") Long swapId,
            @Valid @RequestBody(required = false) BridgeSendRequest request);

    /**
     * Waits for the bridge attestation. Blocks up to the configured overall timeout.
     *
     * @param swapId Swap id
     * @return Step result (PENDING when no attestation arrived in time)
     */
    @PostMapping("/{swapId}/confirm-bridge")
    ResponseEntity<StepResponse> confirmBridge(@PathVariable("swapId") Long swapId);

    /**
     * Calls the destination executor and records its result.
     *
     * @param swapId Swap id
     * @return Step result
     */
    @PostMapping("/{swapId}/destination-execute")
    ResponseEntity<StepResponse> executeDestination(@PathVariable("swapId") Long swapId);

    /**
     * Records a destination-side outcome reported by an external executor.
     *
     * @param swapId  Swap id
     * @param request Final amount or failure reason
     * @return Step result
     */
    @PostMapping("/{swapId}/destination-complete")
    ResponseEntity<StepResponse> destinationComplete(
            @PathVariable("swapId") Long swapId,
            @Valid @RequestBody DestinationCompleteRequest request);

    // ==================== Refunds & Expiry ====================

    /**
     * Previews the refund for a swap without executing it.
     *
     * @param swapId Swap id
     * @return Refund eligibility and amounts
     */
    @GetMapping("/{swapId}/refund-quote")
    ResponseEntity<RefundQuoteResponse> getRefundQuote(@PathVariable("swapId") Long swapId);

    /**
     * Refunds a failed, expired or never-started swap to its owner.
     *
     * @param swapId Swap id
     * @param caller Principal requesting the refund; must be the swap owner
     * @return Executed refund
     */
    @PostMapping("/{swapId}/refund")
    ResponseEntity<RefundResponse> refund(
            @PathVariable("swapId") Long swapId,
            @RequestHeader(CALLER_HEADER) String caller) throws Exception;

    /**
     * Moves past-deadline, non-terminal swaps to EXPIRED. Permissionless.
     *
     * @param request Swap ids to check
     * @return Ids expired by this call
     */
    @PostMapping("/sweep")
    ResponseEntity<SweepResponse> sweep(@Valid @RequestBody SweepRequest request);

    @GetMapping("/statistics")
    ResponseEntity<SwapStatisticsResponse> getStatistics();
}
