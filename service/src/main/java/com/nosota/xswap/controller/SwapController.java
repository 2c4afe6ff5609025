package com.nosota.xswap.controller;

import com.nosota.xswap.api.SwapApi;
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
import com.nosota.xswap.mapper.SwapMapper;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.service.ExpiryReconciler;
import com.nosota.xswap.service.RefundEngine;
import com.nosota.xswap.service.RefundQuote;
import com.nosota.xswap.service.SagaExecutor;
import com.nosota.xswap.service.SwapLedger;
import com.nosota.xswap.service.SwapStatisticService;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the swap coordinator.
 *
 * <p>Implements {@link SwapApi} interface for:
 * <ul>
 *   <li>Swap creation and queries (ledger)</li>
 *   <li>Saga steps (executor)</li>
 *   <li>Refunds and expiry sweeps</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SwapController implements SwapApi {

    private final SagaExecutor sagaExecutor;
    private final SwapLedger swapLedger;
    private final RefundEngine refundEngine;
    private final ExpiryReconciler expiryReconciler;
    private final SwapStatisticService swapStatisticService;

    // ==================== Swap Records ====================

    @Override
    public ResponseEntity<SwapResponse> createSwap(CreateSwapRequest request) {
        Swap swap = sagaExecutor.create(
                request.owner(),
                request.direction(),
                request.inputAmount(),
                request.minOutputAmount(),
                request.targetAddress(),
                request.targetDomain(),
                request.deadline());
        return ResponseEntity.status(HttpStatus.CREATED).body(SwapMapper.INSTANCE.toResponse(swap));
    }

    @Override
    public ResponseEntity<SwapResponse> getSwap(Long swapId) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toResponse(swapLedger.getSwap(swapId)));
    }

    @Override
    public ResponseEntity<PagedResponse<SwapResponse>> getSwapsByOwner(String owner, int page, int size) {
        Page<Swap> swaps = swapLedger.getSwapsByOwner(owner, page, size);

        PagedResponse<SwapResponse> response = new PagedResponse<>(
                SwapMapper.INSTANCE.toResponseList(swaps.getContent()),
                swaps.getNumber(),
                swaps.getSize(),
                swaps.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<SwapResponse> getSwapByAttestation(String attestationRef) {
        Swap swap = swapLedger.findByAttestationRef(attestationRef)
                .orElseThrow(() -> new EntityNotFoundException("No swap with attestation " + attestationRef));
        return ResponseEntity.ok(SwapMapper.INSTANCE.toResponse(swap));
    }

    @Override
    public ResponseEntity<List<SwapTransitionDTO>> getTransitions(Long swapId) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toDTOList(swapLedger.getTransitions(swapId)));
    }

    // ==================== Saga Steps ====================

    @Override
    public ResponseEntity<SwapResponse> runSwap(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        sagaExecutor.runAsync(swapId);
        log.info("Saga run submitted: swapId={}, state={}", swapId, swap.getState());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SwapMapper.INSTANCE.toResponse(swap));
    }

    @Override
    public ResponseEntity<StepResponse> sourceExchange(Long swapId) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toStepResponse(sagaExecutor.sourceExchange(swapId)));
    }

    @Override
    public ResponseEntity<StepResponse> bridgeSend(Long swapId, BridgeSendRequest request) {
        Long relayerFee = request != null ? request.relayerFee() : null;
        Long nativeDropOff = request != null ? request.nativeDropOff() : null;
        return ResponseEntity.ok(SwapMapper.INSTANCE.toStepResponse(
                sagaExecutor.bridgeSend(swapId, relayerFee, nativeDropOff)));
    }

    @Override
    public ResponseEntity<StepResponse> confirmBridge(Long swapId) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toStepResponse(sagaExecutor.confirmBridge(swapId)));
    }

    @Override
    public ResponseEntity<StepResponse> executeDestination(Long swapId) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toStepResponse(sagaExecutor.executeDestination(swapId)));
    }

    @Override
    public ResponseEntity<StepResponse> destinationComplete(Long swapId, DestinationCompleteRequest request) {
        return ResponseEntity.ok(SwapMapper.INSTANCE.toStepResponse(
                sagaExecutor.destinationComplete(swapId, request.finalAmount(), request.failureReason())));
    }

    // ==================== Refunds & Expiry ====================

    @Override
    public ResponseEntity<RefundQuoteResponse> getRefundQuote(Long swapId) {
        Swap swap = swapLedger.getSwap(swapId);
        boolean refundable = refundEngine.isRefundable(swap);
        RefundQuote quote = refundEngine.computeRefund(swap);

        RefundQuoteResponse response = new RefundQuoteResponse(
                swapId,
                refundable,
                refundable ? quote.refundAmount() : null,
                refundable ? quote.feeAmount() : null
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<RefundResponse> refund(Long swapId, String caller) throws Exception {
        Swap swap = refundEngine.refund(swapId, caller);
        return ResponseEntity.ok(SwapMapper.INSTANCE.toRefundResponse(swap));
    }

    @Override
    public ResponseEntity<SweepResponse> sweep(SweepRequest request) {
        List<Long> expired = expiryReconciler.sweep(request.swapIds());
        return ResponseEntity.ok(new SweepResponse(request.swapIds().size(), expired));
    }

    @Override
    public ResponseEntity<SwapStatisticsResponse> getStatistics() {
        return ResponseEntity.ok(swapStatisticService.getStatistics());
    }
}
