package com.nosota.xswap.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.xswap.TestBase;
import com.nosota.xswap.api.SwapApi;
import com.nosota.xswap.api.dto.PagedResponse;
import com.nosota.xswap.api.dto.SwapTransitionDTO;
import com.nosota.xswap.api.model.StepOutcome;
import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.api.request.CreateSwapRequest;
import com.nosota.xswap.api.request.DestinationCompleteRequest;
import com.nosota.xswap.api.request.SweepRequest;
import com.nosota.xswap.api.response.RefundQuoteResponse;
import com.nosota.xswap.api.response.RefundResponse;
import com.nosota.xswap.api.response.StepResponse;
import com.nosota.xswap.api.response.SwapResponse;
import com.nosota.xswap.api.response.SweepResponse;
import com.nosota.xswap.error.BridgeTransportException;
import com.nosota.xswap.gateway.AttestationProof;
import com.nosota.xswap.gateway.AttestationStatus;
import com.nosota.xswap.gateway.BridgeTransfer;
import com.nosota.xswap.gateway.ExchangeResult;
import com.nosota.xswap.model.CounterName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for SwapController via REST API with MockMvc.
 *
 * <p>Collaborators are mocked; ledger, counters and transitions hit PostgreSQL.
 * Each test works with its own owner, so tests do not roll back.
 */
public class SwapControllerTest extends TestBase {

    // ==================== Helpers ====================

    private SwapResponse createViaApi(String owner, long inputAmount, long minOutputAmount,
                                      LocalDateTime deadline) throws Exception {
        CreateSwapRequest request = new CreateSwapRequest(owner, SwapDirection.A_TO_B, inputAmount,
                minOutputAmount, SUI_ADDRESS, SUI_DOMAIN, deadline);

        MvcResult result = mockMvc.perform(post("/api/v1/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), SwapResponse.class);
    }

    private StepResponse step(String path, Long swapId) throws Exception {
        return step(path, swapId, null);
    }

    private StepResponse step(String path, Long swapId, Object body) throws Exception {
        MockHttpServletRequestBuilder request = post("/api/v1/swaps/{swapId}/" + path, swapId).contentType(MediaType.APPLICATION_JSON);
        if (body != null) {
            request.content(objectMapper.writeValueAsString(body));
        }
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), StepResponse.class);
    }

    private ResultActions refund(Long swapId, String caller) throws Exception {
        return mockMvc.perform(post("/api/v1/swaps/{swapId}/refund", swapId)
                .header(SwapApi.CALLER_HEADER, caller)
                .contentType(MediaType.APPLICATION_JSON));
    }

    private void stubBridgeSend() throws Exception {
        when(bridgeTransport.send(any(BridgeTransfer.class)))
                .thenAnswer(invocation -> "handle-" + invocation.<BridgeTransfer>getArgument(0).nonce());
    }

    private static AttestationProof proof(String ref) {
        return new AttestationProof(ref, "0x" + ref + "-message", "0x" + ref + "-signature");
    }

    // ==================== Create & Query ====================

    @Test
    public void createSwap_ShouldReturnInitiatedSwap() throws Exception {
        String owner = newOwner();

        SwapResponse swap = createViaApi(owner, 100L, 90L, now().plusHours(1));

        assertThat(swap.id()).isNotNull();
        assertThat(swap.state()).isEqualTo(SwapState.INITIATED);
        assertThat(swap.owner()).isEqualTo(owner);
        assertThat(swap.sourceAsset()).isEqualTo("ETH");
        assertThat(swap.intermediateAsset()).isEqualTo("USDC");
        assertThat(swap.destinationAsset()).isEqualTo("SUI");
        assertThat(swap.outputAmount()).isNull();

        mockMvc.perform(get("/api/v1/swaps/{swapId}", swap.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("INITIATED"))
                .andExpect(jsonPath("$.targetAddress").value(SUI_ADDRESS));
    }

    @Test
    public void createSwap_WithAddressOfWrongChain_ShouldReturn400() throws Exception {
        CreateSwapRequest request = new CreateSwapRequest(newOwner(), SwapDirection.A_TO_B, 100L, 90L,
                ETH_ADDRESS, SUI_DOMAIN, now().plusHours(1));

        mockMvc.perform(post("/api/v1/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));
    }

    @Test
    public void createSwap_WithNonPositiveAmountOrPastDeadline_ShouldReturn400() throws Exception {
        CreateSwapRequest zeroAmount = new CreateSwapRequest(newOwner(), SwapDirection.A_TO_B, 0L, 90L,
                SUI_ADDRESS, SUI_DOMAIN, now().plusHours(1));
        mockMvc.perform(post("/api/v1/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(zeroAmount)))
                .andExpect(status().isBadRequest());

        CreateSwapRequest pastDeadline = new CreateSwapRequest(newOwner(), SwapDirection.A_TO_B, 100L, 90L,
                SUI_ADDRESS, SUI_DOMAIN, now().minusMinutes(1));
        mockMvc.perform(post("/api/v1/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(pastDeadline)))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void getSwap_WhenNotFound_ShouldReturn404() throws Exception {
        mockMvc.perform(get("/api/v1/swaps/{swapId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound());
    }

    @Test
    public void getSwapsByOwner_ShouldReturnOnlyOwnersSwaps() throws Exception {
        String owner = newOwner();
        createSwap(owner, 100L, 90L);
        createSwap(owner, 200L, 180L);
        createSwap(newOwner(), 300L, 270L);

        MvcResult result = mockMvc.perform(get("/api/v1/swaps/owners/{owner}", owner)
                        .param("page", "0")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andReturn();

        PagedResponse<SwapResponse> page = objectMapper.readValue(result.getResponse().getContentAsString(),
                new TypeReference<>() {});
        assertThat(page.totalElements()).isEqualTo(2);
        assertThat(page.content()).extracting(SwapResponse::owner).containsOnly(owner);
    }

    // ==================== Saga Steps ====================

    /**
     * Scenario A extended to completion: every step through the API, then the audit trail.
     */
    @Test
    public void fullFlow_StepByStep_ShouldComplete() throws Exception {
        String owner = newOwner();
        Long volumeBefore = swapStatisticService.getCounter(CounterName.COMPLETED_VOLUME);
        Long completedBefore = swapStatisticService.getCounter(CounterName.COMPLETED_SWAPS);

        SwapResponse created = createViaApi(owner, 100L, 90L, now().plusHours(1));
        Long swapId = created.id();
        String ref = "ref-full-" + swapId;

        when(exchangeGateway.exchange(any())).thenReturn(new ExchangeResult(98L, "0xexchange"));
        stubBridgeSend();
        when(bridgeTransport.fetchAttestation("handle-swap-" + swapId + "-bridge"))
                .thenReturn(AttestationStatus.ready(proof(ref)));

        StepResponse exchanged = step("source-exchange", swapId);
        assertThat(exchanged.outcome()).isEqualTo(StepOutcome.ADVANCED);
        assertThat(exchanged.state()).isEqualTo(SwapState.SOURCE_EXCHANGE_DONE);
        assertThat(swapLedger.getSwap(swapId).getIntermediateAmount()).isEqualTo(98L);

        StepResponse sent = step("bridge-send", swapId);
        assertThat(sent.state()).isEqualTo(SwapState.BRIDGE_SENT);

        StepResponse confirmed = step("confirm-bridge", swapId);
        assertThat(confirmed.state()).isEqualTo(SwapState.BRIDGE_CONFIRMED);

        StepResponse completed = step("destination-complete", swapId, new DestinationCompleteRequest(95L, null));
        assertThat(completed.outcome()).isEqualTo(StepOutcome.ADVANCED);
        assertThat(completed.state()).isEqualTo(SwapState.COMPLETED);

        // Repeating a finished step is benign
        StepResponse repeated = step("source-exchange", swapId);
        assertThat(repeated.outcome()).isEqualTo(StepOutcome.ALREADY_TRANSITIONED);
        verify(exchangeGateway).exchange(any());

        mockMvc.perform(get("/api/v1/swaps/attestations/{ref}", ref))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.outputAmount").value(95));

        MvcResult transitionsResult = mockMvc.perform(get("/api/v1/swaps/{swapId}/transitions", swapId))
                .andExpect(status().isOk())
                .andReturn();
        List<SwapTransitionDTO> transitions = objectMapper.readValue(
                transitionsResult.getResponse().getContentAsString(), new TypeReference<>() {});
        assertThat(transitions).extracting(SwapTransitionDTO::toState).containsExactly(
                SwapState.INITIATED,
                SwapState.SOURCE_EXCHANGE_DONE,
                SwapState.BRIDGE_SENT,
                SwapState.BRIDGE_CONFIRMED,
                SwapState.COMPLETED);
        assertThat(transitions.get(0).fromState()).isNull();

        assertThat(swapStatisticService.getCounter(CounterName.COMPLETED_VOLUME)).isEqualTo(volumeBefore + 95L);
        assertThat(swapStatisticService.getCounter(CounterName.COMPLETED_SWAPS)).isEqualTo(completedBefore + 1L);

        // Completed swap cannot be refunded
        refund(swapId, owner).andExpect(status().isConflict());
    }

    @Test
    public void stepOutOfOrder_ShouldReturn409() throws Exception {
        SwapResponse created = createViaApi(newOwner(), 100L, 90L, now().plusHours(1));

        mockMvc.perform(post("/api/v1/swaps/{swapId}/confirm-bridge", created.id()))
                .andExpect(status().isConflict());
        verify(bridgeTransport, never()).fetchAttestation(any());
    }

    @Test
    public void destinationBelowMinimum_ShouldFailSwap() throws Exception {
        Long swapId = createSwap(newOwner(), 100L, 90L).getId();
        when(exchangeGateway.exchange(any())).thenReturn(new ExchangeResult(98L, "0xexchange"));
        stubBridgeSend();
        when(bridgeTransport.fetchAttestation(any()))
                .thenReturn(AttestationStatus.ready(proof("ref-min-" + swapId)));
        when(destinationExecutor.execute(eq(swapId), any(), eq(SUI_ADDRESS), eq("SUI"))).thenReturn(89L);

        step("source-exchange", swapId);
        step("bridge-send", swapId);
        step("confirm-bridge", swapId);
        StepResponse result = step("destination-execute", swapId);

        assertThat(result.outcome()).isEqualTo(StepOutcome.FAILED);
        assertThat(result.state()).isEqualTo(SwapState.FAILED);
        assertThat(swapLedger.getSwap(swapId).getOutputAmount()).isNull();
    }

    // ==================== Attestation ====================

    @Test
    public void duplicateAttestation_ShouldBeRejected() throws Exception {
        String owner = newOwner();
        Long first = createSwap(owner, 100L, 90L).getId();
        Long second = createSwap(owner, 100L, 90L).getId();
        String ref = "ref-dup-" + first;

        when(exchangeGateway.exchange(any())).thenReturn(new ExchangeResult(98L, "0xexchange"));
        stubBridgeSend();
        when(bridgeTransport.fetchAttestation(any())).thenReturn(AttestationStatus.ready(proof(ref)));

        for (Long swapId : List.of(first, second)) {
            step("source-exchange", swapId);
            step("bridge-send", swapId);
        }

        assertThat(step("confirm-bridge", first).outcome()).isEqualTo(StepOutcome.ADVANCED);

        StepResponse rejected = step("confirm-bridge", second);
        assertThat(rejected.outcome()).isEqualTo(StepOutcome.REJECTED);
        assertThat(rejected.state()).isEqualTo(SwapState.BRIDGE_SENT);
        assertThat(swapLedger.getSwap(second).getAttestationRef()).isNull();
        assertThat(swapLedger.findByAttestationRef(ref).orElseThrow().getId()).isEqualTo(first);
    }

    /**
     * Scenario E: attestation never arrives, the swap waits in BRIDGE_SENT until its deadline.
     */
    @Test
    public void attestationTimeout_ShouldStayBridgeSentUntilSweep() throws Exception {
        Long swapId = createSwap(newOwner(), 100L, 90L).getId();
        when(exchangeGateway.exchange(any())).thenReturn(new ExchangeResult(98L, "0xexchange"));
        stubBridgeSend();
        when(bridgeTransport.fetchAttestation(any())).thenReturn(AttestationStatus.pending());

        step("source-exchange", swapId);
        step("bridge-send", swapId);
        StepResponse pending = step("confirm-bridge", swapId);

        assertThat(pending.outcome()).isEqualTo(StepOutcome.PENDING);
        assertThat(pending.state()).isEqualTo(SwapState.BRIDGE_SENT);
        assertThat(swapLedger.getSwap(swapId).getStepClaimedAt()).isNull();

        clock.advance(Duration.ofHours(2));
        SweepResponse sweep = sweep(List.of(swapId));

        assertThat(sweep.expired()).containsExactly(swapId);
        assertThat(swapLedger.getSwap(swapId).getState()).isEqualTo(SwapState.EXPIRED);
    }

    // ==================== Failure, Expiry & Refund ====================

    /**
     * Scenario B: bridge send fails before funds moved, refund keeps the fee.
     */
    @Test
    public void bridgeSendFailure_ShouldFailAndRefundWithFee() throws Exception {
        String owner = newOwner();
        Long feeBefore = swapStatisticService.getFeeCollectorBalance();
        Long swapId = createSwap(owner, 100L, 90L).getId();
        when(exchangeGateway.exchange(any())).thenReturn(new ExchangeResult(98L, "0xexchange"));
        when(bridgeTransport.send(any())).thenThrow(new BridgeTransportException("relayer unavailable", false));

        step("source-exchange", swapId);
        StepResponse failed = step("bridge-send", swapId);

        assertThat(failed.outcome()).isEqualTo(StepOutcome.FAILED);
        assertThat(swapLedger.getSwap(swapId).getFailureReason()).contains("relayer unavailable");

        MvcResult quoteResult = mockMvc.perform(get("/api/v1/swaps/{swapId}/refund-quote", swapId))
                .andExpect(status().isOk())
                .andReturn();
        RefundQuoteResponse quote = objectMapper.readValue(quoteResult.getResponse().getContentAsString(),
                RefundQuoteResponse.class);
        assertThat(quote.refundable()).isTrue();
        assertThat(quote.refundAmount()).isEqualTo(99L);
        assertThat(quote.feeAmount()).isEqualTo(1L);

        MvcResult refundResult = refund(swapId, owner)
                .andExpect(status().isOk())
                .andReturn();
        RefundResponse refunded = objectMapper.readValue(refundResult.getResponse().getContentAsString(),
                RefundResponse.class);
        assertThat(refunded.state()).isEqualTo(SwapState.REFUNDED);
        assertThat(refunded.refundAmount()).isEqualTo(99L);
        assertThat(refunded.feeAmount()).isEqualTo(1L);

        verify(custodyGateway).release(eq(swapId), eq(owner), eq("ETH"), eq(99L), eq("swap-" + swapId + "-refund"));
        verify(custodyGateway).collectFee(eq(swapId), eq("ETH"), eq(1L), eq("swap-" + swapId + "-fee"));
        assertThat(swapStatisticService.getFeeCollectorBalance()).isEqualTo(feeBefore + 1L);
    }

    /**
     * Scenario C: abandoned swap is swept to EXPIRED and refunded in full.
     */
    @Test
    public void abandonedSwap_ShouldExpireAndRefundInFull() throws Exception {
        String owner = newOwner();
        SwapResponse created = createViaApi(owner, 100L, 90L, now().plusSeconds(1));

        clock.advance(Duration.ofSeconds(2));
        SweepResponse sweep = sweep(List.of(created.id(), Long.MAX_VALUE));
        assertThat(sweep.checked()).isEqualTo(2);
        assertThat(sweep.expired()).containsExactly(created.id());

        // A second sweep changes nothing
        assertThat(sweep(List.of(created.id())).expired()).isEmpty();

        refund(created.id(), "someone-else")
                .andExpect(status().isForbidden());

        refund(created.id(), owner)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REFUNDED"))
                .andExpect(jsonPath("$.refundAmount").value(100))
                .andExpect(jsonPath("$.feeAmount").value(0));
        verify(custodyGateway, never()).collectFee(any(), any(), anyLong(), any());

        refund(created.id(), owner)
                .andExpect(status().isConflict());    }

    @Test
    public void refundWithoutCallerHeader_ShouldReturn400() throws Exception {
        Long swapId = createSwap(newOwner(), 100L, 90L).getId();

        mockMvc.perform(post("/api/v1/swaps/{swapId}/refund", swapId))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void statistics_ShouldCountSwapsByState() throws Exception {
        createSwap(newOwner(), 100L, 90L);

        mockMvc.perform(get("/api/v1/swaps/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.swapsByState.INITIATED").isNumber())
                .andExpect(jsonPath("$.feeCollectorBalance").isNumber());
    }

    private SweepResponse sweep(List<Long> swapIds) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/swaps/sweep")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SweepRequest(swapIds))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), SweepResponse.class);
    }
}
