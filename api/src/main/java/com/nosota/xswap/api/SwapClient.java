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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of SwapApi for consuming the swap coordinator.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class XswapClientConfig {
 *     @Bean
 *     public WebClient xswapWebClient(WebClient.Builder builder,
 *                                     @Value("${services.xswap.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public SwapClient swapClient(WebClient xswapWebClient) {
 *         return new SwapClient(xswapWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class SwapClient implements SwapApi {

    private final WebClient webClient;

    // ==================== Swap Records ====================

    @Override
    public ResponseEntity<SwapResponse> createSwap(CreateSwapRequest request) {
        log.debug("Calling createSwap: owner={}, direction={}, inputAmount={}",
                request.owner(), request.direction(), request.inputAmount());

        return webClient.post()
                .uri("/api/v1/swaps")
                .bodyValue(request)
                .retrieve()
                .toEntity(SwapResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SwapResponse> getSwap(Long swapId) {
        log.debug("Calling getSwap: swapId={}", swapId);

        return webClient.get()
                .uri("/api/v1/swaps/{swapId}", swapId)
                .retrieve()
                .toEntity(SwapResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<SwapResponse>> getSwapsByOwner(String owner, int page, int size) {
        log.debug("Calling getSwapsByOwner: owner={}, page={}, size={}", owner, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/swaps/owners/{owner}")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(owner))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<SwapResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<SwapResponse> getSwapByAttestation(String attestationRef) {
        log.debug("Calling getSwapByAttestation: attestationRef={}", attestationRef);

        return webClient.get()
                .uri("/api/v1/swaps/attestations/{attestationRef}", attestationRef)
                .retrieve()
                .toEntity(SwapResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<SwapTransitionDTO>> getTransitions(Long swapId) {
        log.debug("Calling getTransitions: swapId={}", swapId);

        return webClient.get()
                .uri("/api/v1/swaps/{swapId}/transitions", swapId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SwapTransitionDTO>>() {})
                .block();
    }

    // ==================== Saga Steps ====================

    @Override
    public ResponseEntity<SwapResponse> runSwap(Long swapId) {
        log.debug("Calling runSwap: swapId={}", swapId);

        return webClient.post()
                .uri("/api/v1/swaps/{swapId}/run", swapId)
                .retrieve()
                .toEntity(SwapResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<StepResponse> sourceExchange(Long swapId) {
        return postStep("/api/v1/swaps/{swapId}/source-exchange", swapId, null);
    }

    @Override
    public ResponseEntity<StepResponse> bridgeSend(Long swapId, BridgeSendRequest request) {
        return postStep("/api/v1/swaps/{swapId}/bridge-send", swapId,
                request != null ? request : BridgeSendRequest.defaults());
    }

    @Override
    public ResponseEntity<StepResponse> confirmBridge(Long swapId) {
        return postStep("/api/v1/swaps/{swapId}/confirm-bridge", swapId, null);
    }

    @Override
    public ResponseEntity<StepResponse> executeDestination(Long swapId) {
        return postStep("/api/v1/swaps/{swapId}/destination-execute", swapId, null);
    }

    @Override
    public ResponseEntity<StepResponse> destinationComplete(Long swapId, DestinationCompleteRequest request) {
        return postStep("/api/v1/swaps/{swapId}/destination-complete", swapId, request);
    }

    // ==================== Refunds & Expiry ====================

    @Override
    public ResponseEntity<RefundQuoteResponse> getRefundQuote(Long swapId) {
        log.debug("Calling getRefundQuote: swapId={}", swapId);

        return webClient.get()
                .uri("/api/v1/swaps/{swapId}/refund-quote", swapId)
                .retrieve()
                .toEntity(RefundQuoteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RefundResponse> refund(Long swapId, String caller) {
        log.debug("Calling refund: swapId={}, caller={}", swapId, caller);

        return webClient.post()
                .uri("/api/v1/swaps/{swapId}/refund", swapId)
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(RefundResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SweepResponse> sweep(SweepRequest request) {
        log.debug("Calling sweep: {} swaps", request.swapIds().size());

        return webClient.post()
                .uri("/api/v1/swaps/sweep")
                .bodyValue(request)
                .retrieve()
                .toEntity(SweepResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SwapStatisticsResponse> getStatistics() {
        return webClient.get()
                .uri("/api/v1/swaps/statistics")
                .retrieve()
                .toEntity(SwapStatisticsResponse.class)
                .block();
    }

    private ResponseEntity<StepResponse> postStep(String uri, Long swapId, Object body) {
        log.debug("Calling step {}: swapId={}", uri, swapId);

        WebClient.RequestBodySpec request = webClient.post().uri(uri, swapId);
        WebClient.RequestHeadersSpec<?> spec = body != null ? request.bodyValue(body) : request;
        return spec.retrieve()
                .toEntity(StepResponse.class)
                .block();
    }
}
