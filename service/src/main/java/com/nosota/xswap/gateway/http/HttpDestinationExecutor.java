package com.nosota.xswap.gateway.http;

import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.gateway.AttestationProof;
import com.nosota.xswap.gateway.DestinationExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * WebClient-based destination executor: {@code POST /redemptions} → {@code {"finalAmount": ...}}.
 */
@RequiredArgsConstructor
@Slf4j
public class HttpDestinationExecutor implements DestinationExecutor {

    private final WebClient webClient;
    private final Duration timeout;

    public record RedemptionRequest(Long swapId, String attestationRef, String message, String signature,
                             String destAddress, String asset) {
    }

    public record RedemptionResult(Long finalAmount) {
    }

    @Override
    public long execute(Long swapId, AttestationProof proof, String destAddress, String asset)
            throws CollaboratorFailureException {
        log.debug("Calling destination redemption: swapId={}, attestationRef={}, asset={}",
                swapId, proof.attestationRef(), asset);

        RedemptionRequest request = new RedemptionRequest(swapId, proof.attestationRef(), proof.message(),
                proof.signature(), destAddress, asset);
        try {
            RedemptionResult result = webClient.post()
                    .uri("/redemptions")
                    .header(CollaboratorClientConfig.IDEMPOTENCY_KEY_HEADER, "swap-" + swapId + "-destination")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(RedemptionResult.class)
                    .timeout(timeout)
                    .block();
            if (result == null || result.finalAmount() == null) {
                throw new CollaboratorFailureException("Destination returned no final amount");
            }
            return result.finalAmount();
        } catch (WebClientResponseException e) {
            throw new CollaboratorFailureException(
                    "Destination rejected redemption (" + e.getStatusCode().value() + "): "
                            + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Destination unavailable: " + e.getMessage(), e);
        }
    }
}
