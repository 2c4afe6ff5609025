package com.nosota.xswap.gateway.http;

import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.gateway.CustodyGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * WebClient-based custody: {@code POST /releases} pays out to an owner,
 * {@code POST /fees} moves a fee to the fee collector.
 */
@RequiredArgsConstructor
@Slf4j
public class HttpCustodyGateway implements CustodyGateway {

    private final WebClient webClient;
    private final Duration timeout;

    public record CustodyTransfer(Long swapId, String recipient, String asset, long amount) {
    }

    @Override
    public void release(Long swapId, String recipient, String asset, long amount, String idempotencyKey)
            throws CollaboratorFailureException {
        log.debug("Calling custody release: swapId={}, recipient={}, amount={} {}", swapId, recipient, amount, asset);
        post("/releases", new CustodyTransfer(swapId, recipient, asset, amount), idempotencyKey);
    }

    @Override
    public void collectFee(Long swapId, String asset, long amount, String idempotencyKey)
            throws CollaboratorFailureException {
        log.debug("Calling custody fee collection: swapId={}, amount={} {}", swapId, amount, asset);
        post("/fees", new CustodyTransfer(swapId, null, asset, amount), idempotencyKey);
    }

    private void post(String uri, CustodyTransfer body, String idempotencyKey) throws CollaboratorFailureException {
        try {
            webClient.post()
                    .uri(uri)
                    .header(CollaboratorClientConfig.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new CollaboratorFailureException(
                    "Custody rejected " + uri + " (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Custody unavailable: " + e.getMessage(), e);
        }
    }
}
