package com.nosota.xswap.gateway.http;

import com.nosota.xswap.error.BridgeTransportException;
import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.gateway.AttestationProof;
import com.nosota.xswap.gateway.AttestationStatus;
import com.nosota.xswap.gateway.BridgeTransfer;
import com.nosota.xswap.gateway.BridgeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.time.Duration;

/**
 * WebClient-based bridge transport and attestation service.
 *
 * <ul>
 *   <li>{@code POST /transfers} → {@code {"handle": ...}}</li>
 *   <li>{@code GET /transfers/{handle}/attestation} → {@code {"status": READY|PENDING|FAILED, ...}}, 404 while unknown</li>
 *   <li>{@code POST /transfers/{nonce}/recall}</li>
 * </ul>
 *
 * <p>A failed send reports {@code fundsMoved} from the transport's error body when present.
 * Without it, a refused connection or a 4xx means nothing left custody; anything else is
 * treated as possibly moved.
 *
 * <p>Attestation lookups use their own, usually shorter, timeout so that an abandoned poll
 * releases its thread about when the waiter gives up on it.
 */
@Slf4j
public class HttpBridgeTransport implements BridgeTransport {

    private final WebClient webClient;
    private final Duration timeout;
    private final Duration attestationTimeout;

    public HttpBridgeTransport(WebClient webClient, Duration timeout) {
        this(webClient, timeout, timeout);
    }

    public HttpBridgeTransport(WebClient webClient, Duration timeout, Duration attestationTimeout) {
        this.webClient = webClient;
        this.timeout = timeout;
        this.attestationTimeout = attestationTimeout;
    }

    public record TransferReceipt(String handle) {
    }

    public record TransferError(String message, Boolean fundsMoved) {
    }

    public record AttestationPayload(String status, String attestationRef, String message, String signature,
                              String detail) {
    }

    @Override
    public String send(BridgeTransfer transfer) throws BridgeTransportException {
        log.debug("Calling bridge send: nonce={}, amount={} {}, destDomain={}",
                transfer.nonce(), transfer.amount(), transfer.asset(), transfer.destDomain());

        try {
            TransferReceipt receipt = webClient.post()
                    .uri("/transfers")
                    .header(CollaboratorClientConfig.IDEMPOTENCY_KEY_HEADER, transfer.nonce())
                    .bodyValue(transfer)
                    .retrieve()
                    .bodyToMono(TransferReceipt.class)
                    .timeout(timeout)
                    .block();
            // An accepted transfer without a handle is reported as a blank handle
            return receipt != null ? receipt.handle() : null;
        } catch (WebClientResponseException e) {
            TransferError error = readError(e);
            boolean fundsMoved = error != null && error.fundsMoved() != null
                    ? error.fundsMoved()
                    : !e.getStatusCode().is4xxClientError();
            String message = error != null && error.message() != null ? error.message() : e.getResponseBodyAsString();
            throw new BridgeTransportException(
                    "Bridge rejected transfer (" + e.getStatusCode().value() + "): " + message, fundsMoved, e);
        } catch (WebClientRequestException e) {
            boolean fundsMoved = !(e.getRootCause() instanceof ConnectException);
            throw new BridgeTransportException("Bridge unavailable: " + e.getMessage(), fundsMoved, e);
        } catch (RuntimeException e) {
            // Timed out after the request was sent
            throw new BridgeTransportException("Bridge send did not complete: " + e.getMessage(), true, e);
        }
    }

    @Override
    public AttestationStatus fetchAttestation(String handle) throws CollaboratorFailureException {
        try {
            AttestationPayload payload = webClient.get()
                    .uri("/transfers/{handle}/attestation", handle)
                    .retrieve()
                    .bodyToMono(AttestationPayload.class)
                    .timeout(attestationTimeout)
                    .block();
            if (payload == null || payload.status() == null) {
                return AttestationStatus.pending();
            }
            return switch (payload.status()) {
                case "READY" -> AttestationStatus.ready(
                        new AttestationProof(payload.attestationRef(), payload.message(), payload.signature()));
                case "FAILED" -> AttestationStatus.failed(payload.detail());
                default -> AttestationStatus.pending();
            };
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return AttestationStatus.pending();
            }
            throw new CollaboratorFailureException(
                    "Attestation service error (" + e.getStatusCode().value() + ")", e);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Attestation service unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void recall(String nonce) throws CollaboratorFailureException {
        log.info("Calling bridge recall: nonce={}", nonce);

        try {
            webClient.post()
                    .uri("/transfers/{nonce}/recall", nonce)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new CollaboratorFailureException(
                    "Recall rejected (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Recall failed: " + e.getMessage(), e);
        }
    }

    private TransferError readError(WebClientResponseException e) {
        try {
            return e.getResponseBodyAs(TransferError.class);
        } catch (RuntimeException decodeError) {
            log.debug("Bridge error body is not a transfer error: {}", decodeError.getMessage());
            return null;
        }
    }
}
