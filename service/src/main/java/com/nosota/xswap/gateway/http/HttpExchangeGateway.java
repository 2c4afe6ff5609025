package com.nosota.xswap.gateway.http;

import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.gateway.ExchangeGateway;
import com.nosota.xswap.gateway.ExchangeOrder;
import com.nosota.xswap.gateway.ExchangeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * WebClient-based exchange collaborator.
 *
 * <p>{@code POST /exchanges} with the order as body and its key in the {@code Idempotency-Key} header.
 */
@RequiredArgsConstructor
@Slf4j
public class HttpExchangeGateway implements ExchangeGateway {

    private final WebClient webClient;
    private final Duration timeout;

    @Override
    public ExchangeResult exchange(ExchangeOrder order) throws CollaboratorFailureException {
        log.debug("Calling exchange: swapId={}, {} {} → {}, minOut={}",
                order.swapId(), order.amountIn(), order.sourceAsset(), order.destAsset(), order.minAmountOut());

        try {
            ExchangeResult result = webClient.post()
                    .uri("/exchanges")
                    .header(CollaboratorClientConfig.IDEMPOTENCY_KEY_HEADER, order.idempotencyKey())
                    .bodyValue(order)
                    .retrieve()
                    .bodyToMono(ExchangeResult.class)
                    .timeout(timeout)
                    .block();
            if (result == null) {
                throw new CollaboratorFailureException("Exchange returned an empty response");
            }
            return result;
        } catch (WebClientResponseException e) {
            throw new CollaboratorFailureException(
                    "Exchange rejected order (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Exchange unavailable: " + e.getMessage(), e);
        }
    }
}
