package com.nosota.xswap.gateway.http;

import com.nosota.xswap.gateway.BridgeTransport;
import com.nosota.xswap.gateway.CustodyGateway;
import com.nosota.xswap.gateway.DestinationExecutor;
import com.nosota.xswap.gateway.ExchangeGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP clients of the external collaborators.
 *
 * <p>Configuration:
 * <pre>
 * collaborators:
 *   timeout: PT30S
 *   exchange.url: http://exchange:8080
 *   bridge.url: http://bridge:8080         # attestation lookups use attestation.per-attempt-timeout
 *   destination.url: http://destination:8080
 *   custody.url: http://custody:8080
 * </pre>
 */
@Configuration
public class CollaboratorClientConfig {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    @Value("${collaborators.timeout:PT30S}")
    private Duration timeout;

    @Bean
    public ExchangeGateway exchangeGateway(WebClient.Builder builder,
                                           @Value("${collaborators.exchange.url}") String baseUrl) {
        return new HttpExchangeGateway(builder.clone().baseUrl(baseUrl).build(), timeout);
    }

    @Bean
    public BridgeTransport bridgeTransport(WebClient.Builder builder,
                                           @Value("${collaborators.bridge.url}") String baseUrl,
                                           @Value("${attestation.per-attempt-timeout:PT15S}") Duration attestationTimeout) {
        return new HttpBridgeTransport(builder.clone().baseUrl(baseUrl).build(), timeout, attestationTimeout);
    }

    @Bean
    public DestinationExecutor destinationExecutor(WebClient.Builder builder,
                                                   @Value("${collaborators.destination.url}") String baseUrl) {
        return new HttpDestinationExecutor(builder.clone().baseUrl(baseUrl).build(), timeout);
    }

    @Bean
    public CustodyGateway custodyGateway(WebClient.Builder builder,
                                         @Value("${collaborators.custody.url}") String baseUrl) {
        return new HttpCustodyGateway(builder.clone().baseUrl(baseUrl).build(), timeout);
    }
}
