package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapDirection;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * The two chains connected by the coordinator and the asset bridged between them.
 *
 * <p>Configuration:
 * <pre>
 * swap:
 *   bridge-asset: USDC
 *   chains:
 *     a: { name: ethereum, domain: 0, native-asset: ETH, address-pattern: "^0x[0-9a-fA-F]{40}$" }
 *     b: { name: sui,      domain: 8, native-asset: SUI, address-pattern: "^0x[0-9a-fA-F]{64}$" }
 * </pre>
 */
@Component
public class ChainRegistry {

    private final ChainProfile chainA;
    private final ChainProfile chainB;
    private final String bridgeAsset;

    public ChainRegistry(@Value("${swap.chains.a.name}") String chainAName,
                         @Value("${swap.chains.a.domain}") int chainADomain,
                         @Value("${swap.chains.a.native-asset}") String chainAAsset,
                         @Value("${swap.chains.a.address-pattern}") String chainAAddressPattern,
                         @Value("${swap.chains.b.name}") String chainBName,
                         @Value("${swap.chains.b.domain}") int chainBDomain,
                         @Value("${swap.chains.b.native-asset}") String chainBAsset,
                         @Value("${swap.chains.b.address-pattern}") String chainBAddressPattern,
                         @Value("${swap.bridge-asset}") String bridgeAsset) {
        this(new ChainProfile(chainAName, chainADomain, chainAAsset, Pattern.compile(chainAAddressPattern)),
                new ChainProfile(chainBName, chainBDomain, chainBAsset, Pattern.compile(chainBAddressPattern)),
                bridgeAsset);
    }

    public ChainRegistry(ChainProfile chainA, ChainProfile chainB, String bridgeAsset) {
        this.chainA = chainA;
        this.chainB = chainB;
        this.bridgeAsset = bridgeAsset;
    }

    public ChainProfile source(SwapDirection direction) {
        return direction == SwapDirection.A_TO_B ? chainA : chainB;
    }

    public ChainProfile destination(SwapDirection direction) {
        return direction == SwapDirection.A_TO_B ? chainB : chainA;
    }

    public String bridgeAsset() {
        return bridgeAsset;
    }
}
