package com.nosota.xswap.gateway;

/**
 * Cross-chain transfer handed to the bridge transport.
 *
 * @param asset          Bridged asset
 * @param amount         Amount leaving coordinator custody
 * @param destDomain     Destination bridge domain
 * @param destAddress    Recipient on the destination chain
 * @param nonce          Deterministic per-swap nonce; the transport sends a given nonce at most once
 * @param relayerFee     Fee for the destination relayer
 * @param nativeDropOff  Destination gas token requested for the recipient
 */
public record BridgeTransfer(
        String asset,
        long amount,
        int destDomain,
        String destAddress,
        String nonce,
        long relayerFee,
        long nativeDropOff
) {
}
