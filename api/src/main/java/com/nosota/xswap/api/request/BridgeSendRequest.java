package com.nosota.xswap.api.request;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Optional parameters of the bridge-send step.
 *
 * @param relayerFee     Fee paid to the relayer on the destination chain, deducted from the bridged amount
 * @param nativeDropOff  Amount of destination gas token requested for the recipient
 */
public record BridgeSendRequest(
        @PositiveOrZero(message = "Relayer fee must not be negative")
        Long relayerFee,

        @PositiveOrZero(message = "Native drop-off must not be negative")
        Long nativeDropOff
) {
    public static BridgeSendRequest defaults() {
        return new BridgeSendRequest(0L, 0L);
    }
}
