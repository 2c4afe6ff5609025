package com.nosota.xswap.api.response;

import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.api.model.SwapState;

import java.time.LocalDateTime;

/**
 * Response DTO describing the full swap record.
 *
 * @param id                  Swap id
 * @param owner               Principal who created the swap
 * @param direction           A_TO_B or B_TO_A
 * @param state               Current lifecycle state
 * @param sourceAsset         Asset debited on the source chain
 * @param intermediateAsset   Asset moved over the bridge
 * @param destinationAsset    Asset delivered on the destination chain
 * @param inputAmount         Source amount
 * @param intermediateAmount  Bridge asset amount obtained by the source exchange (null before step 1)
 * @param outputAmount        Delivered amount, or refunded amount for REFUNDED swaps
 * @param minOutputAmount     Minimum acceptable destination amount
 * @param targetAddress       Recipient on the destination chain
 * @param targetDomain        Destination bridge domain
 * @param deadline            Absolute expiry timestamp
 * @param bridgeHandle        Transfer handle returned by the bridge transport
 * @param attestationRef      Attestation correlation key
 * @param failureReason       Reason recorded when the swap failed
 * @param stranded            True when bridged funds could not be recovered automatically
 * @param createdAt           Creation timestamp
 * @param updatedAt           Last transition timestamp
 */
public record SwapResponse(
        Long id,
        String owner,
        SwapDirection direction,
        SwapState state,
        String sourceAsset,
        String intermediateAsset,
        String destinationAsset,
        Long inputAmount,
        Long intermediateAmount,
        Long outputAmount,
        Long minOutputAmount,
        String targetAddress,
        Integer targetDomain,
        LocalDateTime deadline,
        String bridgeHandle,
        String attestationRef,
        String failureReason,
        boolean stranded,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
