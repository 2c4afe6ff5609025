package com.nosota.xswap.api.request;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Reports the outcome of the destination-side action executed outside the coordinator.
 *
 * @param finalAmount    Amount delivered to the target address, required unless {@code failureReason} is set
 * @param failureReason  Destination-side error, or null on success
 */
public record DestinationCompleteRequest(
        @PositiveOrZero(message = "Final amount must not be negative")
        Long finalAmount,

        String failureReason
) {
}
