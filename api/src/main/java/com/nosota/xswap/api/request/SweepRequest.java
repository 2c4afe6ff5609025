package com.nosota.xswap.api.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Swap ids to check for expiry.
 */
public record SweepRequest(
        @NotEmpty(message = "At least one swap id is required")
        List<Long> swapIds
) {
}
