package com.nosota.xswap.api.request;

import com.nosota.xswap.api.model.SwapDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

/**
 * Request DTO for creating a swap.
 *
 * @param owner            Principal creating the swap; the only one allowed to refund it
 * @param direction        A_TO_B or B_TO_A
 * @param inputAmount      Amount of the source asset, in minimum currency units
 * @param minOutputAmount  Minimum acceptable amount of the destination asset
 * @param targetAddress    Recipient address on the destination chain
 * @param targetDomain     Bridge domain id of the destination chain
 * @param deadline         Absolute deadline (UTC) after which the swap expires
 */
public record CreateSwapRequest(
        @NotBlank(message = "Owner is required")
        String owner,

        @NotNull(message = "Direction is required")
        SwapDirection direction,

        @NotNull(message = "Input amount is required")
        @Positive(message = "Input amount must be positive")
        Long inputAmount,

        @NotNull(message = "Minimum output amount is required")
        @Positive(message = "Minimum output amount must be positive")
        Long minOutputAmount,

        @NotBlank(message = "Target address is required")
        String targetAddress,

        @NotNull(message = "Target domain is required")
        Integer targetDomain,

        @NotNull(message = "Deadline is required")
        LocalDateTime deadline
) {
}
