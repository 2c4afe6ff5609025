package com.nosota.xswap.api.response;

import java.util.List;

/**
 * Result of an expiry sweep.
 *
 * @param checked  Number of swaps examined
 * @param expired  Ids of swaps moved to EXPIRED by this sweep
 */
public record SweepResponse(
        int checked,
        List<Long> expired
) {
}
