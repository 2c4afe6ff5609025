package com.nosota.xswap.service;

import java.util.regex.Pattern;

/**
 * Static description of one side of the swap route.
 *
 * @param name           Chain name (ethereum, sui)
 * @param domain         Bridge domain id of the chain
 * @param nativeAsset    Asset the user holds or receives on this chain
 * @param addressPattern Well-formed recipient address on this chain
 */
public record ChainProfile(
        String name,
        int domain,
        String nativeAsset,
        Pattern addressPattern
) {

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return addressPattern.matcher(address.trim()).matches();
    }
}
