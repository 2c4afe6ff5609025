package com.nosota.xswap.gateway;

/**
 * Signed proof that a bridge transfer happened.
 *
 * @param attestationRef  Correlation key of the attestation (message hash)
 * @param message         Attested message bytes, hex encoded
 * @param signature       Validator signatures, hex encoded
 */
public record AttestationProof(
        String attestationRef,
        String message,
        String signature
) {

    /**
     * A proof is usable only when all three parts are present.
     */
    public boolean isComplete() {
        return attestationRef != null && !attestationRef.isBlank()
                && message != null && !message.isBlank()
                && signature != null && !signature.isBlank();
    }
}
