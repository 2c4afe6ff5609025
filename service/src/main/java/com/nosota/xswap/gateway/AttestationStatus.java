package com.nosota.xswap.gateway;

/**
 * Answer of one attestation poll.
 *
 * @param kind    READY, PENDING or FAILED
 * @param proof   Proof, present only for READY
 * @param detail  Diagnostic text from the attestation service
 */
public record AttestationStatus(
        Kind kind,
        AttestationProof proof,
        String detail
) {

    public enum Kind {
        READY,
        PENDING,
        FAILED
    }

    public static AttestationStatus ready(AttestationProof proof) {
        return new AttestationStatus(Kind.READY, proof, null);
    }

    public static AttestationStatus pending() {
        return new AttestationStatus(Kind.PENDING, null, null);
    }

    public static AttestationStatus failed(String detail) {
        return new AttestationStatus(Kind.FAILED, null, detail);
    }
}
