package com.nosota.xswap.gateway;

import com.nosota.xswap.error.BridgeTransportException;
import com.nosota.xswap.error.CollaboratorFailureException;

/**
 * Message-passing transport that moves the bridge asset between chains
 * and the attestation service that certifies the transfer.
 */
public interface BridgeTransport {

    /**
     * Burns/locks the asset on the source chain and returns the transfer handle.
     *
     * @param transfer Transfer parameters
     * @return Handle used to fetch the attestation
     * @throws BridgeTransportException if the send failed; {@code fundsMoved} tells whether custody was already left
     */
    String send(BridgeTransfer transfer) throws BridgeTransportException;

    /**
     * Polls the attestation service once.
     *
     * @param handle Transfer handle
     * @return READY with proof, PENDING, or FAILED when the transfer can never be attested
     * @throws CollaboratorFailureException on transport errors (treated as a pending attempt)
     */
    AttestationStatus fetchAttestation(String handle) throws CollaboratorFailureException;

    /**
     * Compensating transfer: returns funds of a send that failed mid-flight back into coordinator custody.
     *
     * @param nonce Nonce of the failed send
     * @throws CollaboratorFailureException if the funds cannot be recalled
     */
    void recall(String nonce) throws CollaboratorFailureException;
}
