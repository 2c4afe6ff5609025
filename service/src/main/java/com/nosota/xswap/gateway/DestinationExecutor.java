package com.nosota.xswap.gateway;

import com.nosota.xswap.error.CollaboratorFailureException;

/**
 * Destination-side collaborator: redeems the attested transfer and delivers the output asset.
 */
public interface DestinationExecutor {

    /**
     * @param swapId       Swap id, used as idempotency key
     * @param proof        Complete attestation proof
     * @param destAddress  Recipient on the destination chain
     * @param asset        Asset to deliver
     * @return Amount delivered
     * @throws CollaboratorFailureException if the destination action failed
     */
    long execute(Long swapId, AttestationProof proof, String destAddress, String asset)
            throws CollaboratorFailureException;
}
