package com.nosota.xswap.error;

import lombok.Getter;

/**
 * No attestation arrived within the overall timeout, or the swap deadline passed while waiting.
 */
@Getter
public class AttestationTimeoutException extends Exception {

    private final boolean deadlineReached;

    public AttestationTimeoutException(String message, boolean deadlineReached) {
        super(message);
        this.deadlineReached = deadlineReached;
    }
}
