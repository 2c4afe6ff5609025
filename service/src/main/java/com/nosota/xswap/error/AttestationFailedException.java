package com.nosota.xswap.error;

public class AttestationFailedException extends Exception {
    public AttestationFailedException() {
    }

    public AttestationFailedException(String message) {
        super(message);
    }

    public AttestationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public AttestationFailedException(Throwable cause) {
        super(cause);
    }
}
