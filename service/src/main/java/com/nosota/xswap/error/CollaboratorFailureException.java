package com.nosota.xswap.error;

public class CollaboratorFailureException extends Exception {
    public CollaboratorFailureException() {
    }

    public CollaboratorFailureException(String message) {
        super(message);
    }

    public CollaboratorFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public CollaboratorFailureException(Throwable cause) {
        super(cause);
    }
}
