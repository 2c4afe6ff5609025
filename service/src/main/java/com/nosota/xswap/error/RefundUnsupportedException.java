package com.nosota.xswap.error;

public class RefundUnsupportedException extends Exception {
    public RefundUnsupportedException() {
    }

    public RefundUnsupportedException(String message) {
        super(message);
    }

    public RefundUnsupportedException(String message, Throwable cause) {
        super(message, cause);
    }

    public RefundUnsupportedException(Throwable cause) {
        super(cause);
    }
}
