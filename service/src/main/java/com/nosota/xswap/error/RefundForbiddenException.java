package com.nosota.xswap.error;

public class RefundForbiddenException extends Exception {
    public RefundForbiddenException() {
    }

    public RefundForbiddenException(String message) {
        super(message);
    }

    public RefundForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }

    public RefundForbiddenException(Throwable cause) {
        super(cause);
    }
}
