package com.nosota.xswap.error;

public class RefundIneligibleException extends Exception {
    public RefundIneligibleException() {
    }

    public RefundIneligibleException(String message) {
        super(message);
    }

    public RefundIneligibleException(String message, Throwable cause) {
        super(message, cause);
    }

    public RefundIneligibleException(Throwable cause) {
        super(cause);
    }
}
