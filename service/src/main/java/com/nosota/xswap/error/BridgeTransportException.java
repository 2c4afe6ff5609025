package com.nosota.xswap.error;

import lombok.Getter;

/**
 * Bridge send failure. {@code fundsMoved} tells whether the transport had already
 * taken the funds out of coordinator custody when it failed.
 */
@Getter
public class BridgeTransportException extends CollaboratorFailureException {

    private final boolean fundsMoved;

    public BridgeTransportException(String message, boolean fundsMoved) {
        super(message);
        this.fundsMoved = fundsMoved;
    }

    public BridgeTransportException(String message, boolean fundsMoved, Throwable cause) {
        super(message, cause);
        this.fundsMoved = fundsMoved;
    }
}
