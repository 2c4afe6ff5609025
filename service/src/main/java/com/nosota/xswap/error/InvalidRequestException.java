package com.nosota.xswap.error;

/**
 * Bad swap request, rejected before any record exists.
 */
public class InvalidRequestException extends IllegalArgumentException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
