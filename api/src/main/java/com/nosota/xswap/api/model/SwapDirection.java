package com.nosota.xswap.api.model;

/**
 * Direction of a swap between the two supported chains.
 * Fixes which chain is the source and which is the destination.
 */
public enum SwapDirection {
    A_TO_B,
    B_TO_A
}
