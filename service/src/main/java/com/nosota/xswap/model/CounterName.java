package com.nosota.xswap.model;

public enum CounterName {
    FEE_COLLECTOR_BALANCE,
    COMPLETED_VOLUME,
    COMPLETED_SWAPS,
    REFUNDED_VOLUME,
    REFUNDED_SWAPS
}
