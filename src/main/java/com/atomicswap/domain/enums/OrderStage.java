package com.atomicswap.domain.enums;

/**
 * Time-derived resolution stage of an order.
 *
 * <p>Single-timelock orders only ever see OPEN and EXPIRED. Staged orders walk
 * PENDING through PUBLIC_CANCELLATION; the interval after finality is FINALIZED instead of
 * TAKER_EXCLUSIVE when the order names no taker.
 */
public enum OrderStage {
    OPEN,
    EXPIRED,
    PENDING,
    FINALIZED,
    TAKER_EXCLUSIVE,
    PRIVATE_RESOLVER,
    PUBLIC_RESOLVER,
    PRIVATE_CANCELLATION,
    PUBLIC_CANCELLATION;

    public boolean isCancellationStage() {
        return this == EXPIRED || this == PRIVATE_CANCELLATION || this == PUBLIC_CANCELLATION;
    }
}
