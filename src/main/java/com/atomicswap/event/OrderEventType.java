package com.atomicswap.event;

/**
 * Classifies the change that triggered an {@link OrderEvent}.
 */
public enum OrderEventType {

    CREATED,

    /** Clock moved the order into a new resolution stage; status is unchanged. */
    STAGE_CHANGED,

    PARTIALLY_FILLED,

    /** Remaining amount reached zero; fills still await the secret. */
    FULLY_FILLED,

    /** Cross-chain leg handed to the messaging layer; order awaits its acknowledgement. */
    SETTLEMENT_INITIATED,

    COMPLETED,

    CANCELLED,

    /** Cross-chain leg failed or timed out; the sender may refund. */
    FAILED
}
