package com.atomicswap.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a swap order. Orthogonal to {@link OrderStage}, which is derived from
 * the clock; status only moves through explicit operations.
 * AWAITING_ACK means a cross-chain settlement leg is in flight and only an acknowledgement
 * can move the order on.
 */
public enum OrderStatus {
    ACTIVE,
    PARTIALLY_FILLED,
    FULLY_FILLED,
    AWAITING_ACK,
    COMPLETED,
    CANCELLED,
    FAILED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<OrderStatus> openStatuses() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }
}
