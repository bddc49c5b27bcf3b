package com.atomicswap.exception;

import java.util.Map;

/**
 * The order (or fill) is in a state that does not allow the requested action: already terminal,
 * awaiting an acknowledgement, or on the wrong side of its timelock.
 */
public class OrderStateException extends BaseException {

    public OrderStateException(String message) {
        super(ErrorCode.ORDER_STATE_CONFLICT, message);
    }

    public OrderStateException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static OrderStateException timelockExpired(Long orderId) {
        return new OrderStateException(
                ErrorCode.TIMELOCK_EXPIRED, "Timelock expired for order " + orderId, Map.of("orderId", orderId));
    }

    public static OrderStateException timelockNotExpired(Long orderId) {
        return new OrderStateException(
                ErrorCode.TIMELOCK_NOT_EXPIRED,
                "Timelock not yet expired for order " + orderId,
                Map.of("orderId", orderId));
    }
}
