package com.atomicswap.exception;

import java.util.Map;

public class InsufficientSafetyDepositException extends BaseException {

    public InsufficientSafetyDepositException(Long orderId, String address, long required) {
        super(
                ErrorCode.INSUFFICIENT_SAFETY_DEPOSIT,
                String.format("%s has no safety deposit of at least %d on order %d", address, required, orderId),
                Map.of("orderId", orderId, "address", address, "required", required));
    }
}
