package com.atomicswap.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    ORDER_STATE_CONFLICT("ORDER_STATE_CONFLICT", 409),
    TIMELOCK_EXPIRED("TIMELOCK_EXPIRED", 409),
    TIMELOCK_NOT_EXPIRED("TIMELOCK_NOT_EXPIRED", 409),
    INVALID_SECRET("INVALID_SECRET", 422),
    INSUFFICIENT_SAFETY_DEPOSIT("INSUFFICIENT_SAFETY_DEPOSIT", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    LEDGER_ERROR("LEDGER_ERROR", 502),
    MESSAGING_ERROR("MESSAGING_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
