package com.atomicswap.domain.enums;

public enum FillStatus {
    PENDING,
    COMPLETED,
    REFUNDED
}
