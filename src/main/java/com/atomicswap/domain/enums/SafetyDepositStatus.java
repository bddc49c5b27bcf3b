package com.atomicswap.domain.enums;

public enum SafetyDepositStatus {
    HELD,
    RETURNED
}
