package com.atomicswap.domain.enums;

public enum AckOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
