package com.atomicswap.event;

public enum FillEventType {
    CREATED,
    WITHDRAWN,
    REFUNDED
}
