package com.atomicswap.domain.enums;

/**
 * Whether fills settle against the order's hashlock or carry their own.
 */
public enum SecretScope {
    ORDER,
    FILL
}
