package com.atomicswap.domain.enums;

/**
 * Why the engine asked the ledger to move funds. Every emitted transfer carries one.
 */
public enum TransferReason {
    PAYOUT,
    RESOLVER_FEE,
    TREASURY_FEE,
    FILL_PAYOUT,
    FILL_REFUND,
    ORDER_REFUND,
    DEPOSIT_RETURN
}
