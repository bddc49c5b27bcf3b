package com.atomicswap.domain.enums;

public enum TimelockMode {
    /** One expiry boundary: receiver withdraws before it, sender refunds after it. */
    SINGLE,
    /** Five boundaries: finality, taker deadline, public deadline, cancellation start, public cancellation. */
    STAGED
}
