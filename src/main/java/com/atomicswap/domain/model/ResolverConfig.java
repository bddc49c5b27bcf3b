package com.atomicswap.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Global resolver registration. Priority and fee discount are advisory; only
 * {@code enabled} gates authorization.
 */
@Data
@Builder
public class ResolverConfig {

    private String address;
    private int priority;
    private int feeDiscountBps;
    private boolean enabled;
    private long updatedAt;
}
