package com.atomicswap.domain.model;

import com.atomicswap.domain.enums.FillStatus;
import lombok.Builder;
import lombok.Data;

/**
 * One filler's commitment against part of an order. The order's filledAmount is the sum
 * of its non-refunded fills.
 */
@Data
@Builder
public class Fill {

    private Long id;
    private Long orderId;
    private String filler;
    private long amount;
    private FillStatus status;

    /** Only set when fills carry their own hashlock. */
    private String hashlock;

    private String secret;
    private long createdAt;
    private Long settledAt;
    private Long version;
}
