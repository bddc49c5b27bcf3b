package com.atomicswap.htlc;

import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AckResult {

    long sequence;
    AckOutcome outcome;

    /** False for redeliveries and unknown sequences. */
    boolean applied;

    Long orderId;
    OrderStatus orderStatus;
}
