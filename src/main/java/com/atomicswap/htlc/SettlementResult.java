package com.atomicswap.htlc;

import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.vo.SettlementBreakdown;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a full withdrawal. For cross-chain orders the order is AWAITING_ACK and
 * {@code sequence} identifies the in-flight leg; otherwise the order is COMPLETED.
 */
@Value
@Builder
public class SettlementResult {

    SwapOrder order;
    SettlementBreakdown breakdown;
    Long sequence;
}
