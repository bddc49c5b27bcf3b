package com.atomicswap.domain.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EngineStats {

    private long totalOrders;
    private long openOrders;
    private long completedOrders;
    private long cancelledOrders;
    private long failedOrders;

    /** Sum of totalAmount over all orders, across assets. */
    private long totalVolume;
}
