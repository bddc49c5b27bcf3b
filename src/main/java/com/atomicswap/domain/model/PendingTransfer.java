package com.atomicswap.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * An in-flight cross-chain settlement leg, keyed by the sequence number handed to the
 * messaging layer. Discarded once the leg is acknowledged either way.
 */
@Data
@Builder
public class PendingTransfer {

    private Long sequence;
    private Long orderId;
    private String destinationChainId;
    private String channel;
    private String destinationRecipient;
    private String destinationToken;
    private long amount;
    private long payout;
    private long fee;
    private String feeRecipient;
    private String settler;
    private long initiatedAt;
    private long timeoutAt;
}
