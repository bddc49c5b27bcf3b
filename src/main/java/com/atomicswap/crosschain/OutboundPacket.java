package com.atomicswap.crosschain;

import lombok.Builder;
import lombok.Value;

/**
 * Settlement packet for the destination chain. The sequence is the correlation key the
 * messaging layer echoes back in its acknowledgement.
 */
@Value
@Builder
public class OutboundPacket {

    long sequence;
    Long orderId;
    String channel;
    String destinationChainId;
    String recipient;
    String token;
    long amount;
    String hashlock;
    String secret;
    long timeoutAt;
}
