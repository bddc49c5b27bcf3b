package com.atomicswap.crosschain;

/**
 * Outbound half of the cross-chain transport. {@link #send} must return without waiting
 * for delivery; the outcome arrives later through the acknowledgement endpoint, at least once.
 */
public interface CrossChainMessenger {

    /**
     * @throws com.atomicswap.exception.MessagingException if the packet could not be queued
     */
    void send(OutboundPacket packet);
}
