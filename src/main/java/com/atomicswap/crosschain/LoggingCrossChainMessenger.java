package com.atomicswap.crosschain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default messenger for deployments where a relayer tails the engine's logs and pending
 * transfers. It only records the packet.
 */
@Component
public class LoggingCrossChainMessenger implements CrossChainMessenger {

    private static final Logger log = LoggerFactory.getLogger(LoggingCrossChainMessenger.class);

    @Override
    public void send(OutboundPacket packet) {
        log.info(
                "Outbound packet queued: sequence={}, orderId={}, channel={}, chain={}, recipient={}, amount={} {},"
                        + " timeoutAt={}",
                packet.getSequence(),
                packet.getOrderId(),
                packet.getChannel(),
                packet.getDestinationChainId(),
                packet.getRecipient(),
                packet.getAmount(),
                packet.getToken(),
                packet.getTimeoutAt());
    }
}
