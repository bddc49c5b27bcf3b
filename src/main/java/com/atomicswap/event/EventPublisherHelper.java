package com.atomicswap.event;

import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.model.Fill;
import com.atomicswap.domain.model.SwapOrder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for swap events.
 *
 * <p>Listeners are synchronous {@code @EventListener}s, so they run inside the publishing
 * operation's transaction.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderCreated(Object source, SwapOrder order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CREATED));
    }

    public void publishOrderEvent(Object source, SwapOrder order, OrderEventType eventType, OrderStatus previous) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previous));
    }

    public void publishStageChanged(Object source, SwapOrder order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.STAGE_CHANGED, order.getStatus()));
    }

    // ---- Fill ----

    public void publishFillEvent(Object source, Fill fill, FillEventType eventType) {
        applicationEventPublisher.publishEvent(new FillEvent(source, fill, eventType));
    }

    // ---- Acknowledgement ----

    public void publishAck(Object source, long sequence, AckOutcome outcome, boolean applied) {
        applicationEventPublisher.publishEvent(new AckEvent(source, sequence, outcome, applied));
    }
}
