package com.atomicswap.event;

import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.model.SwapOrder;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every state change of a swap order, carrying the order snapshot and the
 * status it left.
 */
public class OrderEvent extends ApplicationEvent {

    private final SwapOrder order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, SwapOrder order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, SwapOrder order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public SwapOrder getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Null for CREATED. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
