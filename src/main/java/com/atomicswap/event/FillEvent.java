package com.atomicswap.event;

import com.atomicswap.domain.model.Fill;
import org.springframework.context.ApplicationEvent;

public class FillEvent extends ApplicationEvent {

    private final Fill fill;
    private final FillEventType eventType;

    public FillEvent(Object source, Fill fill, FillEventType eventType) {
        super(source);
        this.fill = fill;
        this.eventType = eventType;
    }

    public Fill getFill() {
        return fill;
    }

    public FillEventType getEventType() {
        return eventType;
    }
}
