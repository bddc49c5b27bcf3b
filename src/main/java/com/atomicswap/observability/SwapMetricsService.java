package com.atomicswap.observability;

import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.event.AckEvent;
import com.atomicswap.event.FillEvent;
import com.atomicswap.event.FillEventType;
import com.atomicswap.event.OrderEvent;
import com.atomicswap.repository.jpa.SwapOrderJpaRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the settlement engine.
 *
 * <p>Counters: swaps.orders.created, swaps.orders.completed, swaps.orders.cancelled,
 * swaps.orders.failed, swaps.fills.created, swaps.acks.duplicate.
 * Gauge: swaps.orders.open, evaluated against the status index on scrape.
 */
@Service
public class SwapMetricsService {

    private final Counter ordersCreatedCounter;
    private final Counter ordersCompletedCounter;
    private final Counter ordersCancelledCounter;
    private final Counter ordersFailedCounter;
    private final Counter fillsCreatedCounter;
    private final Counter duplicateAcksCounter;

    public SwapMetricsService(MeterRegistry meterRegistry, SwapOrderJpaRepository swapOrderJpaRepository) {
        this.ordersCreatedCounter = Counter.builder("swaps.orders.created")
                .description("Swap orders accepted")
                .register(meterRegistry);
        this.ordersCompletedCounter = Counter.builder("swaps.orders.completed")
                .description("Swap orders settled against their secret")
                .register(meterRegistry);
        this.ordersCancelledCounter = Counter.builder("swaps.orders.cancelled")
                .description("Swap orders refunded to the sender")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("swaps.orders.failed")
                .description("Cross-chain settlements that failed or timed out")
                .register(meterRegistry);
        this.fillsCreatedCounter = Counter.builder("swaps.fills.created")
                .description("Partial fills committed")
                .register(meterRegistry);
        this.duplicateAcksCounter = Counter.builder("swaps.acks.duplicate")
                .description("Acknowledgements ignored as redeliveries or unknown sequences")
                .register(meterRegistry);

        meterRegistry.gauge(
                "swaps.orders.open",
                swapOrderJpaRepository,
                repository -> repository.countByStatusIn(OrderStatus.openStatuses()));
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case CREATED -> ordersCreatedCounter.increment();
            case COMPLETED -> ordersCompletedCounter.increment();
            case CANCELLED -> ordersCancelledCounter.increment();
            case FAILED -> ordersFailedCounter.increment();
            default -> {
                // stage and fill transitions are not counted
            }
        }
    }

    @EventListener
    @Order(20)
    public void onFillEvent(FillEvent event) {
        if (event.getEventType() == FillEventType.CREATED) {
            fillsCreatedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onAckEvent(AckEvent event) {
        if (!event.isApplied()) {
            duplicateAcksCounter.increment();
        }
    }
}
