package com.atomicswap.htlc;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.event.EventPublisherHelper;
import com.atomicswap.event.OrderEventType;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.StageAuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Returns escrowed funds to the sender once an order can no longer settle.
 *
 * <p>Cancellation needs a cancellation-eligible stage (single expiry passed, or a staged
 * cancellation window) and a caller that stage admits. A FAILED order, whose cross-chain
 * leg bounced, is refundable by its sender straight away. An order awaiting an
 * acknowledgement cannot be cancelled until that acknowledgement's deadline passes; after it,
 * cancelling first expires the leg as a TIMEOUT and then refunds like any FAILED order.
 *
 * <p>The refund is the remaining amount: the full amount when no fills were taken. Pending
 * fills keep their reservation and are released through fill refunds.
 */
@Service
public class CancellationHandler {

    private static final Logger log = LoggerFactory.getLogger(CancellationHandler.class);

    private final OrderStore orderStore;
    private final AcknowledgementHandler acknowledgementHandler;
    private final StagePolicy stagePolicy;
    private final SafetyDepositService safetyDepositService;
    private final TransferEmitter transferEmitter;
    private final EventPublisherHelper eventPublisherHelper;

    public CancellationHandler(
            OrderStore orderStore,
            AcknowledgementHandler acknowledgementHandler,
            StagePolicy stagePolicy,
            SafetyDepositService safetyDepositService,
            TransferEmitter transferEmitter,
            EventPublisherHelper eventPublisherHelper) {
        this.orderStore = orderStore;
        this.acknowledgementHandler = acknowledgementHandler;
        this.stagePolicy = stagePolicy;
        this.safetyDepositService = safetyDepositService;
        this.transferEmitter = transferEmitter;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Transactional
    public SwapOrder cancel(Long orderId, String caller) {
        SwapOrder order = orderStore.loadForUpdate(orderId);
        if (acknowledgementHandler.expireIfOverdue(order)) {
            order = orderStore.load(orderId);
        }
        requireCancellable(order);
        OrderStage stage = order.getStage();

        if (order.getStatus() == OrderStatus.FAILED) {
            if (!caller.equals(order.getSender()) && !stagePolicy.canCancel(order, stage, caller)) {
                throw new StageAuthorizationException(orderId, caller, stage, "refund");
            }
        } else {
            if (!stage.isCancellationStage()) {
                throw OrderStateException.timelockNotExpired(orderId);
            }
            if (!stagePolicy.canCancel(order, stage, caller)) {
                throw new StageAuthorizationException(orderId, caller, stage, "cancel");
            }
        }

        long refund = order.getRemainingAmount();
        transferEmitter.emit(order, null, order.getSender(), refund, TransferReason.ORDER_REFUND);
        safetyDepositService.returnHeldDeposits(order);

        OrderStatus previousStatus = order.getStatus();
        order.setStatus(OrderStatus.CANCELLED);
        order.setCancelledBy(caller);
        SwapOrder saved = orderStore.save(order);

        log.info(
                "Order cancelled: orderId={}, caller={}, stage={}, previousStatus={}, refunded={}",
                orderId,
                caller,
                stage,
                previousStatus,
                refund);
        eventPublisherHelper.publishOrderEvent(this, saved, OrderEventType.CANCELLED, previousStatus);
        return saved;
    }

    /** Whether the order can be cancelled at all right now; the sender is admitted in every refund window. */
    @Transactional
    public boolean canCancel(Long orderId) {
        return canCancel(orderId, orderStore.load(orderId).getSender());
    }

    /** Would {@code address} be allowed to cancel the order right now. */
    @Transactional
    public boolean canCancel(Long orderId, String address) {
        SwapOrder order = orderStore.load(orderId);
        OrderStatus status = order.getStatus();
        if (status == OrderStatus.FAILED || acknowledgementHandler.isOverdue(order)) {
            return address.equals(order.getSender()) || stagePolicy.canCancel(order, order.getStage(), address);
        }
        if (status.isTerminal() || status == OrderStatus.AWAITING_ACK) {
            return false;
        }
        return order.getStage().isCancellationStage() && stagePolicy.canCancel(order, order.getStage(), address);
    }

    private void requireCancellable(SwapOrder order) {
        switch (order.getStatus()) {
            case COMPLETED -> throw new OrderStateException("Order " + order.getId() + " is already completed");
            case CANCELLED -> throw new OrderStateException("Order " + order.getId() + " is already cancelled");
            case AWAITING_ACK -> throw new OrderStateException(
                    "Order " + order.getId() + " has a settlement awaiting acknowledgement");
            default -> {
                // ACTIVE, fill states and FAILED may be cancelled
            }
        }
    }
}
