package com.atomicswap.htlc;

import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.PendingTransfer;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.entity.PendingTransferEntity;
import com.atomicswap.event.EventPublisherHelper;
import com.atomicswap.event.OrderEventType;
import com.atomicswap.mapper.PendingTransferMapper;
import com.atomicswap.repository.jpa.PendingTransferJpaRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Finalizes cross-chain settlements from asynchronous acknowledgements.
 *
 * <p>Exactly one of success, failure or timeout is expected per sequence, delivered at least
 * once. Success completes the order and releases payout and fee; failure and timeout move it
 * to FAILED so the sender can refund. Either way the pending transfer is discarded, which
 * makes every later delivery for that sequence a no-op.
 *
 * <p>A leg whose timeout passes without any acknowledgement is expired locally as a TIMEOUT,
 * either by the {@link SettlementTimeoutMonitor} or by the first cancellation that finds it
 * overdue. The relayer's own TIMEOUT, or a late SUCCESS, is then ignored like any duplicate.
 * Receipts for redelivery short-circuiting are written by {@link AckReceiptService} only after
 * the acknowledging transaction commits.
 */
@Service
public class AcknowledgementHandler {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgementHandler.class);

    private final PendingTransferJpaRepository pendingTransferJpaRepository;
    private final PendingTransferMapper pendingTransferMapper = Mappers.getMapper(PendingTransferMapper.class);
    private final OrderStore orderStore;
    private final AckReceiptService ackReceiptService;
    private final SafetyDepositService safetyDepositService;
    private final TransferEmitter transferEmitter;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public AcknowledgementHandler(
            PendingTransferJpaRepository pendingTransferJpaRepository,
            OrderStore orderStore,
            AckReceiptService ackReceiptService,
            SafetyDepositService safetyDepositService,
            TransferEmitter transferEmitter,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.pendingTransferJpaRepository = pendingTransferJpaRepository;
        this.orderStore = orderStore;
        this.ackReceiptService = ackReceiptService;
        this.safetyDepositService = safetyDepositService;
        this.transferEmitter = transferEmitter;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @Transactional
    public AckResult acknowledge(long sequence, AckOutcome outcome) {
        if (ackReceiptService.isProcessed(sequence)) {
            log.warn("Duplicate acknowledgement ignored: sequence={}, outcome={}", sequence, outcome);
            return ignored(sequence, outcome, null, null);
        }

        Optional<PendingTransfer> pendingTransfer =
                pendingTransferJpaRepository.findById(sequence).map(pendingTransferMapper::toDomain);
        if (pendingTransfer.isEmpty()) {
            log.warn("Acknowledgement for unknown or finalized sequence ignored: sequence={}", sequence);
            return ignored(sequence, outcome, null, null);
        }

        PendingTransfer pending = pendingTransfer.get();
        SwapOrder order = orderStore.loadForUpdate(pending.getOrderId());
        if (order.getStatus() != OrderStatus.AWAITING_ACK) {
            log.warn(
                    "Acknowledgement for order not awaiting one ignored: sequence={}, orderId={}, status={}",
                    sequence,
                    order.getId(),
                    order.getStatus());
            return ignored(sequence, outcome, order.getId(), order.getStatus());
        }

        OrderStatus previousStatus = order.getStatus();
        SwapOrder saved;
        if (outcome == AckOutcome.SUCCESS) {
            saved = complete(order, pending);
            eventPublisherHelper.publishOrderEvent(this, saved, OrderEventType.COMPLETED, previousStatus);
        } else {
            order.setStatus(OrderStatus.FAILED);
            saved = orderStore.save(order);
            log.warn("Cross-chain settlement failed: orderId={}, sequence={}, outcome={}", order.getId(), sequence, outcome);
            eventPublisherHelper.publishOrderEvent(this, saved, OrderEventType.FAILED, previousStatus);
        }
        pendingTransferJpaRepository.deleteById(sequence);
        eventPublisherHelper.publishAck(this, sequence, outcome, true);

        return AckResult.builder()
                .sequence(sequence)
                .outcome(outcome)
                .applied(true)
                .orderId(saved.getId())
                .orderStatus(saved.getStatus())
                .build();
    }

    /**
     * Expires the order's pending leg as a TIMEOUT when its deadline has passed.
     *
     * @return true when the order moved to FAILED
     */
    @Transactional
    public boolean expireIfOverdue(SwapOrder order) {
        Optional<PendingTransfer> overdue = overduePendingTransfer(order);
        if (overdue.isEmpty()) {
            return false;
        }
        long sequence = overdue.get().getSequence();
        log.info("Settlement timed out without acknowledgement: orderId={}, sequence={}", order.getId(), sequence);
        return acknowledge(sequence, AckOutcome.TIMEOUT).isApplied();
    }

    /** Whether the order is awaiting an acknowledgement whose deadline has already passed. */
    @Transactional(readOnly = true)
    public boolean isOverdue(SwapOrder order) {
        return overduePendingTransfer(order).isPresent();
    }

    /** Sequences whose acknowledgement deadline has passed, oldest first. */
    @Transactional(readOnly = true)
    public List<Long> overdueSequences() {
        return pendingTransferJpaRepository
                .findByTimeoutAtLessThanEqualOrderBySequenceAsc(clock.instant().getEpochSecond())
                .stream()
                .map(PendingTransferEntity::getSequence)
                .collect(Collectors.toList());
    }

    private Optional<PendingTransfer> overduePendingTransfer(SwapOrder order) {
        if (order.getStatus() != OrderStatus.AWAITING_ACK || order.getSequenceRef() == null) {
            return Optional.empty();
        }
        long now = clock.instant().getEpochSecond();
        return pendingTransferJpaRepository
                .findById(order.getSequenceRef())
                .map(pendingTransferMapper::toDomain)
                .filter(pending -> now >= pending.getTimeoutAt());
    }

    private SwapOrder complete(SwapOrder order, PendingTransfer pending) {
        transferEmitter.emit(order, null, pending.getDestinationRecipient(), pending.getPayout(), TransferReason.PAYOUT);
        TransferReason feeReason = pending.getSettler().equals(order.getReceiver())
                ? TransferReason.TREASURY_FEE
                : TransferReason.RESOLVER_FEE;
        transferEmitter.emit(order, null, pending.getFeeRecipient(), pending.getFee(), feeReason);
        safetyDepositService.returnHeldDeposits(order);

        order.setFilledAmount(order.getTotalAmount());
        order.setRemainingAmount(0);
        order.setStatus(OrderStatus.COMPLETED);
        SwapOrder saved = orderStore.save(order);
        log.info(
                "Cross-chain settlement completed: orderId={}, sequence={}, payout={}, fee={}",
                order.getId(),
                pending.getSequence(),
                pending.getPayout(),
                pending.getFee());
        return saved;
    }

    private AckResult ignored(long sequence, AckOutcome outcome, Long orderId, OrderStatus status) {
        eventPublisherHelper.publishAck(this, sequence, outcome, false);
        return AckResult.builder()
                .sequence(sequence)
                .outcome(outcome)
                .applied(false)
                .orderId(orderId)
                .orderStatus(status)
                .build();
    }
}
