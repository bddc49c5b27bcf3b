package com.atomicswap.htlc;

import com.atomicswap.config.EngineProperties;
import com.atomicswap.domain.enums.FillStatus;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.Fill;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.entity.FillEntity;
import com.atomicswap.event.EventPublisherHelper;
import com.atomicswap.event.FillEventType;
import com.atomicswap.event.OrderEventType;
import com.atomicswap.exception.InsufficientSafetyDepositException;
import com.atomicswap.exception.InvalidSecretException;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.StageAuthorizationException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.mapper.FillMapper;
import com.atomicswap.repository.jpa.FillJpaRepository;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Partial-fill bookkeeping on top of an order.
 *
 * <p>A fill commits part of the order's remaining amount to one filler. The order moves to
 * PARTIALLY_FILLED, then FULLY_FILLED when nothing remains, and only becomes COMPLETED once
 * the receiver has withdrawn every pending fill with the secret. With the default order-wide
 * secret scope, one reveal unlocks every fill; with fill scope each fill commits its own
 * hashlock at creation.
 *
 * <p>Every mutation holds the parent order's row lock, and fill rows are version-checked.
 *
 * <p>Refunded fills give their amount back to the order while it is still open. After the
 * order is terminal a refund only releases the filler's reservation.
 */
@Service
public class FillLedger {

    private static final Logger log = LoggerFactory.getLogger(FillLedger.class);

    private final FillJpaRepository fillJpaRepository;
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);
    private final OrderStore orderStore;
    private final StagePolicy stagePolicy;
    private final StageCalculator stageCalculator;
    private final SecretVerifier secretVerifier;
    private final SafetyDepositService safetyDepositService;
    private final TransferEmitter transferEmitter;
    private final EngineProperties engineProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public FillLedger(
            FillJpaRepository fillJpaRepository,
            OrderStore orderStore,
            StagePolicy stagePolicy,
            StageCalculator stageCalculator,
            SecretVerifier secretVerifier,
            SafetyDepositService safetyDepositService,
            TransferEmitter transferEmitter,
            EngineProperties engineProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.fillJpaRepository = fillJpaRepository;
        this.orderStore = orderStore;
        this.stagePolicy = stagePolicy;
        this.stageCalculator = stageCalculator;
        this.secretVerifier = secretVerifier;
        this.safetyDepositService = safetyDepositService;
        this.transferEmitter = transferEmitter;
        this.engineProperties = engineProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Commits {@code amount} of the order to {@code filler}.
     *
     * @param fillHashlock the fill's own hashlock; required with fill-scoped secrets, rejected otherwise
     */
    @Transactional
    public Fill createFill(Long orderId, String filler, long amount, String fillHashlock) {
        SwapOrder order = orderStore.loadForUpdate(orderId);
        if (!engineProperties.isPartialFillsEnabled() || !order.isPartialFillsAllowed()) {
            throw new OrderStateException("Partial fills are not enabled for order " + orderId);
        }
        requireFillable(order);
        if (order.getStage().isCancellationStage()) {
            throw OrderStateException.timelockExpired(orderId);
        }
        if (amount < order.getMinFillAmount() || amount > order.getRemainingAmount()) {
            throw new ValidationException(
                    "Fill amount outside allowed bounds",
                    Map.of(
                            "amount", amount,
                            "minFillAmount", order.getMinFillAmount(),
                            "remainingAmount", order.getRemainingAmount()));
        }
        String hashlock = resolveFillHashlock(fillHashlock);
        if (!stagePolicy.canFill(order, order.getStage(), filler)) {
            throw new StageAuthorizationException(orderId, filler, order.getStage(), "fill");
        }
        if (order.getSafetyDepositAmount() > 0 && !safetyDepositService.hasHeldDeposit(orderId, filler)) {
            throw new InsufficientSafetyDepositException(orderId, filler, order.getSafetyDepositAmount());
        }

        OrderStatus previousStatus = order.getStatus();
        order.setFilledAmount(order.getFilledAmount() + amount);
        order.setRemainingAmount(order.getRemainingAmount() - amount);
        order.setStatus(order.getRemainingAmount() == 0 ? OrderStatus.FULLY_FILLED : OrderStatus.PARTIALLY_FILLED);
        SwapOrder saved = orderStore.save(order);

        Fill fill = Fill.builder()
                .orderId(orderId)
                .filler(filler)
                .amount(amount)
                .status(FillStatus.PENDING)
                .hashlock(hashlock)
                .createdAt(clock.instant().getEpochSecond())
                .build();
        Fill created = fillMapper.toDomain(fillJpaRepository.save(fillMapper.toEntity(fill)));

        log.info(
                "Fill created: fillId={}, orderId={}, filler={}, amount={}, remaining={}",
                created.getId(),
                orderId,
                filler,
                amount,
                saved.getRemainingAmount());
        eventPublisherHelper.publishFillEvent(this, created, FillEventType.CREATED);
        eventPublisherHelper.publishOrderEvent(
                this,
                saved,
                saved.getStatus() == OrderStatus.FULLY_FILLED
                        ? OrderEventType.FULLY_FILLED
                        : OrderEventType.PARTIALLY_FILLED,
                previousStatus);
        return created;
    }

    /**
     * Releases a pending fill to the order's receiver against the secret.
     */
    @Transactional
    public Fill withdrawFill(Long fillId, String caller, String secret) {
        SwapOrder order = lockOrderOf(fillId);
        Fill fill = loadFill(fillId);
        if (fill.getStatus() != FillStatus.PENDING) {
            throw new OrderStateException("Fill " + fillId + " is already " + fill.getStatus());
        }
        if (order.getStatus().isTerminal()) {
            throw new OrderStateException("Order " + order.getId() + " is already " + order.getStatus());
        }
        if (order.getStage().isCancellationStage()) {
            throw OrderStateException.timelockExpired(order.getId());
        }
        String hashlock = fill.getHashlock() != null ? fill.getHashlock() : order.getHashlock();
        if (!secretVerifier.verify(secret, hashlock)) {
            throw new InvalidSecretException(order.getId());
        }
        if (!caller.equals(order.getReceiver())) {
            throw new StageAuthorizationException(order.getId(), caller, order.getStage(), "withdraw fill");
        }

        long now = clock.instant().getEpochSecond();
        fill.setStatus(FillStatus.COMPLETED);
        fill.setSecret(secret);
        fill.setSettledAt(now);
        Fill saved = fillMapper.toDomain(fillJpaRepository.save(fillMapper.toEntity(fill)));
        if (order.getSecret() == null && fill.getHashlock() == null) {
            order.setSecret(secret);
        }

        transferEmitter.emit(order, fillId, order.getReceiver(), fill.getAmount(), TransferReason.FILL_PAYOUT);

        OrderStatus previousStatus = order.getStatus();
        boolean completed = order.getRemainingAmount() == 0 && noPendingFills(order.getId());
        if (completed) {
            order.setStatus(OrderStatus.COMPLETED);
            order.setWithdrawnBy(caller);
            safetyDepositService.returnHeldDeposits(order);
        }
        SwapOrder savedOrder = orderStore.save(order);

        log.info("Fill withdrawn: fillId={}, orderId={}, amount={}", fillId, order.getId(), fill.getAmount());
        eventPublisherHelper.publishFillEvent(this, saved, FillEventType.WITHDRAWN);
        if (completed) {
            log.info("Order completed through fills: orderId={}", order.getId());
            eventPublisherHelper.publishOrderEvent(this, savedOrder, OrderEventType.COMPLETED, previousStatus);
        }
        return saved;
    }

    /**
     * Returns a pending fill's reservation to its filler once the order has expired.
     */
    @Transactional
    public Fill refundFill(Long fillId, String caller) {
        SwapOrder order = lockOrderOf(fillId);
        Fill fill = loadFill(fillId);
        if (fill.getStatus() != FillStatus.PENDING) {
            throw new OrderStateException("Fill " + fillId + " is already " + fill.getStatus());
        }
        if (!stageCalculator.isExpired(order, clock.instant().getEpochSecond())) {
            throw OrderStateException.timelockNotExpired(order.getId());
        }
        if (!caller.equals(fill.getFiller())) {
            throw new StageAuthorizationException(order.getId(), caller, order.getStage(), "refund fill");
        }

        fill.setStatus(FillStatus.REFUNDED);
        fill.setSettledAt(clock.instant().getEpochSecond());
        Fill saved = fillMapper.toDomain(fillJpaRepository.save(fillMapper.toEntity(fill)));
        transferEmitter.emit(order, fillId, fill.getFiller(), fill.getAmount(), TransferReason.FILL_REFUND);

        if (!order.getStatus().isTerminal()) {
            order.setFilledAmount(order.getFilledAmount() - fill.getAmount());
            order.setRemainingAmount(order.getRemainingAmount() + fill.getAmount());
            order.setStatus(order.getFilledAmount() == 0 ? OrderStatus.ACTIVE : OrderStatus.PARTIALLY_FILLED);
            orderStore.save(order);
        }

        log.info(
                "Fill refunded: fillId={}, orderId={}, filler={}, amount={}, orderStatus={}",
                fillId,
                order.getId(),
                fill.getFiller(),
                fill.getAmount(),
                order.getStatus());
        eventPublisherHelper.publishFillEvent(this, saved, FillEventType.REFUNDED);
        return saved;
    }

    public List<Fill> getFills(Long orderId) {
        return fillMapper.toDomainList(fillJpaRepository.findByOrderIdOrderByIdAsc(orderId));
    }

    public Fill getFill(Long fillId) {
        return loadFill(fillId);
    }

    public boolean hasPendingFills(Long orderId) {
        return !noPendingFills(orderId);
    }

    /** Fill mutations lock the parent order first, so they serialize with the order's other writers. */
    private SwapOrder lockOrderOf(Long fillId) {
        Long orderId = fillJpaRepository
                .findOrderIdById(fillId)
                .orElseThrow(() -> new ResourceNotFoundException("Fill", fillId));
        return orderStore.loadForUpdate(orderId);
    }

    private Fill loadFill(Long fillId) {
        FillEntity entity =
                fillJpaRepository.findById(fillId).orElseThrow(() -> new ResourceNotFoundException("Fill", fillId));
        return fillMapper.toDomain(entity);
    }

    private void requireFillable(SwapOrder order) {
        OrderStatus status = order.getStatus();
        if (status.isTerminal() || status == OrderStatus.AWAITING_ACK) {
            throw new OrderStateException("Order " + order.getId() + " does not accept fills: " + status);
        }
    }

    private String resolveFillHashlock(String fillHashlock) {
        return switch (engineProperties.getSecretScope()) {
            case ORDER -> {
                if (fillHashlock != null) {
                    throw new ValidationException("Fills share the order's secret; a fill hashlock is not accepted");
                }
                yield null;
            }
            case FILL -> {
                if (!SecretVerifier.isValidHashlock(fillHashlock)) {
                    throw new ValidationException("Fill hashlock must be 64 hex characters");
                }
                yield SecretVerifier.normalizeHashlock(fillHashlock);
            }
        };
    }

    private boolean noPendingFills(Long orderId) {
        return fillJpaRepository.findByOrderIdOrderByIdAsc(orderId).stream()
                .noneMatch(entity -> entity.getStatus() == FillStatus.PENDING);
    }
}
