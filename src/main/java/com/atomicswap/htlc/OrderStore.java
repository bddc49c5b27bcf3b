package com.atomicswap.htlc;

import com.atomicswap.config.EngineProperties;
import com.atomicswap.crosschain.ChainConfigService;
import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TimelockMode;
import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.domain.model.EngineStats;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.vo.StageDurations;
import com.atomicswap.entity.SwapOrderEntity;
import com.atomicswap.event.EventPublisherHelper;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.mapper.SwapOrderMapper;
import com.atomicswap.repository.jpa.SwapOrderJpaRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the canonical swap order records.
 *
 * <p>Order ids come from the table's identity column, so they are monotonic and issued once
 * per creation. Every load recomputes the stage from the clock and persists it when it moved,
 * so subsequent authorization checks in the same operation see a consistent value. Terminal
 * orders are never recomputed.
 *
 * <p>Every state-changing operation reads its order through {@link #loadForUpdate}, which holds
 * a row lock until the transaction ends, so settlements of one order run one at a time. Saves
 * are version-checked as well: a snapshot read before another writer committed is rejected
 * with an optimistic locking failure instead of overwriting that write.
 *
 * <p>Open orders are found through the indexed status column; nothing maintains a separate
 * active list.
 */
@Service
public class OrderStore {

    private static final Logger log = LoggerFactory.getLogger(OrderStore.class);

    /** Keeps amount * 10000 inside a long for basis-point arithmetic. */
    static final long MAX_AMOUNT = Long.MAX_VALUE / 10_000;

    private final SwapOrderJpaRepository swapOrderJpaRepository;
    private final SwapOrderMapper swapOrderMapper = Mappers.getMapper(SwapOrderMapper.class);
    private final StageCalculator stageCalculator;
    private final ChainConfigService chainConfigService;
    private final EngineProperties engineProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public OrderStore(
            SwapOrderJpaRepository swapOrderJpaRepository,
            StageCalculator stageCalculator,
            ChainConfigService chainConfigService,
            EngineProperties engineProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.swapOrderJpaRepository = swapOrderJpaRepository;
        this.stageCalculator = stageCalculator;
        this.chainConfigService = chainConfigService;
        this.engineProperties = engineProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Validates the terms and records a new ACTIVE order. Funds are assumed escrowed by the
     * host ledger before this call.
     *
     * @throws ValidationException if any term is out of bounds or the hashlock is already committed
     */
    @Transactional
    public SwapOrder createOrder(CreateOrderCommand command) {
        long now = clock.instant().getEpochSecond();
        validateParties(command);
        validateAmount(command.getAmount());
        String hashlock = validateHashlock(command.getHashlock());
        int feeBps = resolveFeeBps(command.getFeeBps());

        SwapOrder order = SwapOrder.builder()
                .sender(command.getSender())
                .receiver(command.getReceiver())
                .taker(blankToNull(command.getTaker()))
                .whitelist(normalizeWhitelist(command.getWhitelist()))
                .asset(command.getAsset())
                .totalAmount(command.getAmount())
                .filledAmount(0)
                .remainingAmount(command.getAmount())
                .feeBps(feeBps)
                .hashlock(hashlock)
                .createdAt(now)
                .status(OrderStatus.ACTIVE)
                .updatedAt(now)
                .build();

        applyTimelock(order, command, now);
        applyFillTerms(order, command);
        applySafetyDeposit(order, command);
        applyCrossChain(order, command);
        order.setStage(stageCalculator.stageOf(order, now));

        SwapOrderEntity saved = swapOrderJpaRepository.save(swapOrderMapper.toEntity(order));
        SwapOrder created = swapOrderMapper.toDomain(saved);

        log.info(
                "Order created: orderId={}, sender={}, receiver={}, amount={} {}, mode={}, expiresAt={}, crossChain={}",
                created.getId(),
                created.getSender(),
                created.getReceiver(),
                created.getTotalAmount(),
                created.getAsset(),
                created.getTimelockMode(),
                created.getExpiresAt(),
                created.isCrossChain());
        eventPublisherHelper.publishOrderCreated(this, created);
        return created;
    }

    /**
     * Loads an order and refreshes its stage against the clock.
     *
     * @throws ResourceNotFoundException if no order has this id
     */
    @Transactional
    public SwapOrder load(Long orderId) {
        SwapOrderEntity entity = swapOrderJpaRepository
                .findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        return refreshStage(swapOrderMapper.toDomain(entity), clock.instant().getEpochSecond());
    }

    /**
     * Loads an order under a row lock held until the caller's transaction ends. Settlement,
     * cancellation, fill and acknowledgement paths all start here.
     *
     * @throws ResourceNotFoundException if no order has this id
     */
    @Transactional
    public SwapOrder loadForUpdate(Long orderId) {
        SwapOrderEntity entity = swapOrderJpaRepository
                .findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        return refreshStage(swapOrderMapper.toDomain(entity), clock.instant().getEpochSecond());
    }

    /**
     * Persists a mutated order and returns the stored snapshot, which carries the new version.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException if the order changed
     *     since {@code order} was read
     */
    @Transactional
    public SwapOrder save(SwapOrder order) {
        assertAmountsBalance(order);
        order.setUpdatedAt(clock.instant().getEpochSecond());
        return swapOrderMapper.toDomain(swapOrderJpaRepository.saveAndFlush(swapOrderMapper.toEntity(order)));
    }

    @Transactional(readOnly = true)
    public Optional<Long> findIdByHashlock(String hashlock) {
        if (!SecretVerifier.isValidHashlock(hashlock)) {
            throw new ValidationException("Hashlock must be 64 hex characters");
        }
        return swapOrderJpaRepository
                .findByHashlock(SecretVerifier.normalizeHashlock(hashlock))
                .map(SwapOrderEntity::getId);
    }

    @Transactional
    public List<SwapOrder> openOrders(int page, int size) {
        long now = clock.instant().getEpochSecond();
        List<SwapOrderEntity> entities = swapOrderJpaRepository
                .findByStatusIn(OrderStatus.openStatuses(), PageRequest.of(page, size, Sort.by("id")))
                .getContent();
        List<SwapOrder> orders = new ArrayList<>(entities.size());
        for (SwapOrderEntity entity : entities) {
            orders.add(refreshStage(swapOrderMapper.toDomain(entity), now));
        }
        return orders;
    }

    @Transactional(readOnly = true)
    public List<SwapOrder> ordersByParty(String address) {
        return swapOrderMapper.toDomainList(swapOrderJpaRepository.findByParty(address));
    }

    @Transactional(readOnly = true)
    public EngineStats stats() {
        return EngineStats.builder()
                .totalOrders(swapOrderJpaRepository.count())
                .openOrders(swapOrderJpaRepository.countByStatusIn(OrderStatus.openStatuses()))
                .completedOrders(swapOrderJpaRepository.countByStatus(OrderStatus.COMPLETED))
                .cancelledOrders(swapOrderJpaRepository.countByStatus(OrderStatus.CANCELLED))
                .failedOrders(swapOrderJpaRepository.countByStatus(OrderStatus.FAILED))
                .totalVolume(swapOrderJpaRepository.sumTotalAmount())
                .build();
    }

    /**
     * Recomputes the stage of every open order.
     *
     * @return number of orders whose stage moved
     */
    @Transactional
    public int refreshOpenStages() {
        long now = clock.instant().getEpochSecond();
        int changed = 0;
        for (SwapOrderEntity entity : swapOrderJpaRepository.findByStatusIn(OrderStatus.openStatuses())) {
            OrderStage before = entity.getStage();
            SwapOrder refreshed = refreshStage(swapOrderMapper.toDomain(entity), now);
            if (refreshed.getStage() != before) {
                changed++;
            }
        }
        return changed;
    }

    private SwapOrder refreshStage(SwapOrder order, long now) {
        if (order.getStatus().isTerminal()) {
            return order;
        }
        OrderStage current = stageCalculator.stageOf(order, now);
        if (current == order.getStage()) {
            return order;
        }
        OrderStage previous = order.getStage();
        order.setStage(current);
        SwapOrder saved = save(order);
        log.info("Order stage changed: orderId={}, from={}, to={}", order.getId(), previous, current);
        eventPublisherHelper.publishStageChanged(this, saved);
        return saved;
    }

    private void assertAmountsBalance(SwapOrder order) {
        if (order.getFilledAmount() + order.getRemainingAmount() != order.getTotalAmount()
                || order.getFilledAmount() < 0
                || order.getRemainingAmount() < 0) {
            throw new IllegalStateException(String.format(
                    "Order %d amounts out of balance: filled=%d, remaining=%d, total=%d",
                    order.getId(), order.getFilledAmount(), order.getRemainingAmount(), order.getTotalAmount()));
        }
    }

    // ---- Creation rules ----

    private void validateParties(CreateOrderCommand command) {
        if (isBlank(command.getSender()) || isBlank(command.getReceiver())) {
            throw new ValidationException("Sender and receiver are required");
        }
        if (isBlank(command.getAsset())) {
            throw new ValidationException("Asset is required");
        }
    }

    private void validateAmount(long amount) {
        if (amount <= 0) {
            throw new ValidationException("Amount must be positive", Map.of("amount", amount));
        }
        if (amount > MAX_AMOUNT) {
            throw new ValidationException("Amount too large", Map.of("amount", amount, "max", MAX_AMOUNT));
        }
    }

    private String validateHashlock(String hashlock) {
        if (!SecretVerifier.isValidHashlock(hashlock)) {
            throw new ValidationException(
                    "Hashlock must be " + SecretVerifier.HASHLOCK_HEX_LENGTH + " hex characters",
                    Map.of("length", hashlock == null ? 0 : hashlock.length()));
        }
        String normalized = SecretVerifier.normalizeHashlock(hashlock);
        if (swapOrderJpaRepository.existsByHashlock(normalized)) {
            throw new ValidationException("Hashlock already committed by another order");
        }
        return normalized;
    }

    private int resolveFeeBps(Integer requested) {
        int feeBps = requested != null ? requested : engineProperties.getProtocolFeeBps();
        if (feeBps < 0 || feeBps > engineProperties.getMaxFeeBps()) {
            throw new ValidationException(
                    "Fee out of range", Map.of("feeBps", feeBps, "max", engineProperties.getMaxFeeBps()));
        }
        return feeBps;
    }

    private void applyTimelock(SwapOrder order, CreateOrderCommand command, long now) {
        boolean single = command.getTimelockSeconds() != null;
        boolean staged = command.getStageDurations() != null;
        if (single == staged) {
            throw new ValidationException("Exactly one of timelockSeconds and stageDurations is required");
        }

        if (single) {
            long timelock = command.getTimelockSeconds();
            checkTimelockRange(timelock);
            order.setTimelockMode(TimelockMode.SINGLE);
            order.setExpiresAt(now + timelock);
            return;
        }

        StageDurations durations = command.getStageDurations();
        if (durations.getFinalityDelay() < 0
                || durations.getTakerExclusiveDuration() <= 0
                || durations.getPrivateResolverDuration() <= 0
                || durations.getPublicResolverDuration() <= 0
                || durations.getPrivateCancellationDuration() <= 0) {
            throw new ValidationException("Stage durations must be positive (finality delay may be zero)");
        }
        // each part bounded first, so the sum below cannot wrap
        long max = engineProperties.getMaxTimelockSeconds();
        if (durations.getFinalityDelay() > max
                || durations.getTakerExclusiveDuration() > max
                || durations.getPrivateResolverDuration() > max
                || durations.getPublicResolverDuration() > max
                || durations.getPrivateCancellationDuration() > max) {
            throw new ValidationException(
                    "Stage duration exceeds the maximum timelock", Map.of("maxTimelockSeconds", max));
        }
        checkTimelockRange(durations.getTotal());

        long finality = now + durations.getFinalityDelay();
        long takerDeadline = finality + durations.getTakerExclusiveDuration();
        long publicDeadline = takerDeadline + durations.getPrivateResolverDuration();
        long cancellationStart = publicDeadline + durations.getPublicResolverDuration();
        long publicCancellation = cancellationStart + durations.getPrivateCancellationDuration();

        order.setTimelockMode(TimelockMode.STAGED);
        order.setFinalityAt(finality);
        order.setTakerDeadline(takerDeadline);
        order.setPublicDeadline(publicDeadline);
        order.setCancellationStart(cancellationStart);
        order.setPublicCancellationStart(publicCancellation);
        order.setExpiresAt(cancellationStart);
    }

    private void checkTimelockRange(long seconds) {
        long min = engineProperties.getMinTimelockSeconds();
        long max = engineProperties.getMaxTimelockSeconds();
        if (seconds < min || seconds > max) {
            throw new ValidationException(
                    "Timelock outside allowed range", Map.of("timelockSeconds", seconds, "min", min, "max", max));
        }
    }

    private void applyFillTerms(SwapOrder order, CreateOrderCommand command) {
        long total = order.getTotalAmount();
        if (!command.isPartialFills()) {
            order.setPartialFillsAllowed(false);
            order.setMinFillAmount(total);
            return;
        }
        if (!engineProperties.isPartialFillsEnabled()) {
            throw new ValidationException("Partial fills are disabled on this engine");
        }
        if (!isBlank(command.getDestinationChainId())) {
            throw new ValidationException("Cross-chain orders settle in one leg and cannot take partial fills");
        }
        long minFill = command.getMinFillAmount() != null
                ? command.getMinFillAmount()
                : Math.max(1, total / engineProperties.getDefaultMinFillDivisor());
        if (minFill <= 0 || minFill > total) {
            throw new ValidationException(
                    "Minimum fill must be positive and at most the total",
                    Map.of("minFillAmount", minFill, "amount", total));
        }
        order.setPartialFillsAllowed(true);
        order.setMinFillAmount(minFill);
    }

    private void applySafetyDeposit(SwapOrder order, CreateOrderCommand command) {
        long required = 0;
        if (command.getSafetyDepositAmount() != null) {
            required = command.getSafetyDepositAmount();
            if (required < 0) {
                throw new ValidationException("Safety deposit cannot be negative");
            }
        } else if (command.isRequireSafetyDeposit()) {
            required = Math.max(1, order.getTotalAmount() / engineProperties.getSafetyDepositDivisor());
        }
        order.setSafetyDepositAmount(required);
    }

    private void applyCrossChain(SwapOrder order, CreateOrderCommand command) {
        if (isBlank(command.getDestinationChainId())) {
            return;
        }
        if (isBlank(command.getDestinationRecipient()) || isBlank(command.getDestinationToken())) {
            throw new ValidationException("Cross-chain orders need a destination recipient and token");
        }
        ChainConfig chain = chainConfigService.requireActive(command.getDestinationChainId());
        FeeCalculator.checkCombinedFee(order.getFeeBps(), chain);
        order.setDestinationChainId(command.getDestinationChainId());
        order.setDestinationRecipient(command.getDestinationRecipient());
        order.setDestinationToken(command.getDestinationToken());
    }

    private static List<String> normalizeWhitelist(List<String> whitelist) {
        if (whitelist == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String address : whitelist) {
            if (!isBlank(address)) {
                distinct.add(address);
            }
        }
        return new ArrayList<>(distinct);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
