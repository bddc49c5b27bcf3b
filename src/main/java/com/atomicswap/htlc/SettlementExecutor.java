package com.atomicswap.htlc;

import com.atomicswap.config.EngineProperties;
import com.atomicswap.crosschain.ChainConfigService;
import com.atomicswap.crosschain.CrossChainMessenger;
import com.atomicswap.crosschain.OutboundPacket;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.domain.model.PendingTransfer;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.vo.SettlementBreakdown;
import com.atomicswap.entity.PendingTransferEntity;
import com.atomicswap.event.EventPublisherHelper;
import com.atomicswap.event.OrderEventType;
import com.atomicswap.exception.BaseException;
import com.atomicswap.exception.InvalidSecretException;
import com.atomicswap.exception.MessagingException;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.StageAuthorizationException;
import com.atomicswap.mapper.PendingTransferMapper;
import com.atomicswap.repository.jpa.PendingTransferJpaRepository;
import java.time.Clock;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Full, single-leg withdrawal of an order against its secret.
 *
 * <p>Checks run strictly in this order and all precede any effect: order state, expiry,
 * secret, stage authorization. A local order then pays out and completes in the same call.
 * A cross-chain order instead records a pending transfer, hands the packet to the
 * {@link CrossChainMessenger} without waiting and stays AWAITING_ACK until the
 * {@link AcknowledgementHandler} hears back.
 */
@Service
public class SettlementExecutor {

    private static final Logger log = LoggerFactory.getLogger(SettlementExecutor.class);

    private final OrderStore orderStore;
    private final StagePolicy stagePolicy;
    private final SecretVerifier secretVerifier;
    private final FeeCalculator feeCalculator;
    private final ChainConfigService chainConfigService;
    private final FillLedger fillLedger;
    private final PendingTransferJpaRepository pendingTransferJpaRepository;
    private final PendingTransferMapper pendingTransferMapper = Mappers.getMapper(PendingTransferMapper.class);
    private final CrossChainMessenger crossChainMessenger;
    private final SafetyDepositService safetyDepositService;
    private final TransferEmitter transferEmitter;
    private final EngineProperties engineProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public SettlementExecutor(
            OrderStore orderStore,
            StagePolicy stagePolicy,
            SecretVerifier secretVerifier,
            FeeCalculator feeCalculator,
            ChainConfigService chainConfigService,
            FillLedger fillLedger,
            PendingTransferJpaRepository pendingTransferJpaRepository,
            CrossChainMessenger crossChainMessenger,
            SafetyDepositService safetyDepositService,
            TransferEmitter transferEmitter,
            EngineProperties engineProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.orderStore = orderStore;
        this.stagePolicy = stagePolicy;
        this.secretVerifier = secretVerifier;
        this.feeCalculator = feeCalculator;
        this.chainConfigService = chainConfigService;
        this.fillLedger = fillLedger;
        this.pendingTransferJpaRepository = pendingTransferJpaRepository;
        this.crossChainMessenger = crossChainMessenger;
        this.safetyDepositService = safetyDepositService;
        this.transferEmitter = transferEmitter;
        this.engineProperties = engineProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @Transactional
    public SettlementResult withdraw(Long orderId, String withdrawer, String secret) {
        SwapOrder order = orderStore.loadForUpdate(orderId);
        requireSettleable(order);
        if (order.getStage().isCancellationStage()) {
            throw OrderStateException.timelockExpired(orderId);
        }
        if (!secretVerifier.verify(secret, order.getHashlock())) {
            throw new InvalidSecretException(orderId);
        }
        if (!stagePolicy.canWithdraw(order, order.getStage(), withdrawer)) {
            throw new StageAuthorizationException(orderId, withdrawer, order.getStage(), "withdraw");
        }

        ChainConfig chain = order.isCrossChain() ? chainConfigService.requireActive(order.getDestinationChainId()) : null;
        SettlementBreakdown breakdown = feeCalculator.compute(order, order.getTotalAmount(), withdrawer, chain);

        OrderStatus previousStatus = order.getStatus();
        order.setSecret(secret);
        order.setWithdrawnBy(withdrawer);

        if (chain != null) {
            return initiateCrossChain(order, chain, breakdown, withdrawer, previousStatus);
        }

        transferEmitter.emit(order, null, order.getReceiver(), breakdown.getPayout(), TransferReason.PAYOUT);
        transferEmitter.emit(order, null, breakdown.getFeeRecipient(), breakdown.getFee(), breakdown.getFeeReason());
        safetyDepositService.returnHeldDeposits(order);

        order.setFilledAmount(order.getTotalAmount());
        order.setRemainingAmount(0);
        order.setStatus(OrderStatus.COMPLETED);
        SwapOrder saved = orderStore.save(order);

        log.info(
                "Order withdrawn: orderId={}, withdrawer={}, stage={}, payout={}, fee={}, feeRecipient={}",
                orderId,
                withdrawer,
                saved.getStage(),
                breakdown.getPayout(),
                breakdown.getFee(),
                breakdown.getFeeRecipient());
        eventPublisherHelper.publishOrderEvent(this, saved, OrderEventType.COMPLETED, previousStatus);
        return SettlementResult.builder().order(saved).breakdown(breakdown).build();
    }

    /**
     * Would {@code address} pass every withdrawal check short of the secret right now. Once an
     * order has fills it settles fill by fill, and only its receiver can withdraw them.
     */
    @Transactional
    public boolean canWithdraw(Long orderId, String address) {
        SwapOrder order = orderStore.load(orderId);
        OrderStatus status = order.getStatus();
        if (status.isTerminal() || status == OrderStatus.AWAITING_ACK || order.getStage().isCancellationStage()) {
            return false;
        }
        if (order.getFilledAmount() > 0) {
            return address.equals(order.getReceiver()) && fillLedger.hasPendingFills(orderId);
        }
        return stagePolicy.canWithdraw(order, order.getStage(), address);
    }

    private SettlementResult initiateCrossChain(
            SwapOrder order,
            ChainConfig chain,
            SettlementBreakdown breakdown,
            String withdrawer,
            OrderStatus previousStatus) {
        long now = clock.instant().getEpochSecond();
        PendingTransfer pending = PendingTransfer.builder()
                .orderId(order.getId())
                .destinationChainId(chain.getChainId())
                .channel(chain.getChannel())
                .destinationRecipient(order.getDestinationRecipient())
                .destinationToken(order.getDestinationToken())
                .amount(breakdown.getAmount())
                .payout(breakdown.getPayout())
                .fee(breakdown.getFee())
                .feeRecipient(breakdown.getFeeRecipient())
                .settler(withdrawer)
                .initiatedAt(now)
                .timeoutAt(now + engineProperties.getAckTimeoutSeconds())
                .build();
        PendingTransferEntity saved = pendingTransferJpaRepository.save(pendingTransferMapper.toEntity(pending));
        long sequence = saved.getSequence();

        order.setSequenceRef(sequence);
        order.setStatus(OrderStatus.AWAITING_ACK);
        SwapOrder savedOrder = orderStore.save(order);

        OutboundPacket packet = OutboundPacket.builder()
                .sequence(sequence)
                .orderId(order.getId())
                .channel(chain.getChannel())
                .destinationChainId(chain.getChainId())
                .recipient(order.getDestinationRecipient())
                .token(order.getDestinationToken())
                .amount(breakdown.getPayout())
                .hashlock(order.getHashlock())
                .secret(order.getSecret())
                .timeoutAt(pending.getTimeoutAt())
                .build();
        try {
            crossChainMessenger.send(packet);
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessagingException("Failed to queue packet for order " + order.getId(), e);
        }

        log.info(
                "Cross-chain settlement initiated: orderId={}, sequence={}, chain={}, payout={}, fee={}",
                order.getId(),
                sequence,
                chain.getChainId(),
                breakdown.getPayout(),
                breakdown.getFee());
        eventPublisherHelper.publishOrderEvent(this, savedOrder, OrderEventType.SETTLEMENT_INITIATED, previousStatus);
        return SettlementResult.builder()
                .order(savedOrder)
                .breakdown(breakdown)
                .sequence(sequence)
                .build();
    }

    private void requireSettleable(SwapOrder order) {
        OrderStatus status = order.getStatus();
        if (status.isTerminal()) {
            throw new OrderStateException("Order " + order.getId() + " is already " + status);
        }
        if (status == OrderStatus.AWAITING_ACK) {
            throw new OrderStateException("Order " + order.getId() + " has a settlement awaiting acknowledgement");
        }
        if (order.getFilledAmount() > 0) {
            throw new OrderStateException("Order " + order.getId() + " has partial fills; settle it through its fills");
        }
    }
}
