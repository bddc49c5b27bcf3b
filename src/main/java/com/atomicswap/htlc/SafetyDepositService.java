package com.atomicswap.htlc;

import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.SafetyDepositStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.SafetyDeposit;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.entity.SafetyDepositEntity;
import com.atomicswap.exception.InsufficientSafetyDepositException;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.mapper.SafetyDepositMapper;
import com.atomicswap.repository.jpa.SafetyDepositJpaRepository;
import java.time.Clock;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolver collateral posted against an order. Deposits stay HELD while the order is open
 * and go back to their depositors once it completes or is cancelled.
 */
@Service
public class SafetyDepositService {

    private static final Logger log = LoggerFactory.getLogger(SafetyDepositService.class);

    private final SafetyDepositJpaRepository safetyDepositJpaRepository;
    private final SafetyDepositMapper safetyDepositMapper = Mappers.getMapper(SafetyDepositMapper.class);
    private final OrderStore orderStore;
    private final TransferEmitter transferEmitter;
    private final Clock clock;

    public SafetyDepositService(
            SafetyDepositJpaRepository safetyDepositJpaRepository,
            OrderStore orderStore,
            TransferEmitter transferEmitter,
            Clock clock) {
        this.safetyDepositJpaRepository = safetyDepositJpaRepository;
        this.orderStore = orderStore;
        this.transferEmitter = transferEmitter;
        this.clock = clock;
    }

    @Transactional
    public SafetyDeposit post(Long orderId, String depositor, long amount) {
        SwapOrder order = orderStore.loadForUpdate(orderId);
        if (order.getStatus().isTerminal() || order.getStatus() == OrderStatus.AWAITING_ACK) {
            throw new OrderStateException("Order " + orderId + " no longer accepts deposits: " + order.getStatus());
        }
        if (order.getSafetyDepositAmount() == 0) {
            throw new ValidationException("Order " + orderId + " does not require a safety deposit");
        }
        if (amount < order.getSafetyDepositAmount()) {
            throw new InsufficientSafetyDepositException(orderId, depositor, order.getSafetyDepositAmount());
        }
        if (hasHeldDeposit(orderId, depositor)) {
            throw new OrderStateException(depositor + " already holds a deposit on order " + orderId);
        }

        SafetyDeposit deposit = SafetyDeposit.builder()
                .orderId(orderId)
                .depositor(depositor)
                .amount(amount)
                .status(SafetyDepositStatus.HELD)
                .postedAt(clock.instant().getEpochSecond())
                .build();
        SafetyDepositEntity saved = safetyDepositJpaRepository.save(safetyDepositMapper.toEntity(deposit));
        log.info("Safety deposit posted: orderId={}, depositor={}, amount={}", orderId, depositor, amount);
        return safetyDepositMapper.toDomain(saved);
    }

    public boolean hasHeldDeposit(Long orderId, String depositor) {
        return safetyDepositJpaRepository.existsByOrderIdAndDepositorAndStatus(
                orderId, depositor, SafetyDepositStatus.HELD);
    }

    /**
     * Returns every held deposit on the order to its depositor.
     *
     * @return total amount returned
     */
    @Transactional
    public long returnHeldDeposits(SwapOrder order) {
        long now = clock.instant().getEpochSecond();
        long returned = 0;
        for (SafetyDepositEntity entity :
                safetyDepositJpaRepository.findByOrderIdAndStatus(order.getId(), SafetyDepositStatus.HELD)) {
            entity.setStatus(SafetyDepositStatus.RETURNED);
            entity.setReturnedAt(now);
            safetyDepositJpaRepository.save(entity);
            transferEmitter.emit(order, null, entity.getDepositor(), entity.getAmount(), TransferReason.DEPOSIT_RETURN);
            returned += entity.getAmount();
        }
        if (returned > 0) {
            log.info("Safety deposits returned: orderId={}, amount={}", order.getId(), returned);
        }
        return returned;
    }

    public List<SafetyDeposit> depositsForOrder(Long orderId) {
        return safetyDepositMapper.toDomainList(safetyDepositJpaRepository.findByOrderId(orderId));
    }
}
