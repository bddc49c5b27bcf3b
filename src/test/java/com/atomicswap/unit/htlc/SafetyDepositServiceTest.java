package com.atomicswap.unit.htlc;

import static com.atomicswap.support.SwapFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.SafetyDepositStatus;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.SafetyDeposit;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.exception.InsufficientSafetyDepositException;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.htlc.OrderStore;
import com.atomicswap.htlc.SafetyDepositService;
import com.atomicswap.htlc.TransferEmitter;
import com.atomicswap.support.InMemoryRepositories;
import com.atomicswap.support.MutableClock;
import com.atomicswap.support.SwapFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SafetyDepositServiceTest {

    private static final String FILLER = "fred";

    private InMemoryRepositories repositories;
    private TransferEmitter transferEmitter;
    private SafetyDepositService safetyDepositService;
    private SwapOrder order;

    @BeforeEach
    void setUp() {
        repositories = new InMemoryRepositories();
        OrderStore orderStore = mock(OrderStore.class);
        transferEmitter = mock(TransferEmitter.class);

        order = SwapFixtures.partialFillOrder(1L);
        order.setSafetyDepositAmount(50_000);
        when(orderStore.load(1L)).thenAnswer(inv -> order);
        when(orderStore.loadForUpdate(1L)).thenAnswer(inv -> order);

        safetyDepositService = new SafetyDepositService(
                repositories.safetyDepositJpaRepository, orderStore, transferEmitter, new MutableClock(NOW));
    }

    @Test
    @DisplayName("Deposit at the required amount is held")
    void postsDeposit() {
        SafetyDeposit deposit = safetyDepositService.post(1L, FILLER, 50_000);

        assertThat(deposit.getStatus()).isEqualTo(SafetyDepositStatus.HELD);
        assertThat(deposit.getPostedAt()).isEqualTo(NOW);
        assertThat(safetyDepositService.hasHeldDeposit(1L, FILLER)).isTrue();
    }

    @Test
    @DisplayName("Deposit below the requirement is rejected")
    void rejectsShortDeposit() {
        assertThatThrownBy(() -> safetyDepositService.post(1L, FILLER, 49_999))
                .isInstanceOf(InsufficientSafetyDepositException.class);
    }

    @Test
    @DisplayName("Second deposit from the same depositor is rejected")
    void rejectsDuplicate() {
        safetyDepositService.post(1L, FILLER, 50_000);

        assertThatThrownBy(() -> safetyDepositService.post(1L, FILLER, 50_000))
                .isInstanceOf(OrderStateException.class);
    }

    @Test
    @DisplayName("Order without a deposit requirement rejects deposits")
    void rejectsWhenNotRequired() {
        order.setSafetyDepositAmount(0);

        assertThatThrownBy(() -> safetyDepositService.post(1L, FILLER, 50_000))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Terminal order rejects deposits")
    void rejectsTerminalOrder() {
        order.setStatus(OrderStatus.CANCELLED);

        assertThatThrownBy(() -> safetyDepositService.post(1L, FILLER, 50_000))
                .isInstanceOf(OrderStateException.class);
    }

    @Test
    @DisplayName("Held deposits are returned once and marked RETURNED")
    void returnsDeposits() {
        safetyDepositService.post(1L, FILLER, 50_000);
        safetyDepositService.post(1L, "gina", 60_000);

        assertThat(safetyDepositService.returnHeldDeposits(order)).isEqualTo(110_000);
        assertThat(safetyDepositService.returnHeldDeposits(order)).isZero();

        verify(transferEmitter).emit(order, null, FILLER, 50_000, TransferReason.DEPOSIT_RETURN);
        verify(transferEmitter).emit(order, null, "gina", 60_000, TransferReason.DEPOSIT_RETURN);
        assertThat(safetyDepositService.depositsForOrder(1L))
                .extracting(SafetyDeposit::getStatus)
                .containsOnly(SafetyDepositStatus.RETURNED);
        assertThat(safetyDepositService.hasHeldDeposit(1L, FILLER)).isFalse();
    }
}
