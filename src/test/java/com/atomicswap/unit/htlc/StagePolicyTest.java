package com.atomicswap.unit.htlc;

import static com.atomicswap.support.SwapFixtures.RECEIVER;
import static com.atomicswap.support.SwapFixtures.RESOLVER;
import static com.atomicswap.support.SwapFixtures.SENDER;
import static com.atomicswap.support.SwapFixtures.STRANGER;
import static com.atomicswap.support.SwapFixtures.TAKER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.htlc.StagePolicy;
import com.atomicswap.resolver.ResolverRegistry;
import com.atomicswap.support.SwapFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StagePolicy covering the withdraw, fill and cancel permission tables.
 */
class StagePolicyTest {

    private static final String REGISTERED = "reggie";

    private ResolverRegistry resolverRegistry;
    private StagePolicy stagePolicy;
    private SwapOrder order;

    @BeforeEach
    void setUp() {
        resolverRegistry = mock(ResolverRegistry.class);
        when(resolverRegistry.isEnabled(REGISTERED)).thenReturn(true);
        stagePolicy = new StagePolicy(resolverRegistry);
        order = SwapFixtures.stagedOrder(1L);
    }

    @Nested
    @DisplayName("Withdraw")
    class WithdrawPermissions {

        @Test
        @DisplayName("OPEN admits receiver and taker only")
        void openStage() {
            assertThat(stagePolicy.canWithdraw(order, OrderStage.OPEN, RECEIVER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.OPEN, TAKER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.OPEN, RESOLVER)).isFalse();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.OPEN, SENDER)).isFalse();
        }

        @Test
        @DisplayName("TAKER_EXCLUSIVE admits the taker only")
        void takerExclusive() {
            assertThat(stagePolicy.canWithdraw(order, OrderStage.TAKER_EXCLUSIVE, TAKER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.TAKER_EXCLUSIVE, RESOLVER)).isFalse();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.TAKER_EXCLUSIVE, RECEIVER)).isFalse();
        }

        @Test
        @DisplayName("FINALIZED admits the receiver")
        void finalized() {
            assertThat(stagePolicy.canWithdraw(order, OrderStage.FINALIZED, RECEIVER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.FINALIZED, RESOLVER)).isFalse();
        }

        @Test
        @DisplayName("PRIVATE_RESOLVER admits taker, whitelisted and registry resolvers")
        void privateResolver() {
            assertThat(stagePolicy.canWithdraw(order, OrderStage.PRIVATE_RESOLVER, TAKER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.PRIVATE_RESOLVER, RESOLVER)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.PRIVATE_RESOLVER, REGISTERED)).isTrue();
            assertThat(stagePolicy.canWithdraw(order, OrderStage.PRIVATE_RESOLVER, STRANGER)).isFalse();
        }

        @Test
        @DisplayName("PUBLIC_RESOLVER admits anyone")
        void publicResolver() {
            assertThat(stagePolicy.canWithdraw(order, OrderStage.PUBLIC_RESOLVER, STRANGER)).isTrue();
        }

        @Test
        @DisplayName("No one withdraws in PENDING or cancellation stages")
        void closedStages() {
            for (OrderStage stage : new OrderStage[] {
                OrderStage.PENDING, OrderStage.EXPIRED, OrderStage.PRIVATE_CANCELLATION, OrderStage.PUBLIC_CANCELLATION
            }) {
                assertThat(stagePolicy.canWithdraw(order, stage, RECEIVER)).as(stage.name()).isFalse();
                assertThat(stagePolicy.canWithdraw(order, stage, TAKER)).as(stage.name()).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("Fill")
    class FillPermissions {

        @Test
        @DisplayName("OPEN and PUBLIC_RESOLVER admit anyone")
        void openStages() {
            assertThat(stagePolicy.canFill(order, OrderStage.OPEN, STRANGER)).isTrue();
            assertThat(stagePolicy.canFill(order, OrderStage.PUBLIC_RESOLVER, STRANGER)).isTrue();
        }

        @Test
        @DisplayName("TAKER_EXCLUSIVE admits the taker only")
        void takerExclusive() {
            assertThat(stagePolicy.canFill(order, OrderStage.TAKER_EXCLUSIVE, TAKER)).isTrue();
            assertThat(stagePolicy.canFill(order, OrderStage.TAKER_EXCLUSIVE, RESOLVER)).isFalse();
        }

        @Test
        @DisplayName("FINALIZED admits privileged resolvers")
        void finalized() {
            assertThat(stagePolicy.canFill(order, OrderStage.FINALIZED, RESOLVER)).isTrue();
            assertThat(stagePolicy.canFill(order, OrderStage.FINALIZED, STRANGER)).isFalse();
        }

        @Test
        @DisplayName("Nobody fills during PENDING")
        void pending() {
            assertThat(stagePolicy.canFill(order, OrderStage.PENDING, TAKER)).isFalse();
        }
    }

    @Nested
    @DisplayName("Cancel")
    class CancelPermissions {

        @Test
        @DisplayName("EXPIRED admits the sender only")
        void expired() {
            assertThat(stagePolicy.canCancel(order, OrderStage.EXPIRED, SENDER)).isTrue();
            assertThat(stagePolicy.canCancel(order, OrderStage.EXPIRED, RESOLVER)).isFalse();
        }

        @Test
        @DisplayName("PRIVATE_CANCELLATION admits sender and privileged resolvers")
        void privateCancellation() {
            assertThat(stagePolicy.canCancel(order, OrderStage.PRIVATE_CANCELLATION, SENDER)).isTrue();
            assertThat(stagePolicy.canCancel(order, OrderStage.PRIVATE_CANCELLATION, RESOLVER)).isTrue();
            assertThat(stagePolicy.canCancel(order, OrderStage.PRIVATE_CANCELLATION, REGISTERED)).isTrue();
            assertThat(stagePolicy.canCancel(order, OrderStage.PRIVATE_CANCELLATION, STRANGER)).isFalse();
        }

        @Test
        @DisplayName("PUBLIC_CANCELLATION admits anyone")
        void publicCancellation() {
            assertThat(stagePolicy.canCancel(order, OrderStage.PUBLIC_CANCELLATION, STRANGER)).isTrue();
        }

        @Test
        @DisplayName("Settlement stages never allow cancellation")
        void settlementStages() {
            assertThat(stagePolicy.canCancel(order, OrderStage.OPEN, SENDER)).isFalse();
            assertThat(stagePolicy.canCancel(order, OrderStage.PUBLIC_RESOLVER, SENDER)).isFalse();
        }
    }

    @Test
    @DisplayName("A disabled registry entry is not privileged")
    void disabledRegistryEntryNotPrivileged() {
        when(resolverRegistry.isEnabled(REGISTERED)).thenReturn(false);

        assertThat(stagePolicy.isPrivileged(order, REGISTERED)).isFalse();
        assertThat(stagePolicy.isPrivileged(order, RESOLVER)).isTrue();
    }
}
