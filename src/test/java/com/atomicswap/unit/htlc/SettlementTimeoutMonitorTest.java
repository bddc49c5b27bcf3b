package com.atomicswap.unit.htlc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.entity.SwapOrderEntity;
import com.atomicswap.htlc.AckResult;
import com.atomicswap.htlc.AcknowledgementHandler;
import com.atomicswap.htlc.SettlementTimeoutMonitor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

class SettlementTimeoutMonitorTest {

    private AcknowledgementHandler acknowledgementHandler;
    private SettlementTimeoutMonitor monitor;

    @BeforeEach
    void setUp() {
        acknowledgementHandler = mock(AcknowledgementHandler.class);
        monitor = new SettlementTimeoutMonitor(acknowledgementHandler);
    }

    @Test
    void expiresEveryOverdueSequenceAsTimeout() {
        when(acknowledgementHandler.overdueSequences()).thenReturn(List.of(3L, 5L));
        when(acknowledgementHandler.acknowledge(3L, AckOutcome.TIMEOUT)).thenReturn(applied(3L));
        when(acknowledgementHandler.acknowledge(5L, AckOutcome.TIMEOUT)).thenReturn(applied(5L));

        monitor.expireOverdueSettlements();

        verify(acknowledgementHandler).acknowledge(3L, AckOutcome.TIMEOUT);
        verify(acknowledgementHandler).acknowledge(5L, AckOutcome.TIMEOUT);
    }

    @Test
    void oneFailedExpiryDoesNotStopTheRest() {
        when(acknowledgementHandler.overdueSequences()).thenReturn(List.of(3L, 5L));
        when(acknowledgementHandler.acknowledge(3L, AckOutcome.TIMEOUT))
                .thenThrow(new ObjectOptimisticLockingFailureException(SwapOrderEntity.class, 1L));
        when(acknowledgementHandler.acknowledge(5L, AckOutcome.TIMEOUT)).thenReturn(applied(5L));

        monitor.expireOverdueSettlements();

        verify(acknowledgementHandler).acknowledge(5L, AckOutcome.TIMEOUT);
    }

    @Test
    void nothingOverdueTouchesNothing() {
        when(acknowledgementHandler.overdueSequences()).thenReturn(List.of());

        monitor.expireOverdueSettlements();

        verify(acknowledgementHandler, never()).acknowledge(anyLong(), any());
    }

    private static AckResult applied(long sequence) {
        return AckResult.builder()
                .sequence(sequence)
                .outcome(AckOutcome.TIMEOUT)
                .applied(true)
                .build();
    }
}
