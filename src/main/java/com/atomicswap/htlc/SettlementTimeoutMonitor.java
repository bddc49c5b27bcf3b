package com.atomicswap.htlc;

import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.exception.BaseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Expires cross-chain legs whose acknowledgement deadline passed without any delivery, so
 * their orders reach FAILED and become refundable even when the relayer never reports.
 * Each sequence is expired in its own transaction; one failure does not hold back the rest.
 */
@Component
public class SettlementTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(SettlementTimeoutMonitor.class);

    private final AcknowledgementHandler acknowledgementHandler;

    public SettlementTimeoutMonitor(AcknowledgementHandler acknowledgementHandler) {
        this.acknowledgementHandler = acknowledgementHandler;
    }

    @Scheduled(fixedRateString = "${atomicswap.settlement-timeout.interval-ms:30000}")
    public void expireOverdueSettlements() {
        List<Long> overdue = acknowledgementHandler.overdueSequences();
        int expired = 0;
        for (Long sequence : overdue) {
            try {
                if (acknowledgementHandler.acknowledge(sequence, AckOutcome.TIMEOUT).isApplied()) {
                    expired++;
                }
            } catch (BaseException | DataAccessException e) {
                log.warn("Failed to expire settlement: sequence={}, error={}", sequence, e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue cross-chain settlements", expired);
        }
    }
}
