package com.atomicswap.htlc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically walks open orders and persists stage moves, so listeners see STAGE_CHANGED
 * events and listings show the current stage even for orders nobody touches. Never changes
 * lifecycle status: expiry alone does not cancel anything. A pass that races a settlement
 * loses and is retried on the next tick.
 */
@Component
public class StageRefreshMonitor {

    private static final Logger log = LoggerFactory.getLogger(StageRefreshMonitor.class);

    private final OrderStore orderStore;

    public StageRefreshMonitor(OrderStore orderStore) {
        this.orderStore = orderStore;
    }

    @Scheduled(fixedRateString = "${atomicswap.stage-refresh.interval-ms:5000}")
    public void refreshStages() {
        try {
            int changed = orderStore.refreshOpenStages();
            if (changed > 0) {
                log.debug("Stage refresh moved {} orders", changed);
            }
        } catch (OptimisticLockingFailureException e) {
            log.warn("Stage refresh lost a race with a concurrent update, retrying next tick: {}", e.getMessage());
        }
    }
}
