package com.atomicswap.htlc;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.TimelockMode;
import com.atomicswap.domain.model.SwapOrder;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps (current time, ordered stage boundaries) to the order's resolution stage.
 *
 * <p>N strictly increasing boundaries split time into N + 1 intervals; a timestamp equal to a
 * boundary already belongs to the later interval. Single-timelock orders use one boundary
 * (OPEN, EXPIRED); staged orders use five:
 * <pre>
 *   [.. finality)               PENDING
 *   [finality .. taker)         TAKER_EXCLUSIVE, or FINALIZED when no taker is named
 *   [taker .. public)           PRIVATE_RESOLVER
 *   [public .. cancellation)    PUBLIC_RESOLVER
 *   [cancellation .. public c.) PRIVATE_CANCELLATION
 *   [public cancellation ..]    PUBLIC_CANCELLATION
 * </pre>
 *
 * <p>Terminal orders keep the stage they had when they left the active set.
 */
@Component
public class StageCalculator {

    private static final List<OrderStage> SINGLE_STAGES = List.of(OrderStage.OPEN, OrderStage.EXPIRED);

    private static final List<OrderStage> STAGED_WITH_TAKER = List.of(
            OrderStage.PENDING,
            OrderStage.TAKER_EXCLUSIVE,
            OrderStage.PRIVATE_RESOLVER,
            OrderStage.PUBLIC_RESOLVER,
            OrderStage.PRIVATE_CANCELLATION,
            OrderStage.PUBLIC_CANCELLATION);

    private static final List<OrderStage> STAGED_WITHOUT_TAKER = List.of(
            OrderStage.PENDING,
            OrderStage.FINALIZED,
            OrderStage.PRIVATE_RESOLVER,
            OrderStage.PUBLIC_RESOLVER,
            OrderStage.PRIVATE_CANCELLATION,
            OrderStage.PUBLIC_CANCELLATION);

    public OrderStage stageOf(SwapOrder order, long now) {
        if (order.getStatus() != null && order.getStatus().isTerminal() && order.getStage() != null) {
            return order.getStage();
        }
        return stageAt(now, order.boundaries(), stagesFor(order));
    }

    /**
     * Generic form: {@code stages.size()} must be {@code boundaries.size() + 1}.
     */
    public OrderStage stageAt(long now, List<Long> boundaries, List<OrderStage> stages) {
        if (stages.size() != boundaries.size() + 1) {
            throw new IllegalArgumentException(
                    "Expected " + (boundaries.size() + 1) + " stages for " + boundaries.size() + " boundaries");
        }
        return stages.get(intervalIndex(now, boundaries));
    }

    /**
     * Number of boundaries at or before {@code now}, i.e. the index of the interval containing it.
     */
    public int intervalIndex(long now, List<Long> boundaries) {
        int index = 0;
        Long previous = null;
        for (Long boundary : boundaries) {
            if (boundary == null) {
                throw new IllegalArgumentException("Stage boundary missing");
            }
            if (previous != null && boundary <= previous) {
                throw new IllegalArgumentException("Stage boundaries must be strictly increasing");
            }
            if (now >= boundary) {
                index++;
            }
            previous = boundary;
        }
        return index;
    }

    /** True once the order's refund window has opened, independent of any frozen stage. */
    public boolean isExpired(SwapOrder order, long now) {
        return now >= order.getExpiresAt();
    }

    private List<OrderStage> stagesFor(SwapOrder order) {
        if (order.getTimelockMode() == TimelockMode.SINGLE) {
            return SINGLE_STAGES;
        }
        return order.getTaker() != null ? STAGED_WITH_TAKER : STAGED_WITHOUT_TAKER;
    }
}
