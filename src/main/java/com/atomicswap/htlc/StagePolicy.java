package com.atomicswap.htlc;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.resolver.ResolverRegistry;
import org.springframework.stereotype.Component;

/**
 * Who may withdraw, fill or cancel in each stage.
 *
 * <p>Withdrawal widens from the taker to privileged resolvers to anyone; cancellation mirrors
 * that gradient starting from the sender. A privileged resolver is one on the order's
 * whitelist or enabled in the {@link ResolverRegistry}.
 */
@Component
public class StagePolicy {

    private final ResolverRegistry resolverRegistry;

    public StagePolicy(ResolverRegistry resolverRegistry) {
        this.resolverRegistry = resolverRegistry;
    }

    public boolean canWithdraw(SwapOrder order, OrderStage stage, String caller) {
        return switch (stage) {
            case OPEN -> caller.equals(order.getReceiver()) || isTaker(order, caller);
            case FINALIZED -> caller.equals(order.getReceiver());
            case TAKER_EXCLUSIVE -> isTaker(order, caller);
            case PRIVATE_RESOLVER -> isTaker(order, caller) || isPrivileged(order, caller);
            case PUBLIC_RESOLVER -> true;
            default -> false;
        };
    }

    public boolean canFill(SwapOrder order, OrderStage stage, String caller) {
        return switch (stage) {
            case OPEN, PUBLIC_RESOLVER -> true;
            case TAKER_EXCLUSIVE -> isTaker(order, caller);
            case FINALIZED -> isPrivileged(order, caller);
            case PRIVATE_RESOLVER -> isTaker(order, caller) || isPrivileged(order, caller);
            default -> false;
        };
    }

    public boolean canCancel(SwapOrder order, OrderStage stage, String caller) {
        return switch (stage) {
            case EXPIRED -> caller.equals(order.getSender());
            case PRIVATE_CANCELLATION -> caller.equals(order.getSender()) || isPrivileged(order, caller);
            case PUBLIC_CANCELLATION -> true;
            default -> false;
        };
    }

    public boolean isPrivileged(SwapOrder order, String caller) {
        return order.isWhitelisted(caller) || resolverRegistry.isEnabled(caller);
    }

    private boolean isTaker(SwapOrder order, String caller) {
        return order.getTaker() != null && order.getTaker().equals(caller);
    }
}
