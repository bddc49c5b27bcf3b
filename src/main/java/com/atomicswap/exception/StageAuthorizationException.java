package com.atomicswap.exception;

import com.atomicswap.domain.enums.OrderStage;
import java.util.Map;

/**
 * The caller is not entitled to perform the requested action in the order's current stage.
 */
public class StageAuthorizationException extends BaseException {

    public StageAuthorizationException(Long orderId, String caller, OrderStage stage, String action) {
        super(
                ErrorCode.FORBIDDEN,
                String.format("%s is not authorized to %s order %d in stage %s", caller, action, orderId, stage),
                Map.of("orderId", orderId, "caller", caller, "stage", stage.name(), "action", action));
    }
}
