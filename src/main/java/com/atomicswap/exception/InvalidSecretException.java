package com.atomicswap.exception;

import java.util.Map;

public class InvalidSecretException extends BaseException {

    public InvalidSecretException(Long orderId) {
        super(ErrorCode.INVALID_SECRET, "Secret does not match hashlock", Map.of("orderId", orderId));
    }
}
