package com.atomicswap.exception;

import java.util.Map;

/**
 * Rejected input: bad amounts, malformed hashlocks, timelocks out of range, fills outside
 * the order's bounds. Always raised before any state is touched.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
