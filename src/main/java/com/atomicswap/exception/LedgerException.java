package com.atomicswap.exception;

public class LedgerException extends BaseException {

    public LedgerException(String message) {
        super(ErrorCode.LEDGER_ERROR, message);
    }

    public LedgerException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_ERROR, message, cause);
    }
}
