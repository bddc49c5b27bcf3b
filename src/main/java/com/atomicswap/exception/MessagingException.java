package com.atomicswap.exception;

public class MessagingException extends BaseException {

    public MessagingException(String message, Throwable cause) {
        super(ErrorCode.MESSAGING_ERROR, message, cause);
    }
}
