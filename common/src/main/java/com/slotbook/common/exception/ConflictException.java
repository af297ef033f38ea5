package com.slotbook.common.exception;

/**
 * The request collides with state another request already committed. Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
