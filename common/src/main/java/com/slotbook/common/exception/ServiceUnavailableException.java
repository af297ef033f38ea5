package com.slotbook.common.exception;

/**
 * A collaborator (payment processor, booking-service, database) is temporarily unavailable.
 * The caller may retry the same request later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
