package com.slotbook.payment.exception;

import com.slotbook.common.exception.ServiceUnavailableException;

/**
 * The payment processor could not be reached or failed. Retrying later with the same
 * booking reuses it; no order is recorded for a failed attempt.
 */
public class GatewayUnavailableException extends ServiceUnavailableException {

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
