package com.slotbook.payment.exception;

import com.slotbook.common.exception.BusinessException;

/**
 * Signature did not match. The confirmation is rejected outright; the message is
 * deliberately generic.
 */
public class InvalidSignatureException extends BusinessException {

    public static final String ERROR_CODE = "PAYMENT_VERIFICATION_FAILED";

    public InvalidSignatureException() {
        super("Payment verification failed. If money was deducted it will be refunded.", ERROR_CODE);
    }
}
