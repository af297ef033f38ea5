package com.slotbook.payment.domain.webhook;

import org.springframework.http.HttpStatus;

/**
 * Result of one webhook delivery. The HTTP status tells the processor whether to redeliver:
 * 2xx stops redelivery, 4xx flags a delivery it cannot fix by retrying, 5xx asks for a retry.
 */
public enum WebhookOutcome {
    PROCESSED(HttpStatus.OK, "OK"),
    ALREADY_PROCESSED(HttpStatus.OK, "Already processed"),
    IGNORED(HttpStatus.OK, "Event ignored"),
    AMOUNT_MISMATCH(HttpStatus.OK, "Payment amount does not match the booking, not settled"),
    SLOT_ALREADY_SOLD(HttpStatus.OK, "Slots already sold to another booking, refund required"),
    INVALID_SIGNATURE(HttpStatus.BAD_REQUEST, "Invalid signature"),
    MALFORMED(HttpStatus.BAD_REQUEST, "Malformed payload"),
    MISSING_BOOKING_REFERENCE(HttpStatus.BAD_REQUEST, "Missing booking reference"),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "Booking not found"),
    FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Processing failed");

    private final HttpStatus httpStatus;
    private final String message;

    WebhookOutcome(HttpStatus httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getMessage() {
        return message;
    }
}
