package com.slotbook.payment.domain.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import com.slotbook.common.util.Constants;
import com.slotbook.payment.client.BookingClient;
import com.slotbook.payment.client.dto.BookingView;
import com.slotbook.payment.client.dto.RazorpayPayment;
import com.slotbook.payment.client.dto.RazorpayWebhookEvent;
import com.slotbook.payment.domain.model.PaymentOrder;
import com.slotbook.payment.domain.repository.PaymentOrderRepository;
import com.slotbook.payment.domain.service.PaymentConfirmationService;
import com.slotbook.payment.domain.service.PaymentOrderService;
import com.slotbook.payment.domain.service.SignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Server-pushed confirmation flow. Works without any client session, so it is the path that
 * finalizes payments whose customer closed the browser.
 *
 * The signature is checked over the exact bytes received, before anything is parsed.
 * Deliveries are at-least-once; a repeat for a settled booking is acknowledged with 200.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookService {

    private final SignatureVerifier signatureVerifier;
    private final PaymentOrderRepository paymentOrderRepository;
    private final PaymentConfirmationService confirmationService;
    private final BookingClient bookingClient;
    private final ObjectMapper objectMapper;

    public WebhookOutcome handle(byte[] rawBody, String signature) {
        if (rawBody == null || rawBody.length == 0 || !signatureVerifier.isValidWebhookSignature(rawBody, signature)) {
            log.warn("Rejected webhook delivery: invalid signature");
            return WebhookOutcome.INVALID_SIGNATURE;
        }

        RazorpayWebhookEvent event;
        try {
            event = objectMapper.readValue(rawBody, RazorpayWebhookEvent.class);
        } catch (IOException e) {
            log.warn("Rejected webhook delivery: unreadable payload: {}", e.getMessage());
            return WebhookOutcome.MALFORMED;
        }

        if (!RazorpayWebhookEvent.PAYMENT_CAPTURED.equals(event.event())) {
            log.debug("Ignoring webhook event {}", event.event());
            return WebhookOutcome.IGNORED;
        }
        Optional<RazorpayPayment> maybePayment = event.payment();
        if (maybePayment.isEmpty() || maybePayment.get().id() == null) {
            return WebhookOutcome.MALFORMED;
        }
        RazorpayPayment payment = maybePayment.get();

        Optional<PaymentOrder> order = Optional.ofNullable(payment.orderId())
                .flatMap(paymentOrderRepository::findByOrderId);
        Long bookingId = resolveBookingId(payment, order);
        if (bookingId == null) {
            log.warn("Webhook for payment {} carries no booking reference", payment.id());
            return WebhookOutcome.MISSING_BOOKING_REFERENCE;
        }

        if (order.isPresent() && !Objects.equals(order.get().getAmount(), payment.amount())) {
            log.error("Webhook payment {} amount {} differs from order {} amount {}; not settling",
                    payment.id(), payment.amount(), order.get().getOrderId(), order.get().getAmount());
            return WebhookOutcome.AMOUNT_MISMATCH;
        }
        if (order.isPresent() && order.get().getStatus() == PaymentOrder.OrderStatus.PAID) {
            log.info("Webhook for payment {} repeats an already settled booking {}", payment.id(), bookingId);
            return WebhookOutcome.ALREADY_PROCESSED;
        }
        if (order.isPresent() && order.get().getStatus() == PaymentOrder.OrderStatus.REFUND_REQUIRED) {
            return WebhookOutcome.SLOT_ALREADY_SOLD;
        }

        try {
            if (order.isEmpty() && !matchesBookingTotal(bookingId, payment)) {
                return WebhookOutcome.AMOUNT_MISMATCH;
            }
            var settlement = confirmationService.settleCaptured(bookingId, order, payment);
            if (settlement != null && settlement.alreadySettled()) {
                return WebhookOutcome.ALREADY_PROCESSED;
            }
            log.info("Webhook settled booking {} with payment {}", bookingId, payment.id());
            return WebhookOutcome.PROCESSED;
        } catch (SlotAlreadySoldException e) {
            return WebhookOutcome.SLOT_ALREADY_SOLD;
        } catch (ResourceNotFoundException e) {
            log.warn("Webhook for payment {} references unknown booking {}", payment.id(), bookingId);
            return WebhookOutcome.BOOKING_NOT_FOUND;
        } catch (RuntimeException e) {
            log.error("Webhook processing failed for payment {} booking {}", payment.id(), bookingId, e);
            return WebhookOutcome.FAILED;
        }
    }

    /**
     * Without a local order the booking total is the only amount to check against.
     *
     * @throws ResourceNotFoundException if booking-service does not know the booking
     */
    private boolean matchesBookingTotal(Long bookingId, RazorpayPayment payment) {
        BookingView booking = bookingClient.getBooking(bookingId).getData();
        if (booking == null) {
            throw new ResourceNotFoundException("Booking", bookingId);
        }
        if (booking.totalAmount() == null
                || !Objects.equals(PaymentOrderService.toMinorUnits(booking.totalAmount()), payment.amount())) {
            log.error("Webhook payment {} amount {} differs from booking {} total {}; not settling",
                    payment.id(), payment.amount(), bookingId, booking.totalAmount());
            return false;
        }
        return true;
    }

    private Long resolveBookingId(RazorpayPayment payment, Optional<PaymentOrder> order) {
        Optional<String> note = payment.note(Constants.BOOKING_ID_NOTE);
        if (note.isPresent()) {
            try {
                return Long.valueOf(note.get());
            } catch (NumberFormatException e) {
                log.warn("Webhook for payment {} has non-numeric booking reference '{}'", payment.id(), note.get());
            }
        }
        return order.map(PaymentOrder::getBookingId).orElse(null);
    }
}
