package com.slotbook.payment.domain.service;

import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import com.slotbook.payment.api.dto.ConfirmationResponse;
import com.slotbook.payment.api.dto.PaymentStatusResponse;
import com.slotbook.payment.api.dto.RedirectConfirmationRequest;
import com.slotbook.payment.client.BookingClient;
import com.slotbook.payment.client.dto.RazorpayPayment;
import com.slotbook.payment.client.dto.SettleBookingRequest;
import com.slotbook.payment.client.dto.SettlementView;
import com.slotbook.payment.domain.model.PaymentOrder;
import com.slotbook.payment.domain.repository.PaymentOrderRepository;
import com.slotbook.payment.exception.InvalidSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Redirect and polling confirmation flows, plus the settlement step every flow ends in.
 *
 * A payment is only settled after the processor itself reports it captured for the right
 * order and amount. Settlement is idempotent in booking-service, so flows may overlap freely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfirmationService {

    private final PaymentOrderRepository paymentOrderRepository;
    private final PaymentGateway paymentGateway;
    private final BookingClient bookingClient;
    private final SignatureVerifier signatureVerifier;

    /**
     * Redirect flow.
     *
     * @throws InvalidSignatureException if the signature over {@code orderId|paymentId} does not match
     * @throws SlotAlreadySoldException  if the slots went to another booking first
     */
    public ConfirmationResponse confirmByRedirect(RedirectConfirmationRequest request) {
        if (!signatureVerifier.isValidPaymentSignature(request.orderId(), request.paymentId(), request.signature())) {
            log.warn("Rejected redirect confirmation for booking {}: signature mismatch for order {} payment {}",
                    request.bookingId(), request.orderId(), request.paymentId());
            throw new InvalidSignatureException();
        }

        PaymentOrder order = findOrderOfBooking(request.orderId(), request.bookingId());
        if (order.getStatus() == PaymentOrder.OrderStatus.PAID && request.paymentId().equals(order.getPaymentId())) {
            return ConfirmationResponse.settled(order.getBookingId(), order.getPaymentId());
        }

        RazorpayPayment payment = paymentGateway.fetchPayment(request.paymentId());
        if (!belongsTo(payment, order)) {
            log.warn("Payment {} does not match order {} (order {}, amount {})",
                    payment.id(), order.getOrderId(), payment.orderId(), payment.amount());
            return ConfirmationResponse.failed(order.getBookingId(), request.paymentId(),
                    "Payment does not match the order");
        }
        if (!payment.isCaptured()) {
            log.info("Payment {} for booking {} not captured yet (status {})",
                    payment.id(), order.getBookingId(), payment.status());
            return ConfirmationResponse.failed(order.getBookingId(), payment.id(), "Payment not captured");
        }

        settleCaptured(order.getBookingId(), Optional.of(order), payment);
        return ConfirmationResponse.settled(order.getBookingId(), payment.id());
    }

    /**
     * One status check of the polling flow.
     *
     * @throws SlotAlreadySoldException if a captured payment was found but the slots were sold to another booking
     */
    public PaymentStatusResponse pollStatus(Long bookingId, String orderId) {
        PaymentOrder order = findOrderOfBooking(orderId, bookingId);
        switch (order.getStatus()) {
            case PAID:
                return new PaymentStatusResponse(bookingId, orderId, PaymentStatusResponse.Status.SETTLED,
                        order.getPaymentId());
            case REFUND_REQUIRED:
                return new PaymentStatusResponse(bookingId, orderId, PaymentStatusResponse.Status.SLOT_ALREADY_SOLD,
                        order.getPaymentId());
            default:
                break;
        }

        Optional<RazorpayPayment> captured = paymentGateway.fetchOrderPayments(orderId).itemsOrEmpty().stream()
                .filter(RazorpayPayment::isCaptured)
                .filter(payment -> belongsTo(payment, order))
                .findFirst();
        if (captured.isEmpty()) {
            return PaymentStatusResponse.pending(bookingId, orderId);
        }

        RazorpayPayment payment = captured.get();
        settleCaptured(bookingId, Optional.of(order), payment);
        return new PaymentStatusResponse(bookingId, orderId, PaymentStatusResponse.Status.SETTLED, payment.id());
    }

    /**
     * Settles a booking for a payment the processor reported captured and records the result
     * on the local order, when there is one.
     *
     * @return the booking-service verdict, {@code ALREADY_SETTLED} for repeats
     */
    public SettlementView settleCaptured(Long bookingId, Optional<PaymentOrder> order, RazorpayPayment payment) {
        SettlementView settlement;
        try {
            settlement = bookingClient.settle(bookingId, new SettleBookingRequest(payment.id(), payment.method()))
                    .getData();
        } catch (SlotAlreadySoldException e) {
            log.error("Captured payment {} for booking {} lost its slots; refund required", payment.id(), bookingId);
            order.ifPresent(o -> paymentOrderRepository.transition(o.getOrderId(), PaymentOrder.OrderStatus.CREATED,
                    PaymentOrder.OrderStatus.REFUND_REQUIRED, payment.id(), payment.method(), LocalDateTime.now()));
            throw e;
        }
        order.ifPresent(o -> paymentOrderRepository.transition(o.getOrderId(), PaymentOrder.OrderStatus.CREATED,
                PaymentOrder.OrderStatus.PAID, payment.id(), payment.method(), LocalDateTime.now()));
        log.info("Payment {} settled booking {} ({})", payment.id(), bookingId,
                settlement != null ? settlement.outcome() : "no body");
        return settlement;
    }

    private PaymentOrder findOrderOfBooking(String orderId, Long bookingId) {
        PaymentOrder order = paymentOrderRepository.findByOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment order", orderId));
        if (!order.getBookingId().equals(bookingId)) {
            log.warn("Order {} belongs to booking {}, not {}", orderId, order.getBookingId(), bookingId);
            throw new BusinessException("Order does not belong to this booking", "ORDER_MISMATCH");
        }
        return order;
    }

    private static boolean belongsTo(RazorpayPayment payment, PaymentOrder order) {
        return Objects.equals(payment.orderId(), order.getOrderId())
                && Objects.equals(payment.amount(), order.getAmount());
    }
}
