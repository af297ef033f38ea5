package com.slotbook.payment.domain.service;

import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.util.Constants;
import com.slotbook.payment.api.dto.CreateOrderResponse;
import com.slotbook.payment.client.BookingClient;
import com.slotbook.payment.client.dto.BookingView;
import com.slotbook.payment.client.dto.RazorpayOrder;
import com.slotbook.payment.client.dto.RazorpayOrderRequest;
import com.slotbook.payment.config.RazorpayProperties;
import com.slotbook.payment.domain.model.PaymentOrder;
import com.slotbook.payment.domain.repository.PaymentOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * Payment order gateway: one processor order per booking, tagged with the booking id.
 *
 * No transaction is held across the processor call. A retry after a failed call simply
 * tries again for the same booking; a retry after a successful one returns the stored order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrderService {

    private final PaymentOrderRepository paymentOrderRepository;
    private final BookingClient bookingClient;
    private final PaymentGateway paymentGateway;
    private final RazorpayProperties razorpayProperties;

    /**
     * @param amount booking total in major units, as shown at checkout
     * @throws BusinessException           if the booking is paid or the amount differs from its total
     * @throws ResourceNotFoundException   if the booking does not exist
     * @throws com.slotbook.payment.exception.GatewayUnavailableException if the processor is unavailable
     */
    public CreateOrderResponse createOrder(Long bookingId, BigDecimal amount) {
        long amountMinor = toMinorUnits(amount);

        Optional<PaymentOrder> existing = paymentOrderRepository.findByBookingId(bookingId);
        if (existing.isPresent()) {
            return reuse(existing.get(), amountMinor);
        }

        BookingView booking = bookingClient.getBooking(bookingId).getData();
        if (booking == null) {
            throw new ResourceNotFoundException("Booking", bookingId);
        }
        if (booking.paid()) {
            throw new BusinessException("Booking " + bookingId + " is already paid", "ALREADY_PAID");
        }
        if (booking.totalAmount() == null || booking.totalAmount().compareTo(amount) != 0) {
            throw new BusinessException("Amount does not match the booking total", "AMOUNT_MISMATCH");
        }

        RazorpayOrder order = paymentGateway.createOrder(new RazorpayOrderRequest(
                amountMinor,
                razorpayProperties.currency(),
                String.valueOf(bookingId),
                Map.of(Constants.BOOKING_ID_NOTE, String.valueOf(bookingId))));

        PaymentOrder paymentOrder = PaymentOrder.builder()
                .bookingId(bookingId)
                .orderId(order.id())
                .amount(order.amount())
                .currency(order.currency())
                .status(PaymentOrder.OrderStatus.CREATED)
                .build();
        try {
            paymentOrder = paymentOrderRepository.saveAndFlush(paymentOrder);
        } catch (DataIntegrityViolationException e) {
            PaymentOrder winner = paymentOrderRepository.findByBookingId(bookingId).orElseThrow(() -> e);
            log.warn("Concurrent order creation for booking {}: keeping {}, processor order {} stays unused",
                    bookingId, winner.getOrderId(), order.id());
            return CreateOrderResponse.from(winner, razorpayProperties.keyId());
        }

        log.info("Created processor order {} for booking {}: {} {}", order.id(), bookingId, order.amount(), order.currency());
        return CreateOrderResponse.from(paymentOrder, razorpayProperties.keyId());
    }

    private CreateOrderResponse reuse(PaymentOrder order, long amountMinor) {
        if (order.getStatus() != PaymentOrder.OrderStatus.CREATED) {
            throw new BusinessException("Booking " + order.getBookingId() + " already has a completed payment",
                    "ALREADY_PAID");
        }
        if (order.getAmount() != amountMinor) {
            throw new BusinessException("Amount does not match the booking total", "AMOUNT_MISMATCH");
        }
        log.info("Reusing processor order {} for booking {}", order.getOrderId(), order.getBookingId());
        return CreateOrderResponse.from(order, razorpayProperties.keyId());
    }

    public static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
