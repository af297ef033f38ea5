package com.slotbook.payment.domain.service;

import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.payment.api.dto.PaymentWatchResponse;
import com.slotbook.payment.api.dto.UpiQrResponse;
import com.slotbook.payment.config.RazorpayProperties;
import com.slotbook.payment.config.UpiProperties;
import com.slotbook.payment.domain.model.PaymentOrder;
import com.slotbook.payment.domain.polling.PaymentStatusPoller;
import com.slotbook.payment.domain.polling.PaymentWatch;
import com.slotbook.payment.domain.repository.PaymentOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * QR payments. The customer pays from a UPI app outside the browser, so confirmation comes
 * from a payment watch (or the webhook), never from a redirect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpiPaymentService {

    private final PaymentOrderRepository paymentOrderRepository;
    private final PaymentStatusPoller paymentStatusPoller;
    private final UpiProperties upiProperties;
    private final RazorpayProperties razorpayProperties;

    public UpiQrResponse startQrPayment(Long bookingId, String orderId) {
        PaymentOrder order = paymentOrderRepository.findByOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment order", orderId));
        if (!order.getBookingId().equals(bookingId)) {
            throw new BusinessException("Order does not belong to this booking", "ORDER_MISMATCH");
        }
        if (order.getStatus() != PaymentOrder.OrderStatus.CREATED) {
            throw new BusinessException("Order is no longer awaiting payment", "ORDER_CLOSED");
        }

        PaymentWatch watch = paymentStatusPoller.watch(bookingId, orderId);
        log.info("Issued UPI QR for booking {} order {}", bookingId, orderId);
        return new UpiQrResponse(bookingId, orderId, upiUri(order), PaymentWatchResponse.from(watch));
    }

    String upiUri(PaymentOrder order) {
        String amount = BigDecimal.valueOf(order.getAmount(), 2).toPlainString();
        String currency = order.getCurrency() != null ? order.getCurrency() : razorpayProperties.currency();
        return "upi://pay"
                + "?pa=" + encode(upiProperties.merchantVpa())
                + "&pn=" + encode(upiProperties.payeeName())
                + "&tr=" + encode(order.getOrderId())
                + "&am=" + amount
                + "&cu=" + encode(currency);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
