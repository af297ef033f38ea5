package com.slotbook.payment.domain.service;

import com.slotbook.common.exception.BusinessException;
import com.slotbook.payment.client.RazorpayClient;
import com.slotbook.payment.client.dto.RazorpayOrder;
import com.slotbook.payment.client.dto.RazorpayOrderRequest;
import com.slotbook.payment.client.dto.RazorpayPayment;
import com.slotbook.payment.client.dto.RazorpayPaymentCollection;
import com.slotbook.payment.exception.GatewayUnavailableException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resilience wrapper around {@link RazorpayClient}.
 *
 * Reads are retried a bounded number of times. Order creation is not retried here because a
 * retry could open a second order at the processor; callers retry it explicitly and the
 * existing booking is reused. Processor 4xx answers are business rejections, everything else
 * becomes {@link GatewayUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGateway {

    private static final String PROCESSOR = "razorpay";

    private final RazorpayClient razorpayClient;

    @CircuitBreaker(name = PROCESSOR, fallbackMethod = "createOrderFallback")
    public RazorpayOrder createOrder(RazorpayOrderRequest request) {
        return razorpayClient.createOrder(request);
    }

    @Retry(name = PROCESSOR, fallbackMethod = "fetchPaymentFallback")
    @CircuitBreaker(name = PROCESSOR)
    public RazorpayPayment fetchPayment(String paymentId) {
        return razorpayClient.fetchPayment(paymentId);
    }

    @Retry(name = PROCESSOR, fallbackMethod = "fetchOrderPaymentsFallback")
    @CircuitBreaker(name = PROCESSOR)
    public RazorpayPaymentCollection fetchOrderPayments(String orderId) {
        return razorpayClient.fetchOrderPayments(orderId);
    }

    private RazorpayOrder createOrderFallback(RazorpayOrderRequest request, Throwable e) {
        throw translate("create order for receipt " + request.receipt(), e);
    }

    private RazorpayPayment fetchPaymentFallback(String paymentId, Throwable e) {
        throw translate("fetch payment " + paymentId, e);
    }

    private RazorpayPaymentCollection fetchOrderPaymentsFallback(String orderId, Throwable e) {
        throw translate("fetch payments of order " + orderId, e);
    }

    private RuntimeException translate(String operation, Throwable e) {
        if (e instanceof FeignException fe && fe.status() >= 400 && fe.status() < 500) {
            log.warn("Payment processor rejected {}: HTTP {}", operation, fe.status());
            return new BusinessException("Payment processor rejected the request", "PAYMENT_REJECTED");
        }
        log.warn("Payment processor unavailable, could not {}: {}", operation, e.toString());
        return new GatewayUnavailableException("Payment processor unavailable, please retry", e);
    }
}
