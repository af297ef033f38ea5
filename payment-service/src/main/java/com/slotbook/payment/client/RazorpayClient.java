package com.slotbook.payment.client;

import com.slotbook.payment.client.dto.RazorpayOrder;
import com.slotbook.payment.client.dto.RazorpayOrderRequest;
import com.slotbook.payment.client.dto.RazorpayPayment;
import com.slotbook.payment.client.dto.RazorpayPaymentCollection;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the payment processor's REST API (Razorpay v1).
 * Authenticated with key id / key secret; see {@link RazorpayClientConfig}.
 */
@FeignClient(name = "razorpay", url = "${payment.razorpay.base-url}", path = "/v1",
        configuration = RazorpayClientConfig.class)
public interface RazorpayClient {

    @PostMapping("/orders")
    RazorpayOrder createOrder(@RequestBody RazorpayOrderRequest request);

    @GetMapping("/payments/{paymentId}")
    RazorpayPayment fetchPayment(@PathVariable("paymentId") String paymentId);

    @GetMapping("/orders/{orderId}/payments")
    RazorpayPaymentCollection fetchOrderPayments(@PathVariable("orderId") String orderId);
}
