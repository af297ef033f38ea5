package com.slotbook.payment.api.controller;

import com.slotbook.common.dto.BaseResponse;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.payment.api.dto.ConfirmationResponse;
import com.slotbook.payment.api.dto.CreateOrderRequest;
import com.slotbook.payment.api.dto.CreateOrderResponse;
import com.slotbook.payment.api.dto.PaymentStatusResponse;
import com.slotbook.payment.api.dto.PaymentWatchResponse;
import com.slotbook.payment.api.dto.RedirectConfirmationRequest;
import com.slotbook.payment.api.dto.UpiQrResponse;
import com.slotbook.payment.domain.polling.PaymentStatusPoller;
import com.slotbook.payment.domain.service.PaymentConfirmationService;
import com.slotbook.payment.domain.service.PaymentOrderService;
import com.slotbook.payment.domain.service.UpiPaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Checkout endpoints: order creation and the client-facing confirmation flows.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentOrderService paymentOrderService;
    private final PaymentConfirmationService confirmationService;
    private final UpiPaymentService upiPaymentService;
    private final PaymentStatusPoller paymentStatusPoller;

    @PostMapping("/orders")
    public ResponseEntity<BaseResponse<CreateOrderResponse>> createOrder(
            @Valid @RequestBody CreateOrderRequest request) {
        CreateOrderResponse response = paymentOrderService.createOrder(request.bookingId(), request.amount());
        return ResponseEntity.ok(BaseResponse.success("Order created", response));
    }

    /**
     * A payment that is not captured (or does not match the order) answers 402 so the client
     * shows the payment-failed view with {@code reason}.
     */
    @PostMapping("/confirmations/redirect")
    public ResponseEntity<BaseResponse<ConfirmationResponse>> confirmRedirect(
            @Valid @RequestBody RedirectConfirmationRequest request) {
        ConfirmationResponse response = confirmationService.confirmByRedirect(request);
        if (response.status() == ConfirmationResponse.Status.FAILED) {
            BaseResponse<ConfirmationResponse> body = BaseResponse.<ConfirmationResponse>builder()
                    .success(false)
                    .message(response.reason())
                    .errorCode("PAYMENT_NOT_CAPTURED")
                    .data(response)
                    .timestamp(Instant.now())
                    .build();
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(body);
        }
        return ResponseEntity.ok(BaseResponse.success("Payment confirmed", response));
    }

    @GetMapping("/orders/{orderId}/status")
    public ResponseEntity<BaseResponse<PaymentStatusResponse>> pollStatus(
            @PathVariable String orderId,
            @RequestParam Long bookingId) {
        PaymentStatusResponse response = confirmationService.pollStatus(bookingId, orderId);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/orders/{orderId}/upi")
    public ResponseEntity<BaseResponse<UpiQrResponse>> startUpiPayment(
            @PathVariable String orderId,
            @RequestParam Long bookingId) {
        UpiQrResponse response = upiPaymentService.startQrPayment(bookingId, orderId);
        return ResponseEntity.ok(BaseResponse.success("Scan the QR code to pay", response));
    }

    @GetMapping("/bookings/{bookingId}/watch")
    public ResponseEntity<BaseResponse<PaymentWatchResponse>> getWatch(@PathVariable Long bookingId) {
        PaymentWatchResponse response = paymentStatusPoller.find(bookingId)
                .map(PaymentWatchResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Payment watch", bookingId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @DeleteMapping("/bookings/{bookingId}/watch")
    public ResponseEntity<BaseResponse<PaymentWatchResponse>> cancelWatch(@PathVariable Long bookingId) {
        paymentStatusPoller.cancel(bookingId);
        PaymentWatchResponse response = paymentStatusPoller.find(bookingId)
                .map(PaymentWatchResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Payment watch", bookingId));
        return ResponseEntity.ok(BaseResponse.success("Payment watch stopped", response));
    }
}
