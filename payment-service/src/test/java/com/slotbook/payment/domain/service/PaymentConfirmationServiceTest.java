package com.slotbook.payment.domain.service;

import com.slotbook.common.dto.BaseResponse;
import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import com.slotbook.payment.api.dto.ConfirmationResponse;
import com.slotbook.payment.api.dto.PaymentStatusResponse;
import com.slotbook.payment.api.dto.RedirectConfirmationRequest;
import com.slotbook.payment.client.BookingClient;
import com.slotbook.payment.client.dto.RazorpayPayment;
import com.slotbook.payment.client.dto.RazorpayPaymentCollection;
import com.slotbook.payment.client.dto.SettleBookingRequest;
import com.slotbook.payment.client.dto.SettlementView;
import com.slotbook.payment.config.RazorpayProperties;
import com.slotbook.payment.domain.model.PaymentOrder;
import com.slotbook.payment.domain.repository.PaymentOrderRepository;
import com.slotbook.payment.exception.InvalidSignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Redirect and polling confirmation against a mocked processor and booking-service.
 */
@ExtendWith(MockitoExtension.class)
class PaymentConfirmationServiceTest {

    /** HMAC-SHA256(test_key_secret, "order_N1|pay_P1") */
    private static final String VALID_SIGNATURE = "5cec31b5347d4787cca2b064902580327444e718b2b5e901d3d6e92bc352012c";

    @Mock
    private PaymentOrderRepository paymentOrderRepository;
    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private BookingClient bookingClient;

    private PaymentConfirmationService service;
    private PaymentOrder order;

    @BeforeEach
    void setUp() {
        SignatureVerifier verifier = new SignatureVerifier(
                new RazorpayProperties("http://localhost", "rzp_test_key", "test_key_secret", "wh", "INR"));
        service = new PaymentConfirmationService(paymentOrderRepository, paymentGateway, bookingClient, verifier);
        order = PaymentOrder.builder().id(1L).bookingId(42L).orderId("order_N1").amount(150000L)
                .currency("INR").status(PaymentOrder.OrderStatus.CREATED).build();
    }

    private static RazorpayPayment payment(String status, long amount) {
        return new RazorpayPayment("pay_P1", "order_N1", status, "upi", amount, "INR", null);
    }

    private static BaseResponse<SettlementView> settled(String outcome) {
        return BaseResponse.success(new SettlementView(42L, outcome, "pay_P1", "upi", LocalDateTime.now()));
    }

    @Test
    @DisplayName("redirect: valid signature and captured payment settles the booking once")
    void redirect_settles() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchPayment("pay_P1")).thenReturn(payment("captured", 150000L));
        when(bookingClient.settle(eq(42L), any())).thenReturn(settled("SETTLED"));

        ConfirmationResponse response = service.confirmByRedirect(
                new RedirectConfirmationRequest(42L, "pay_P1", "order_N1", VALID_SIGNATURE));

        assertThat(response.status()).isEqualTo(ConfirmationResponse.Status.SETTLED);
        verify(bookingClient, times(1)).settle(42L, new SettleBookingRequest("pay_P1", "upi"));
        verify(paymentOrderRepository).transition(eq("order_N1"), eq(PaymentOrder.OrderStatus.CREATED),
                eq(PaymentOrder.OrderStatus.PAID), eq("pay_P1"), eq("upi"), any());
    }

    @Test
    @DisplayName("redirect: invalid signature never reaches settlement")
    void redirect_invalidSignature() {
        RedirectConfirmationRequest request = new RedirectConfirmationRequest(42L, "pay_P1", "order_N1", "deadbeef");

        assertThatThrownBy(() -> service.confirmByRedirect(request))
                .isInstanceOf(InvalidSignatureException.class);
        verifyNoInteractions(bookingClient, paymentGateway);
    }

    @Test
    @DisplayName("redirect: payment not captured fails without settling")
    void redirect_notCaptured() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchPayment("pay_P1")).thenReturn(payment("authorized", 150000L));

        ConfirmationResponse response = service.confirmByRedirect(
                new RedirectConfirmationRequest(42L, "pay_P1", "order_N1", VALID_SIGNATURE));

        assertThat(response.status()).isEqualTo(ConfirmationResponse.Status.FAILED);
        assertThat(response.reason()).isEqualTo("Payment not captured");
        verifyNoInteractions(bookingClient);
    }

    @Test
    @DisplayName("redirect: captured payment for a different amount is not accepted")
    void redirect_amountMismatch() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchPayment("pay_P1")).thenReturn(payment("captured", 100L));

        ConfirmationResponse response = service.confirmByRedirect(
                new RedirectConfirmationRequest(42L, "pay_P1", "order_N1", VALID_SIGNATURE));

        assertThat(response.status()).isEqualTo(ConfirmationResponse.Status.FAILED);
        verifyNoInteractions(bookingClient);
    }

    @Test
    @DisplayName("redirect: order of another booking is rejected")
    void redirect_orderOfOtherBooking() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> service.confirmByRedirect(
                new RedirectConfirmationRequest(99L, "pay_P1", "order_N1", VALID_SIGNATURE)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo("ORDER_MISMATCH");
        verifyNoInteractions(bookingClient);
    }

    @Test
    @DisplayName("redirect: lost slot race marks the order for refund and propagates the conflict")
    void redirect_slotAlreadySold() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchPayment("pay_P1")).thenReturn(payment("captured", 150000L));
        when(bookingClient.settle(eq(42L), any())).thenThrow(new SlotAlreadySoldException("sold"));

        assertThatThrownBy(() -> service.confirmByRedirect(
                new RedirectConfirmationRequest(42L, "pay_P1", "order_N1", VALID_SIGNATURE)))
                .isInstanceOf(SlotAlreadySoldException.class);
        verify(paymentOrderRepository).transition(eq("order_N1"), eq(PaymentOrder.OrderStatus.CREATED),
                eq(PaymentOrder.OrderStatus.REFUND_REQUIRED), eq("pay_P1"), eq("upi"), any());
    }

    @Test
    @DisplayName("pollStatus: no captured payment yet is PENDING")
    void poll_pending() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchOrderPayments("order_N1")).thenReturn(
                new RazorpayPaymentCollection(1, List.of(payment("created", 150000L))));

        PaymentStatusResponse response = service.pollStatus(42L, "order_N1");

        assertThat(response.status()).isEqualTo(PaymentStatusResponse.Status.PENDING);
        verifyNoInteractions(bookingClient);
    }

    @Test
    @DisplayName("pollStatus: captured payment settles the booking")
    void poll_settles() {
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));
        when(paymentGateway.fetchOrderPayments("order_N1")).thenReturn(
                new RazorpayPaymentCollection(1, List.of(payment("captured", 150000L))));
        when(bookingClient.settle(eq(42L), any())).thenReturn(settled("SETTLED"));

        PaymentStatusResponse response = service.pollStatus(42L, "order_N1");

        assertThat(response.status()).isEqualTo(PaymentStatusResponse.Status.SETTLED);
        assertThat(response.paymentId()).isEqualTo("pay_P1");
    }

    @Test
    @DisplayName("pollStatus: order already recorded as paid answers SETTLED without asking the processor")
    void poll_alreadyPaid() {
        order.setStatus(PaymentOrder.OrderStatus.PAID);
        order.setPaymentId("pay_P1");
        when(paymentOrderRepository.findByOrderId("order_N1")).thenReturn(Optional.of(order));

        PaymentStatusResponse response = service.pollStatus(42L, "order_N1");

        assertThat(response.status()).isEqualTo(PaymentStatusResponse.Status.SETTLED);
        verifyNoInteractions(paymentGateway, bookingClient);
    }
}
