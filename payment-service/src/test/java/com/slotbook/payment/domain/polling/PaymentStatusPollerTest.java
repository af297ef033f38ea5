package com.slotbook.payment.domain.polling;

import com.slotbook.common.exception.ServiceUnavailableException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import com.slotbook.payment.api.dto.PaymentStatusResponse;
import com.slotbook.payment.domain.service.PaymentConfirmationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Runs watches on a real scheduler with a short interval.
 */
@ExtendWith(MockitoExtension.class)
class PaymentStatusPollerTest {

    private static final long BOOKING_ID = 42L;
    private static final String ORDER_ID = "order_N1";

    @Mock
    private PaymentConfirmationService confirmationService;

    private ThreadPoolTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("poll-test-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private PaymentStatusPoller poller(long intervalMs, int maxAttempts) {
        return new PaymentStatusPoller(confirmationService, scheduler, intervalMs, maxAttempts, 30);
    }

    private static PaymentStatusResponse pending() {
        return PaymentStatusResponse.pending(BOOKING_ID, ORDER_ID);
    }

    private static PaymentStatusResponse settled() {
        return new PaymentStatusResponse(BOOKING_ID, ORDER_ID, PaymentStatusResponse.Status.SETTLED, "pay_P1");
    }

    @Test
    @DisplayName("first observed capture ends the watch as SETTLED and stops polling")
    void settlesOnThirdAttempt() throws Exception {
        when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID)).thenReturn(pending(), pending(), settled());

        PaymentWatch watch = poller(20, 30).watch(BOOKING_ID, ORDER_ID);

        assertThat(watch.outcome().get(5, TimeUnit.SECONDS)).isEqualTo(PaymentWatch.State.SETTLED);
        Thread.sleep(100);
        assertThat(watch.attempts()).isEqualTo(3);
        verify(confirmationService, times(3)).pollStatus(BOOKING_ID, ORDER_ID);
    }

    @Test
    @DisplayName("exhausting the attempt budget ends as TIMEOUT without settling")
    void timesOut() throws Exception {
        when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID)).thenReturn(pending());

        PaymentWatch watch = poller(10, 3).watch(BOOKING_ID, ORDER_ID);

        assertThat(watch.outcome().get(5, TimeUnit.SECONDS)).isEqualTo(PaymentWatch.State.TIMEOUT);
        Thread.sleep(100);
        verify(confirmationService, times(3)).pollStatus(BOOKING_ID, ORDER_ID);
        verify(confirmationService, never()).settleCaptured(any(), any(), any());
    }

    @Test
    @DisplayName("failed checks count as attempts")
    void failuresCountAsAttempts() throws Exception {
        when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID))
                .thenThrow(new ServiceUnavailableException("processor down"));

        PaymentWatch watch = poller(10, 2).watch(BOOKING_ID, ORDER_ID);

        assertThat(watch.outcome().get(5, TimeUnit.SECONDS)).isEqualTo(PaymentWatch.State.TIMEOUT);
        assertThat(watch.attempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("lost slot race ends the watch as SLOT_ALREADY_SOLD")
    void slotAlreadySold() throws Exception {
        when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID)).thenThrow(new SlotAlreadySoldException("sold"));

        PaymentWatch watch = poller(10, 30).watch(BOOKING_ID, ORDER_ID);

        assertThat(watch.outcome().get(5, TimeUnit.SECONDS)).isEqualTo(PaymentWatch.State.SLOT_ALREADY_SOLD);
        assertThat(watch.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("cancel stops a running watch and keeps it visible as CANCELLED")
    void cancel() throws Exception {
        lenient().when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID)).thenReturn(pending());
        PaymentStatusPoller poller = poller(60_000, 30);
        PaymentWatch watch = poller.watch(BOOKING_ID, ORDER_ID);

        assertThat(poller.cancel(BOOKING_ID)).isTrue();

        assertThat(watch.outcome().get(1, TimeUnit.SECONDS)).isEqualTo(PaymentWatch.State.CANCELLED);
        assertThat(poller.find(BOOKING_ID)).get().extracting(PaymentWatch::state).isEqualTo(PaymentWatch.State.CANCELLED);
        assertThat(poller.cancel(BOOKING_ID)).isFalse();
    }

    @Test
    @DisplayName("watching the same order twice reuses the running watch")
    void watchIsReused() {
        lenient().when(confirmationService.pollStatus(BOOKING_ID, ORDER_ID)).thenReturn(pending());
        PaymentStatusPoller poller = poller(60_000, 30);

        PaymentWatch first = poller.watch(BOOKING_ID, ORDER_ID);
        PaymentWatch second = poller.watch(BOOKING_ID, ORDER_ID);

        assertThat(second).isSameAs(first);
        poller.cancel(BOOKING_ID);
    }
}
