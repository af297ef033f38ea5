package com.slotbook.payment.domain.polling;

import com.slotbook.common.exception.SlotAlreadySoldException;
import com.slotbook.payment.api.dto.PaymentStatusResponse;
import com.slotbook.payment.domain.service.PaymentConfirmationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-side polling flow. Checks an order's status every {@code interval-ms} for at most
 * {@code max-attempts} attempts; the first observed capture settles the booking.
 * Running out of attempts ends the watch with {@link PaymentWatch.State#TIMEOUT} and changes nothing.
 */
@Slf4j
@Component
public class PaymentStatusPoller {

    private final PaymentConfirmationService confirmationService;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final int maxAttempts;
    private final Duration retention;

    private final Map<Long, PaymentWatch> watches = new ConcurrentHashMap<>();

    public PaymentStatusPoller(PaymentConfirmationService confirmationService,
                               @Qualifier("paymentPollingScheduler") TaskScheduler scheduler,
                               @Value("${payment.polling.interval-ms:10000}") long intervalMs,
                               @Value("${payment.polling.max-attempts:30}") int maxAttempts,
                               @Value("${payment.polling.retention-minutes:30}") long retentionMinutes) {
        this.confirmationService = confirmationService;
        this.scheduler = scheduler;
        this.interval = Duration.ofMillis(intervalMs);
        this.maxAttempts = maxAttempts;
        this.retention = Duration.ofMinutes(retentionMinutes);
    }

    /**
     * Starts watching the order, or returns the live watch when one already runs for the same order.
     * A watch for a different order of the same booking is cancelled and replaced.
     */
    public PaymentWatch watch(Long bookingId, String orderId) {
        PaymentWatch watch = watches.compute(bookingId, (id, existing) -> {
            if (existing != null && !existing.isTerminal() && existing.getOrderId().equals(orderId)) {
                return existing;
            }
            if (existing != null) {
                existing.cancel();
            }
            return new PaymentWatch(bookingId, orderId, maxAttempts, Instant.now());
        });
        if (watch.markStarted()) {
            start(watch);
        }
        return watch;
    }

    public Optional<PaymentWatch> find(Long bookingId) {
        return Optional.ofNullable(watches.get(bookingId));
    }

    public boolean cancel(Long bookingId) {
        PaymentWatch watch = watches.get(bookingId);
        if (watch == null || !finish(watch, PaymentWatch.State.CANCELLED)) {
            return false;
        }
        log.info("Cancelled payment watch for booking {} order {}", bookingId, watch.getOrderId());
        return true;
    }

    private void start(PaymentWatch watch) {
        log.info("Watching order {} of booking {} every {} ms, at most {} attempts",
                watch.getOrderId(), watch.getBookingId(), interval.toMillis(), watch.getMaxAttempts());
        watch.attach(scheduler.scheduleWithFixedDelay(() -> pollOnce(watch), Instant.now(), interval));
    }

    void pollOnce(PaymentWatch watch) {
        if (watch.isTerminal()) {
            return;
        }
        int attempt = watch.nextAttempt();
        try {
            PaymentStatusResponse status = confirmationService.pollStatus(watch.getBookingId(), watch.getOrderId());
            if (status.status() == PaymentStatusResponse.Status.SETTLED) {
                finish(watch, PaymentWatch.State.SETTLED);
                return;
            }
            if (status.status() == PaymentStatusResponse.Status.SLOT_ALREADY_SOLD) {
                finish(watch, PaymentWatch.State.SLOT_ALREADY_SOLD);
                return;
            }
        } catch (SlotAlreadySoldException e) {
            finish(watch, PaymentWatch.State.SLOT_ALREADY_SOLD);
            return;
        } catch (RuntimeException e) {
            log.warn("Poll {} of order {} failed: {}", attempt, watch.getOrderId(), e.getMessage());
        }

        if (attempt >= watch.getMaxAttempts()) {
            if (finish(watch, PaymentWatch.State.TIMEOUT)) {
                log.warn("Payment for booking {} order {} not confirmed after {} attempts; "
                                + "booking left provisional for reconciliation",
                        watch.getBookingId(), watch.getOrderId(), attempt);
            }
        }
    }

    private boolean finish(PaymentWatch watch, PaymentWatch.State state) {
        if (!watch.complete(state)) {
            return false;
        }
        log.info("Payment watch for booking {} order {} ended {} after {} attempts",
                watch.getBookingId(), watch.getOrderId(), state, watch.attempts());
        scheduler.schedule(() -> watches.remove(watch.getBookingId(), watch), Instant.now().plus(retention));
        return true;
    }
}
