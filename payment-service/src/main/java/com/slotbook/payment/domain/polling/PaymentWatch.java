package com.slotbook.payment.domain.polling;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One bounded polling run for a booking's order. Leaves {@link State#WATCHING} exactly once;
 * the first terminal state wins and cancels the scheduled task.
 */
public class PaymentWatch {

    public enum State {
        WATCHING,
        SETTLED,
        TIMEOUT,
        SLOT_ALREADY_SOLD,
        CANCELLED
    }

    @Getter
    private final Long bookingId;
    @Getter
    private final String orderId;
    @Getter
    private final int maxAttempts;
    @Getter
    private final Instant startedAt;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicInteger attempts = new AtomicInteger();
    private final CompletableFuture<State> outcome = new CompletableFuture<>();
    private volatile ScheduledFuture<?> task;
    @Getter
    private volatile Instant finishedAt;

    public PaymentWatch(Long bookingId, String orderId, int maxAttempts, Instant startedAt) {
        this.bookingId = bookingId;
        this.orderId = orderId;
        this.maxAttempts = maxAttempts;
        this.startedAt = startedAt;
    }

    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    void attach(ScheduledFuture<?> task) {
        this.task = task;
        if (outcome.isDone()) {
            task.cancel(false);
        }
    }

    /** @return the attempt number just started, starting at 1 */
    int nextAttempt() {
        return attempts.incrementAndGet();
    }

    boolean complete(State state) {
        if (state == State.WATCHING || !outcome.complete(state)) {
            return false;
        }
        finishedAt = Instant.now();
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
        return true;
    }

    public boolean cancel() {
        return complete(State.CANCELLED);
    }

    public State state() {
        return outcome.getNow(State.WATCHING);
    }

    public int attempts() {
        return attempts.get();
    }

    public boolean isTerminal() {
        return outcome.isDone();
    }

    /** Completes with the terminal state. */
    public CompletableFuture<State> outcome() {
        return outcome;
    }
}
