package com.slotbook.booking.events;

import com.slotbook.booking.cache.AvailabilityCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Side effects of a committed settlement: drop the cached availability of the venue/date
 * and announce the booking downstream. A rolled-back settlement produces neither.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementEventListener {

    private final AvailabilityCache availabilityCache;
    private final BookingEventPublisher bookingEventPublisher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingSettled(BookingSettledEvent event) {
        log.debug("Booking {} settled, refreshing availability of venue {} on {}",
                event.getBookingId(), event.getVenueId(), event.getBookingDate());
        availabilityCache.evict(event.getVenueId(), event.getBookingDate());
        bookingEventPublisher.publishBookingSettled(event);
    }
}
