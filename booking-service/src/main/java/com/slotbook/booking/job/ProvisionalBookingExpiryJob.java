package com.slotbook.booking.job;

import com.slotbook.booking.domain.model.Booking;
import com.slotbook.booking.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Lifecycle of abandoned checkouts.
 *
 * PROVISIONAL bookings past their hold time become EXPIRED. An expired booking can still be
 * settled, since its payment may be in flight when the hold lapses. Unpaid EXPIRED bookings
 * older than the retention window are deleted. Paid bookings are never touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProvisionalBookingExpiryJob {

    private final BookingRepository bookingRepository;
    private final Clock clock;

    @Value("${booking.provisional.expiry-enabled:true}")
    private boolean expiryEnabled;

    @Value("${booking.provisional.retention-days:7}")
    private int retentionDays;

    @Value("${booking.provisional.purge-batch-size:500}")
    private int purgeBatchSize;

    @Scheduled(fixedDelayString = "${booking.provisional.expiry-interval-ms:60000}")
    @Transactional
    public void expireAbandonedBookings() {
        if (!expiryEnabled) return;
        LocalDateTime now = LocalDateTime.now(clock);

        int expired = bookingRepository.expireProvisional(now,
                Booking.BookingStatus.PROVISIONAL, Booking.BookingStatus.EXPIRED);
        if (expired > 0) {
            log.info("Expired {} abandoned provisional booking(s)", expired);
        }

        List<Booking> stale = bookingRepository.findByPaidFalseAndStatusAndExpiresAtBefore(
                Booking.BookingStatus.EXPIRED, now.minusDays(retentionDays), PageRequest.of(0, purgeBatchSize));
        if (!stale.isEmpty()) {
            bookingRepository.deleteAll(stale);
            log.info("Purged {} unpaid booking(s) expired more than {} day(s) ago", stale.size(), retentionDays);
        }
    }
}
