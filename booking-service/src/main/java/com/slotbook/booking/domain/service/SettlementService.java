package com.slotbook.booking.domain.service;

import com.slotbook.booking.api.dto.SettleBookingRequest;
import com.slotbook.booking.api.dto.SettlementResponse;
import com.slotbook.booking.domain.model.Booking;
import com.slotbook.booking.domain.model.PaidSlotClaim;
import com.slotbook.booking.domain.repository.BookingRepository;
import com.slotbook.booking.domain.repository.PaidSlotClaimRepository;
import com.slotbook.booking.events.BookingSettledEvent;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Settlement finalizer: the only place a booking becomes paid.
 *
 * One transaction performs, in order:
 * <ol>
 *   <li>the paid-state transition, as an UPDATE guarded by {@code paid = false};</li>
 *   <li>one {@link PaidSlotClaim} insert per slot, under a unique (venue, date, slot) key.</li>
 * </ol>
 * Whichever of two overlapping bookings inserts its claims first wins; the other hits the
 * unique key and its whole transaction, including the paid flag, rolls back.
 * Repeated confirmations of a paid booking report {@code ALREADY_SETTLED} and change nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    private final BookingRepository bookingRepository;
    private final PaidSlotClaimRepository paidSlotClaimRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @throws ResourceNotFoundException if the booking does not exist
     * @throws SlotAlreadySoldException  if another paid booking holds any of the slots
     */
    @Transactional
    public SettlementResponse settle(Long bookingId, SettleBookingRequest request) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

        if (booking.isPaid()) {
            return alreadySettled(booking, request.paymentId());
        }

        List<String> slots = List.copyOf(booking.getSlots());
        List<String> taken = paidSlotClaimRepository
                .findByVenueIdAndBookingDateAndSlotLabelIn(booking.getVenueId(), booking.getBookingDate(), slots).stream()
                .filter(claim -> !claim.getBookingId().equals(bookingId))
                .map(PaidSlotClaim::getSlotLabel)
                .sorted()
                .toList();
        if (!taken.isEmpty()) {
            log.error("Booking {} cannot be settled with payment {}: slots {} at venue {} on {} already sold",
                    bookingId, request.paymentId(), taken, booking.getVenueId(), booking.getBookingDate());
            throw new SlotAlreadySoldException(bookingId, taken);
        }

        LocalDateTime paidAt = LocalDateTime.now(clock);
        int updated = bookingRepository.markPaid(bookingId, request.paymentId(), request.paymentMethod(),
                paidAt, Booking.BookingStatus.PAID);
        if (updated == 0) {
            Booking current = bookingRepository.findById(bookingId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
            return alreadySettled(current, request.paymentId());
        }

        // Slots are stored in operating-day order, so overlapping settlements insert
        // their shared keys in the same order and cannot deadlock each other.
        List<PaidSlotClaim> claims = slots.stream()
                .map(slot -> PaidSlotClaim.builder()
                        .venueId(booking.getVenueId())
                        .bookingDate(booking.getBookingDate())
                        .slotLabel(slot)
                        .bookingId(bookingId)
                        .claimedAt(paidAt)
                        .build())
                .toList();
        try {
            paidSlotClaimRepository.saveAllAndFlush(claims);
        } catch (DataIntegrityViolationException e) {
            log.error("Booking {} lost the race for slots {} at venue {} on {}; payment {} needs a refund",
                    bookingId, slots, booking.getVenueId(), booking.getBookingDate(), request.paymentId());
            throw new SlotAlreadySoldException(bookingId, slots, e);
        }

        Booking settled = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        eventPublisher.publishEvent(BookingSettledEvent.from(settled));
        log.info("Booking {} settled with payment {} ({})", bookingId, request.paymentId(), request.paymentMethod());
        return SettlementResponse.of(settled, SettlementResponse.Outcome.SETTLED);
    }

    private SettlementResponse alreadySettled(Booking booking, String paymentId) {
        if (!Objects.equals(booking.getPaymentId(), paymentId)) {
            log.warn("Booking {} already settled with payment {}; payment {} may be a duplicate charge",
                    booking.getId(), booking.getPaymentId(), paymentId);
        } else {
            log.info("Booking {} already settled with payment {}, ignoring repeat", booking.getId(), paymentId);
        }
        return SettlementResponse.of(booking, SettlementResponse.Outcome.ALREADY_SETTLED);
    }
}
