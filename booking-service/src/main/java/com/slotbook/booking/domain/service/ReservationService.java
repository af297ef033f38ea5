package com.slotbook.booking.domain.service;

import com.slotbook.booking.api.dto.BookingResponse;
import com.slotbook.booking.api.dto.ReserveSlotsRequest;
import com.slotbook.booking.domain.model.Booking;
import com.slotbook.booking.domain.model.BookingDates;
import com.slotbook.booking.domain.model.PaidSlotClaim;
import com.slotbook.booking.domain.model.ReservationIdempotency;
import com.slotbook.booking.domain.model.SlotLabel;
import com.slotbook.booking.domain.model.Venue;
import com.slotbook.booking.domain.repository.BookingRepository;
import com.slotbook.booking.domain.repository.PaidSlotClaimRepository;
import com.slotbook.booking.domain.repository.ReservationIdempotencyRepository;
import com.slotbook.booking.domain.repository.VenueRepository;
import com.slotbook.booking.exception.SlotConflictException;
import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.ConflictException;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reservation ledger: records provisional bookings.
 *
 * Overlapping provisional bookings are allowed to coexist. Only slots that are already
 * paid for are refused here; exclusivity between unpaid bookings is decided at settlement
 * by {@link SettlementService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private final VenueRepository venueRepository;
    private final BookingRepository bookingRepository;
    private final PaidSlotClaimRepository paidSlotClaimRepository;
    private final ReservationIdempotencyRepository idempotencyRepository;
    private final Clock clock;

    @Value("${booking.provisional.ttl-minutes:30}")
    private long provisionalTtlMinutes;

    /**
     * Validates the slot-set and persists a provisional booking priced at
     * price per hour times the number of slots.
     *
     * @param idempotencyKey optional client key; a repeated key returns the original booking
     * @throws SlotConflictException if any slot already belongs to a paid booking
     */
    @Transactional
    public BookingResponse reserve(ReserveSlotsRequest request, String idempotencyKey) {
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<Booking> previous = idempotencyRepository.findById(idempotencyKey)
                    .flatMap(entry -> bookingRepository.findById(entry.getBookingId()));
            if (previous.isPresent()) {
                log.info("Idempotent replay of reservation key {} -> booking {}", idempotencyKey, previous.get().getId());
                return BookingResponse.from(previous.get());
            }
        }

        Venue venue = venueRepository.findById(request.venueId())
                .orElseThrow(() -> new ResourceNotFoundException("Venue", request.venueId()));

        LocalDate date = BookingDates.parse(request.date());
        if (date.isBefore(LocalDate.now(clock))) {
            throw new BusinessException("Cannot book a date in the past: " + request.date(), "DATE_IN_PAST");
        }
        String bookingDate = BookingDates.format(date);

        List<SlotLabel> requested = request.slots().stream().map(SlotLabel::parse).toList();
        List<String> slots = venue.operatingDay().requireContiguousRun(requested).stream()
                .map(SlotLabel::label)
                .toList();

        List<String> taken = paidSlotClaimRepository
                .findByVenueIdAndBookingDateAndSlotLabelIn(venue.getId(), bookingDate, slots).stream()
                .map(PaidSlotClaim::getSlotLabel)
                .sorted()
                .toList();
        if (!taken.isEmpty()) {
            throw new SlotConflictException(venue.getId(), bookingDate, taken);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = Booking.builder()
                .userId(request.userId())
                .venueId(venue.getId())
                .bookingDate(bookingDate)
                .slots(new ArrayList<>(slots))
                .slotsText(String.join(Constants.SLOT_DELIMITER, slots))
                .totalAmount(venue.getPricePerHour().multiply(BigDecimal.valueOf(slots.size())))
                .paid(false)
                .status(Booking.BookingStatus.PROVISIONAL)
                .createdAt(now)
                .expiresAt(now.plusMinutes(provisionalTtlMinutes))
                .build();
        booking = bookingRepository.save(booking);

        if (keyed) {
            try {
                idempotencyRepository.saveAndFlush(new ReservationIdempotency(idempotencyKey, booking.getId(), now));
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException("A reservation with this idempotency key is already in progress",
                        e, "DUPLICATE_REQUEST");
            }
        }

        log.info("Reserved booking {} for user {}: venue {} on {} slots {} total {}",
                booking.getId(), booking.getUserId(), booking.getVenueId(), bookingDate, slots, booking.getTotalAmount());
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBookingById(Long id) {
        return bookingRepository.findById(id)
                .map(BookingResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getBookingsByUserId(Long userId) {
        return bookingRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(BookingResponse::from)
                .toList();
    }
}
