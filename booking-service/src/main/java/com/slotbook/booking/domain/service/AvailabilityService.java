package com.slotbook.booking.domain.service;

import com.slotbook.booking.api.dto.AvailabilityResponse;
import com.slotbook.booking.cache.AvailabilityCache;
import com.slotbook.booking.domain.model.Booking;
import com.slotbook.booking.domain.model.BookingDates;
import com.slotbook.booking.domain.model.SlotLabel;
import com.slotbook.booking.domain.model.Venue;
import com.slotbook.booking.domain.repository.BookingRepository;
import com.slotbook.booking.domain.repository.VenueRepository;
import com.slotbook.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Open slots of a venue on a date: operating hours minus every slot of a paid booking.
 * Derived on read; nothing here is written except the optional cache entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final VenueRepository venueRepository;
    private final BookingRepository bookingRepository;
    private final AvailabilityCache availabilityCache;

    @Transactional(readOnly = true)
    public AvailabilityResponse getAvailability(Long venueId, String date) {
        String normalizedDate = BookingDates.format(BookingDates.parse(date));
        var cached = availabilityCache.get(venueId, normalizedDate);
        if (cached.isPresent()) {
            return cached.get();
        }

        Venue venue = venueRepository.findById(venueId)
                .orElseThrow(() -> new ResourceNotFoundException("Venue", venueId));

        Set<String> sold = bookingRepository.findPaidByVenueAndDate(venueId, normalizedDate).stream()
                .map(Booking::getSlots)
                .flatMap(List::stream)
                .collect(Collectors.toSet());

        List<String> allSlots = venue.operatingDay().slots().stream().map(SlotLabel::label).toList();
        List<String> available = allSlots.stream().filter(slot -> !sold.contains(slot)).toList();
        log.debug("Venue {} on {}: {} of {} slots available", venueId, normalizedDate, available.size(), allSlots.size());

        AvailabilityResponse response = new AvailabilityResponse(
                venueId, normalizedDate, venue.getPricePerHour(), allSlots, available);
        availabilityCache.put(response);
        return response;
    }
}
