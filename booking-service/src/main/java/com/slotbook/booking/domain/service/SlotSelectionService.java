package com.slotbook.booking.domain.service;

import com.slotbook.booking.api.dto.AvailabilityResponse;
import com.slotbook.booking.api.dto.SlotSelectionRequest;
import com.slotbook.booking.api.dto.SlotSelectionResponse;
import com.slotbook.booking.domain.model.OperatingDay;
import com.slotbook.booking.domain.model.SlotLabel;
import com.slotbook.booking.domain.model.SlotSelection;
import com.slotbook.booking.domain.model.Venue;
import com.slotbook.booking.domain.repository.VenueRepository;
import com.slotbook.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies one select/deselect to a client-held selection against current availability.
 * The answer guides the slot picker; reservation re-validates everything on submit.
 */
@Service
@RequiredArgsConstructor
public class SlotSelectionService {

    private final VenueRepository venueRepository;
    private final AvailabilityService availabilityService;

    public SlotSelectionResponse toggle(Long venueId, SlotSelectionRequest request) {
        Venue venue = venueRepository.findById(venueId)
                .orElseThrow(() -> new ResourceNotFoundException("Venue", venueId));
        AvailabilityResponse availability = availabilityService.getAvailability(venueId, request.date());
        OperatingDay day = venue.operatingDay();

        Set<SlotLabel> available = availability.availableSlots().stream()
                .map(SlotLabel::parse)
                .collect(Collectors.toSet());
        List<SlotLabel> held = request.selectedSlotsOrEmpty().stream()
                .filter(Objects::nonNull)
                .map(SlotLabel::parse)
                .toList();

        SlotSelection current = SlotSelection.of(day, held).retainAvailable(available);
        SlotSelection.Toggle result = current.toggle(SlotLabel.parse(request.toggle()), available);

        List<String> selected = result.selection().slots().stream().map(SlotLabel::label).toList();
        BigDecimal total = venue.getPricePerHour().multiply(BigDecimal.valueOf(selected.size()));
        return new SlotSelectionResponse(availability.date(), selected, result.accepted(), result.message(), total);
    }
}
