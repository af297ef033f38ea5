package com.slotbook.booking.api.controller;

import com.slotbook.booking.api.dto.AvailabilityResponse;
import com.slotbook.booking.api.dto.SlotSelectionRequest;
import com.slotbook.booking.api.dto.SlotSelectionResponse;
import com.slotbook.booking.domain.service.AvailabilityService;
import com.slotbook.booking.domain.service.SlotSelectionService;
import com.slotbook.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/venues")
@RequiredArgsConstructor
public class VenueController {

    private final AvailabilityService availabilityService;
    private final SlotSelectionService slotSelectionService;

    @GetMapping("/{venueId}/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> getAvailability(
            @PathVariable Long venueId,
            @RequestParam String date) {
        return ResponseEntity.ok(BaseResponse.success(availabilityService.getAvailability(venueId, date)));
    }

    @PostMapping("/{venueId}/selection")
    public ResponseEntity<BaseResponse<SlotSelectionResponse>> toggleSlot(
            @PathVariable Long venueId,
            @Valid @RequestBody SlotSelectionRequest request) {
        SlotSelectionResponse response = slotSelectionService.toggle(venueId, request);
        return ResponseEntity.ok(BaseResponse.success(response.message(), response));
    }
}
