package com.slotbook.booking.api.controller;

import com.slotbook.booking.api.dto.BookingResponse;
import com.slotbook.booking.api.dto.ReserveSlotsRequest;
import com.slotbook.booking.api.dto.SettleBookingRequest;
import com.slotbook.booking.api.dto.SettlementResponse;
import com.slotbook.booking.domain.service.ReservationService;
import com.slotbook.booking.domain.service.SettlementService;
import com.slotbook.common.dto.BaseResponse;
import com.slotbook.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Reservation and settlement endpoints. {@code POST /{id}/settlement} is called by
 * payment-service once a captured payment has been verified.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final ReservationService reservationService;
    private final SettlementService settlementService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> reserve(
            @Valid @RequestBody ReserveSlotsRequest request,
            @RequestHeader(value = Constants.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        BookingResponse response = reservationService.reserve(request, idempotencyKey);
        return ResponseEntity.ok(BaseResponse.success("Slots reserved, complete payment to confirm", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        BookingResponse response = reservationService.getBookingById(id);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByUser(
            @PathVariable Long userId) {
        List<BookingResponse> response = reservationService.getBookingsByUserId(userId);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/settlement")
    public ResponseEntity<BaseResponse<SettlementResponse>> settle(
            @PathVariable Long id,
            @Valid @RequestBody SettleBookingRequest request) {
        SettlementResponse response = settlementService.settle(id, request);
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
