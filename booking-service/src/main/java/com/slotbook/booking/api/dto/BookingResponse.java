package com.slotbook.booking.api.dto;

import com.slotbook.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long id,
        Long userId,
        Long venueId,
        String date,
        List<String> slots,
        String slotsText,
        BigDecimal totalAmount,
        boolean paid,
        Booking.BookingStatus status,
        String paymentId,
        String paymentMethod,
        LocalDateTime paidAt,
        LocalDateTime expiresAt,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getUserId(),
                booking.getVenueId(),
                booking.getBookingDate(),
                List.copyOf(booking.getSlots()),
                booking.getSlotsText(),
                booking.getTotalAmount(),
                booking.isPaid(),
                booking.getStatus(),
                booking.getPaymentId(),
                booking.getPaymentMethod(),
                booking.getPaidAt(),
                booking.getExpiresAt(),
                booking.getCreatedAt()
        );
    }
}
