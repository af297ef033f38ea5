package com.slotbook.booking.events;

import com.slotbook.booking.domain.model.Booking;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Emitted once per booking, after the transaction that made it paid has committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingSettledEvent {
    private Long bookingId;
    private Long userId;
    private Long venueId;
    private String bookingDate;
    private List<String> slots;
    private BigDecimal totalAmount;
    private String paymentId;
    private String paymentMethod;
    private LocalDateTime paidAt;
    private Instant timestamp;

    public static BookingSettledEvent from(Booking booking) {
        return BookingSettledEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .venueId(booking.getVenueId())
                .bookingDate(booking.getBookingDate())
                .slots(List.copyOf(booking.getSlots()))
                .totalAmount(booking.getTotalAmount())
                .paymentId(booking.getPaymentId())
                .paymentMethod(booking.getPaymentMethod())
                .paidAt(booking.getPaidAt())
                .timestamp(Instant.now())
                .build();
    }
}
