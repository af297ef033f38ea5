package com.slotbook.booking.domain.model;

import com.slotbook.common.util.Constants;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reservation of a contiguous run of hourly slots at a venue on one date.
 * Created provisional (unpaid); becomes exclusive only once settled.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_user_id", columnList = "user_id"),
        @Index(name = "idx_bookings_venue_date", columnList = "venue_id, booking_date"),
        @Index(name = "idx_bookings_status_expires", columnList = "status, expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    /** Calendar date as YYYY-MM-DD, kept as text so no timezone is ever applied. */
    @Column(name = "booking_date", nullable = false, length = 10)
    private String bookingDate;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_slots", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "slot_order")
    @Column(name = "slot_label", nullable = false, length = 5)
    private List<String> slots = new ArrayList<>();

    @Column(name = "slots_text", nullable = false)
    private String slotsText;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "paid", nullable = false)
    private boolean paid;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "payment_id", length = 64)
    private String paymentId;

    @Column(name = "payment_method", length = 32)
    private String paymentMethod;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = BookingStatus.PROVISIONAL;
        }
        if (slotsText == null) {
            slotsText = String.join(Constants.SLOT_DELIMITER, slots);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public List<SlotLabel> slotLabels() {
        return slots.stream().map(SlotLabel::parse).toList();
    }

    public enum BookingStatus {
        /** Reserved, awaiting payment. Not exclusive. */
        PROVISIONAL,
        PAID,
        /** Abandoned past its hold time. Still settleable if a late payment arrives. */
        EXPIRED
    }
}
