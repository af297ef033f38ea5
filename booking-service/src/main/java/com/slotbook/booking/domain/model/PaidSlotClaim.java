package com.slotbook.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One sold (venue, date, slot). The unique key is what makes a slot sellable to at most
 * one paid booking: a second settlement touching the same slot fails on insert.
 */
@Entity
@Table(name = "paid_slot_claims", uniqueConstraints = {
        @UniqueConstraint(name = "uk_paid_slot_claims_slot", columnNames = {"venue_id", "booking_date", "slot_label"})
}, indexes = {
        @Index(name = "idx_paid_slot_claims_booking", columnList = "booking_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaidSlotClaim {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    @Column(name = "booking_date", nullable = false, length = 10)
    private String bookingDate;

    @Column(name = "slot_label", nullable = false, length = 5)
    private String slotLabel;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "claimed_at", nullable = false)
    private LocalDateTime claimedAt;
}
