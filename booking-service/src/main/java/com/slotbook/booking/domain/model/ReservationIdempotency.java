package com.slotbook.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Client-supplied Idempotency-Key of a reserve call and the booking it produced.
 * A retried submit returns that booking instead of creating another one.
 *
 * The key is assigned, so the entity reports itself new until persisted or loaded: saving a
 * key that already exists is an INSERT hitting the primary key, never a merge over the old row.
 */
@Entity
@Table(name = "reservation_idempotency")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationIdempotency implements Persistable<String> {
    @Id
    @Column(name = "idempotency_key", length = 128)
    private String idempotencyKey;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Transient
    private boolean isNew = true;

    public ReservationIdempotency(String idempotencyKey, Long bookingId, LocalDateTime createdAt) {
        this.idempotencyKey = idempotencyKey;
        this.bookingId = bookingId;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }
}
