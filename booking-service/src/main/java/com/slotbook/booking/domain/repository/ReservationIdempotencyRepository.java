package com.slotbook.booking.domain.repository;

import com.slotbook.booking.domain.model.ReservationIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReservationIdempotencyRepository extends JpaRepository<ReservationIdempotency, String> {
}
