package com.slotbook.booking.domain.repository;

import com.slotbook.booking.domain.model.Venue;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VenueRepository extends JpaRepository<Venue, Long> {
}
