package com.slotbook.booking.domain.repository;

import com.slotbook.booking.domain.model.PaidSlotClaim;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PaidSlotClaimRepository extends JpaRepository<PaidSlotClaim, Long> {

    List<PaidSlotClaim> findByVenueIdAndBookingDateAndSlotLabelIn(Long venueId,
                                                                  String bookingDate,
                                                                  Collection<String> slotLabels);

    List<PaidSlotClaim> findByBookingId(Long bookingId);
}
