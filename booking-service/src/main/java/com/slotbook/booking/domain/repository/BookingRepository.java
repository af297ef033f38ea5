package com.slotbook.booking.domain.repository;

import com.slotbook.booking.domain.model.Booking;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByUserIdOrderByCreatedAtDesc(Long userId);

    @Query("SELECT b FROM Booking b WHERE b.venueId = :venueId AND b.bookingDate = :bookingDate AND b.paid = true")
    List<Booking> findPaidByVenueAndDate(@Param("venueId") Long venueId,
                                         @Param("bookingDate") String bookingDate);

    /**
     * Paid-state transition guarded by {@code paid = false}.
     *
     * Two settlements racing on the same row serialize on the row lock; the loser
     * re-evaluates the guard against the committed row and updates nothing.
     *
     * @return 1 if this call made the booking paid, 0 if it was already paid
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.paid = true,
               b.status = :paidStatus,
               b.paymentId = :paymentId,
               b.paymentMethod = :paymentMethod,
               b.paidAt = :paidAt,
               b.updatedAt = :paidAt
           WHERE b.id = :id
             AND b.paid = false
           """)
    int markPaid(@Param("id") Long id,
                 @Param("paymentId") String paymentId,
                 @Param("paymentMethod") String paymentMethod,
                 @Param("paidAt") LocalDateTime paidAt,
                 @Param("paidStatus") Booking.BookingStatus paidStatus);

    /** Flags unpaid holds whose hold time has passed. Never touches paid rows. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.status = :expiredStatus,
               b.updatedAt = :now
           WHERE b.paid = false
             AND b.status = :provisionalStatus
             AND b.expiresAt < :now
           """)
    int expireProvisional(@Param("now") LocalDateTime now,
                          @Param("provisionalStatus") Booking.BookingStatus provisionalStatus,
                          @Param("expiredStatus") Booking.BookingStatus expiredStatus);

    List<Booking> findByPaidFalseAndStatusAndExpiresAtBefore(Booking.BookingStatus status,
                                                             LocalDateTime before,
                                                             Pageable pageable);
}
