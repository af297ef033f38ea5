package com.slotbook.payment.domain.repository;

import com.slotbook.payment.domain.model.PaymentOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

public interface PaymentOrderRepository extends JpaRepository<PaymentOrder, Long> {

    Optional<PaymentOrder> findByBookingId(Long bookingId);

    Optional<PaymentOrder> findByOrderId(String orderId);

    /**
     * Records the captured payment once. Concurrent confirmations of the same order
     * leave the first writer's values.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentOrder o
           SET o.status = :newStatus,
               o.paymentId = :paymentId,
               o.paymentMethod = :paymentMethod,
               o.updatedAt = :now
           WHERE o.orderId = :orderId
             AND o.status = :expectedStatus
           """)
    int transition(@Param("orderId") String orderId,
                   @Param("expectedStatus") PaymentOrder.OrderStatus expectedStatus,
                   @Param("newStatus") PaymentOrder.OrderStatus newStatus,
                   @Param("paymentId") String paymentId,
                   @Param("paymentMethod") String paymentMethod,
                   @Param("now") LocalDateTime now);
}
