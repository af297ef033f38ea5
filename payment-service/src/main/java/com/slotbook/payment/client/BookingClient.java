package com.slotbook.payment.client;

import com.slotbook.common.dto.BaseResponse;
import com.slotbook.payment.client.dto.BookingView;
import com.slotbook.payment.client.dto.SettleBookingRequest;
import com.slotbook.payment.client.dto.SettlementView;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for booking-service. Settlement is idempotent there, so every confirmation
 * flow may call {@link #settle} as often as it observes a captured payment.
 * Error statuses are translated by {@link BookingClientErrorDecoder}.
 */
@FeignClient(name = "booking-service", url = "${clients.booking-service.url}", path = "/api/v1/bookings",
        configuration = BookingClientConfig.class)
public interface BookingClient {

    @GetMapping("/{id}")
    BaseResponse<BookingView> getBooking(@PathVariable("id") Long bookingId);

    @PostMapping("/{id}/settlement")
    BaseResponse<SettlementView> settle(@PathVariable("id") Long bookingId, @RequestBody SettleBookingRequest request);
}
