package com.slotbook.booking.domain.service;

import com.slotbook.booking.api.dto.SettleBookingRequest;
import com.slotbook.booking.api.dto.SettlementResponse;
import com.slotbook.booking.domain.model.Booking;
import com.slotbook.booking.domain.model.PaidSlotClaim;
import com.slotbook.booking.domain.repository.BookingRepository;
import com.slotbook.booking.domain.repository.PaidSlotClaimRepository;
import com.slotbook.booking.events.BookingSettledEvent;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SettlementService}.
 *
 * Verifies:
 * - first settlement writes the paid flag and one claim per slot, then announces it
 * - repeats (sequential or lost race on the guarded update) are ALREADY_SETTLED without writes
 * - a paid claim of another booking, or a unique-key violation on insert, is SLOT_ALREADY_SOLD
 */
@ExtendWith(MockitoExtension.class)
class SettlementServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T04:30:00Z"), ZoneId.of("Asia/Kolkata"));
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 10, 0);
    private static final SettleBookingRequest REQUEST = new SettleBookingRequest("pay_P1", "card");

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private PaidSlotClaimRepository paidSlotClaimRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SettlementService service;

    @BeforeEach
    void setUp() {
        service = new SettlementService(bookingRepository, paidSlotClaimRepository, eventPublisher, CLOCK);
    }

    private static Booking provisional() {
        return Booking.builder()
                .id(42L).userId(100L).venueId(7L).bookingDate("2026-10-20")
                .slots(new ArrayList<>(List.of("13:00", "14:00")))
                .slotsText("13:00 - 14:00")
                .totalAmount(BigDecimal.valueOf(1000))
                .paid(false)
                .status(Booking.BookingStatus.PROVISIONAL)
                .build();
    }

    private static Booking paid(String paymentId) {
        Booking booking = provisional();
        booking.setPaid(true);
        booking.setStatus(Booking.BookingStatus.PAID);
        booking.setPaymentId(paymentId);
        booking.setPaymentMethod("card");
        booking.setPaidAt(NOW);
        return booking;
    }

    @Test
    @DisplayName("settle marks the booking paid, claims every slot and publishes a settled event")
    @SuppressWarnings("unchecked")
    void settle_firstConfirmation() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(provisional()), Optional.of(paid("pay_P1")));
        when(paidSlotClaimRepository.findByVenueIdAndBookingDateAndSlotLabelIn(7L, "2026-10-20", List.of("13:00", "14:00")))
                .thenReturn(List.of());
        when(bookingRepository.markPaid(42L, "pay_P1", "card", NOW, Booking.BookingStatus.PAID)).thenReturn(1);

        SettlementResponse response = service.settle(42L, REQUEST);

        assertThat(response.outcome()).isEqualTo(SettlementResponse.Outcome.SETTLED);
        assertThat(response.paymentId()).isEqualTo("pay_P1");

        ArgumentCaptor<List<PaidSlotClaim>> claims = ArgumentCaptor.forClass(List.class);
        verify(paidSlotClaimRepository).saveAllAndFlush(claims.capture());
        assertThat(claims.getValue()).extracting(PaidSlotClaim::getSlotLabel).containsExactly("13:00", "14:00");
        assertThat(claims.getValue()).allSatisfy(claim -> {
            assertThat(claim.getVenueId()).isEqualTo(7L);
            assertThat(claim.getBookingId()).isEqualTo(42L);
        });

        ArgumentCaptor<BookingSettledEvent> event = ArgumentCaptor.forClass(BookingSettledEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getBookingId()).isEqualTo(42L);
        assertThat(event.getValue().getPaymentId()).isEqualTo("pay_P1");
    }

    @Test
    @DisplayName("settling an already paid booking again is a no-op success")
    void settle_repeatIsIdempotent() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(paid("pay_P1")));

        SettlementResponse response = service.settle(42L, REQUEST);

        assertThat(response.outcome()).isEqualTo(SettlementResponse.Outcome.ALREADY_SETTLED);
        verify(bookingRepository, never()).markPaid(any(), any(), any(), any(), any());
        verifyNoInteractions(paidSlotClaimRepository, eventPublisher);
    }

    @Test
    @DisplayName("losing the guarded update to a concurrent confirmation reports ALREADY_SETTLED")
    void settle_concurrentConfirmationOfSameBooking() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(provisional()), Optional.of(paid("pay_P1")));
        when(paidSlotClaimRepository.findByVenueIdAndBookingDateAndSlotLabelIn(anyLong(), anyString(), anyCollection()))
                .thenReturn(List.of());
        when(bookingRepository.markPaid(any(), any(), any(), any(), any())).thenReturn(0);

        SettlementResponse response = service.settle(42L, REQUEST);

        assertThat(response.outcome()).isEqualTo(SettlementResponse.Outcome.ALREADY_SETTLED);
        verify(paidSlotClaimRepository, never()).saveAllAndFlush(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("settle rejects with SlotAlreadySold when another paid booking owns an overlapping slot")
    void settle_slotOwnedByOtherPaidBooking() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(provisional()));
        PaidSlotClaim foreign = PaidSlotClaim.builder()
                .venueId(7L).bookingDate("2026-10-20").slotLabel("14:00").bookingId(41L).build();
        when(paidSlotClaimRepository.findByVenueIdAndBookingDateAndSlotLabelIn(anyLong(), anyString(), anyCollection()))
                .thenReturn(List.of(foreign));

        assertThatThrownBy(() -> service.settle(42L, REQUEST))
                .isInstanceOf(SlotAlreadySoldException.class)
                .satisfies(ex -> assertThat(((SlotAlreadySoldException) ex).getSlots()).containsExactly("14:00"));
        verify(bookingRepository, never()).markPaid(any(), any(), any(), any(), any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("a unique-key violation while claiming slots becomes SlotAlreadySold")
    void settle_claimInsertRace() {
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(provisional()));
        when(paidSlotClaimRepository.findByVenueIdAndBookingDateAndSlotLabelIn(anyLong(), anyString(), anyCollection()))
                .thenReturn(List.of());
        when(bookingRepository.markPaid(any(), any(), any(), any(), any())).thenReturn(1);
        when(paidSlotClaimRepository.saveAllAndFlush(anyList()))
                .thenThrow(new DataIntegrityViolationException("uk_paid_slot_claims_slot"));

        assertThatThrownBy(() -> service.settle(42L, REQUEST))
                .isInstanceOf(SlotAlreadySoldException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("an expired hold whose payment arrives late is still settled")
    void settle_expiredBooking() {
        Booking expired = provisional();
        expired.setStatus(Booking.BookingStatus.EXPIRED);
        when(bookingRepository.findById(42L)).thenReturn(Optional.of(expired), Optional.of(paid("pay_P1")));
        when(paidSlotClaimRepository.findByVenueIdAndBookingDateAndSlotLabelIn(anyLong(), anyString(), anyCollection()))
                .thenReturn(List.of());
        when(bookingRepository.markPaid(any(), any(), any(), any(), any())).thenReturn(1);

        assertThat(service.settle(42L, REQUEST).outcome()).isEqualTo(SettlementResponse.Outcome.SETTLED);
    }

    @Test
    @DisplayName("settle of an unknown booking is 404")
    void settle_unknownBooking() {
        when(bookingRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.settle(404L, REQUEST)).isInstanceOf(ResourceNotFoundException.class);
    }
}
