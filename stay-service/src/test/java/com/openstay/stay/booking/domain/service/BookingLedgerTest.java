package com.openstay.stay.booking.domain.service;

import com.openstay.common.exception.ErrorCode;
import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.common.result.OperationResult;
import com.openstay.stay.booking.api.dto.ConfirmBookingRequest;
import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.saga.BookingOrchestrator;
import com.openstay.stay.inventory.exception.OutOfInventoryException;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

/**
 * Unit tests for {@link BookingLedger}: exceptions from the transactional layer become tagged results.
 */
@ExtendWith(MockitoExtension.class)
class BookingLedgerTest {

    @Mock
    private BookingOrchestrator orchestrator;

    @InjectMocks
    private BookingLedger ledger;

    private final ConfirmBookingRequest request =
            new ConfirmBookingRequest("Asha", "asha@example.com", null, 1L, "Single", 500000L, null, null);

    @Test
    @DisplayName("successful confirmation is returned as a success result")
    void confirm_success() {
        Booking booking = Booking.builder().id(1L).build();
        given(orchestrator.confirmBooking(request)).willReturn(booking);

        OperationResult<Booking> result = ledger.confirmBooking(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isSameAs(booking);
    }

    @Test
    @DisplayName("OutOfInventory keeps its tag")
    void confirm_outOfInventory() {
        given(orchestrator.confirmBooking(request)).willThrow(OutOfInventoryException.noVacancy(1L, "Single"));

        assertThat(ledger.confirmBooking(request).getError()).contains(ErrorCode.OUT_OF_INVENTORY);
    }

    @Test
    @DisplayName("ListingNotFound keeps its tag")
    void confirm_listingNotFound() {
        given(orchestrator.confirmBooking(request)).willThrow(new ListingNotFoundException(1L));

        assertThat(ledger.confirmBooking(request).getError()).contains(ErrorCode.LISTING_NOT_FOUND);
    }

    @Test
    @DisplayName("lock timeout becomes PersistenceFailure instead of propagating")
    void confirm_lockTimeout() {
        given(orchestrator.confirmBooking(request)).willThrow(new CannotAcquireLockException("lock timeout"));

        OperationResult<Booking> result = ledger.confirmBooking(request);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains(ErrorCode.PERSISTENCE_FAILURE);
    }

    @Test
    @DisplayName("cancelling an unknown booking is NotFound")
    void cancel_notFound() {
        given(orchestrator.cancelBooking(3L)).willThrow(new ResourceNotFoundException("Booking", 3L));

        OperationResult<Booking> result = ledger.cancelBooking(3L);

        assertThat(result.getError()).contains(ErrorCode.NOT_FOUND);
        assertThat(result.getMessage()).isEqualTo("Booking with identifier 3 not found");
    }
}
