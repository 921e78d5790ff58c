package com.openstay.stay.booking.domain.service;

import com.openstay.common.result.OperationResult;
import com.openstay.common.result.Operations;
import com.openstay.stay.booking.api.dto.ConfirmBookingRequest;
import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.domain.model.CurrentStay;
import com.openstay.stay.booking.saga.BookingOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Booking ledger: records paid occupancy and keeps it consistent with room inventory.
 * Delegates each operation to {@link BookingOrchestrator} and reports the outcome as a tagged result.
 */
@Service
@RequiredArgsConstructor
public class BookingLedger {

    private final BookingOrchestrator orchestrator;

    /**
     * Reserves a room and records the booking. Fails with OutOfInventory or ListingNotFound and writes nothing.
     */
    public OperationResult<Booking> confirmBooking(ConfirmBookingRequest request) {
        return Operations.capture("confirmBooking", () -> orchestrator.confirmBooking(request));
    }

    /**
     * Releases the booking's room and deletes the booking, or does neither.
     */
    public OperationResult<Booking> cancelBooking(Long bookingId) {
        return Operations.capture("cancelBooking", () -> orchestrator.cancelBooking(bookingId));
    }

    public OperationResult<Booking> updateMoveInDate(Long bookingId, LocalDate moveInDate) {
        return Operations.capture("updateMoveInDate", () -> orchestrator.updateMoveInDate(bookingId, moveInDate));
    }

    public OperationResult<Booking> assignRoom(Long bookingId, String roomNo, String floor) {
        return Operations.capture("assignRoom", () -> orchestrator.assignRoom(bookingId, roomNo, floor));
    }

    public OperationResult<Booking> getBooking(Long bookingId) {
        return Operations.capture("getBooking", () -> orchestrator.getBooking(bookingId));
    }

    public OperationResult<List<Booking>> bookingsForListing(Long listingId) {
        return Operations.capture("bookingsForListing", () -> orchestrator.bookingsForListing(listingId));
    }

    public OperationResult<Optional<CurrentStay>> currentStay(String email) {
        return Operations.capture("currentStay", () -> orchestrator.currentStay(email));
    }

    public OperationResult<Integer> remindDueBookings() {
        return Operations.capture("remindDueBookings", orchestrator::remindDueBookings);
    }
}
