package com.openstay.stay.booking.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.web.ResultResponses;
import com.openstay.stay.booking.api.dto.BookingResponse;
import com.openstay.stay.booking.api.dto.ConfirmBookingRequest;
import com.openstay.stay.booking.api.dto.CurrentStayResponse;
import com.openstay.stay.booking.api.dto.MoveInDateRequest;
import com.openstay.stay.booking.api.dto.RoomAssignmentRequest;
import com.openstay.stay.booking.domain.service.BookingLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the booking ledger.
 * Confirmation is called once the payment gateway has validated the payment.
 */
@RestController
@RequestMapping("/booking")
@RequiredArgsConstructor
public class BookingController {

    private final BookingLedger bookingLedger;

    @PostMapping("/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirmBooking(
            @Valid @RequestBody ConfirmBookingRequest request) {
        return ResultResponses.toResponse(bookingLedger.confirmBooking(request), HttpStatus.CREATED,
                BookingResponse::from);
    }

    @DeleteMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<Void>> cancelBooking(@PathVariable Long id) {
        return ResultResponses.toResponse(bookingLedger.cancelBooking(id), HttpStatus.OK, booking -> null);
    }

    @PutMapping("/{id}/move-in-date")
    public ResponseEntity<BaseResponse<BookingResponse>> updateMoveInDate(
            @PathVariable Long id,
            @Valid @RequestBody MoveInDateRequest request) {
        return ResultResponses.toResponse(bookingLedger.updateMoveInDate(id, request.moveInDate()), HttpStatus.OK,
                BookingResponse::from);
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResultResponses.toResponse(bookingLedger.getBooking(id), HttpStatus.OK, BookingResponse::from);
    }

    @PutMapping("/{id}/room-assignment")
    public ResponseEntity<BaseResponse<BookingResponse>> assignRoom(
            @PathVariable Long id,
            @Valid @RequestBody RoomAssignmentRequest request) {
        return ResultResponses.toResponse(bookingLedger.assignRoom(id, request.roomNo(), request.floor()),
                HttpStatus.OK, BookingResponse::from);
    }

    @GetMapping("/stay/{email}")
    public ResponseEntity<BaseResponse<CurrentStayResponse>> currentStay(@PathVariable String email) {
        return ResultResponses.toResponse(bookingLedger.currentStay(email), HttpStatus.OK, CurrentStayResponse::from);
    }

    @PostMapping("/reminders/due")
    public ResponseEntity<BaseResponse<Integer>> remindDueBookings() {
        return ResultResponses.ok(bookingLedger.remindDueBookings());
    }
}
