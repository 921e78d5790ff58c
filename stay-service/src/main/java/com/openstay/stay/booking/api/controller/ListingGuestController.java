package com.openstay.stay.booking.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.web.ResultResponses;
import com.openstay.stay.booking.api.dto.BookingResponse;
import com.openstay.stay.booking.domain.service.BookingLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Guest list of a listing, for its owner.
 */
@RestController
@RequestMapping("/listing")
@RequiredArgsConstructor
public class ListingGuestController {

    private final BookingLedger bookingLedger;

    @GetMapping("/{listingId}/bookings")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookings(@PathVariable Long listingId) {
        return ResultResponses.toResponse(bookingLedger.bookingsForListing(listingId), HttpStatus.OK,
                bookings -> bookings.stream().map(BookingResponse::from).toList());
    }
}
