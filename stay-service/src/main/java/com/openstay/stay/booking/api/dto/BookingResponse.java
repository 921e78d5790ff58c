package com.openstay.stay.booking.api.dto;

import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        Long listingId,
        String roomType,
        String name,
        String email,
        String mobile,
        BookingStatus status,
        String bookingRef,
        Long amountMinor,
        LocalDate moveInDate,
        LocalDateTime paidAt,
        String roomNo,
        String floor,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getListingId(),
                booking.getRoomType(),
                booking.getGuestName(),
                booking.getEmail(),
                booking.getMobile(),
                booking.getStatus(),
                booking.getBookingRef(),
                booking.getAmountMinor(),
                booking.getMoveInDate(),
                booking.getPaidAt(),
                booking.getRoomNo(),
                booking.getFloor(),
                booking.getCreatedAt()
        );
    }
}
