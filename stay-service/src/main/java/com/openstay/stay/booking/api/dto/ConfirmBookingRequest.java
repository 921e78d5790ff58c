package com.openstay.stay.booking.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Payment-succeeded fact handed over by the payment gateway.
 *
 * @param bookingRef Optional. When it matches an existing booking, that booking is returned and nothing is reserved.
 * @param moveInDate Optional. Defaults to the confirmation date.
 */
public record ConfirmBookingRequest(
        @NotBlank(message = "Name is required")
        String name,

        @Email(message = "Email must be a valid address")
        String email,

        @Size(max = 20, message = "Mobile must be at most 20 characters")
        String mobile,

        @NotNull(message = "Listing ID cannot be null")
        Long listingId,

        @NotBlank(message = "Room type is required")
        String roomType,

        @NotNull(message = "Amount cannot be null")
        @PositiveOrZero(message = "Amount must not be negative")
        Long amountMinor,

        @Size(max = 100, message = "Booking reference must be at most 100 characters")
        String bookingRef,

        LocalDate moveInDate
) {
}
