package com.openstay.stay.visit.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * @param ownerEmail Optional. Defaults to the listing's owner.
 */
public record VisitRequestCreateRequest(
        @NotBlank(message = "User email is required")
        @Email(message = "User email must be a valid address")
        String userEmail,

        @NotBlank(message = "User name is required")
        String userName,

        @NotNull(message = "Listing ID cannot be null")
        Long listingId,

        @Email(message = "Owner email must be a valid address")
        String ownerEmail,

        @NotNull(message = "Visit date cannot be null")
        LocalDate visitDate,

        @NotNull(message = "Visit time cannot be null")
        @JsonFormat(pattern = "HH:mm")
        LocalTime visitTime
) {
}
