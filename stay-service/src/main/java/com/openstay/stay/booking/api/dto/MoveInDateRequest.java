package com.openstay.stay.booking.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record MoveInDateRequest(
        @NotNull(message = "Move-in date cannot be null")
        LocalDate moveInDate
) {
}
