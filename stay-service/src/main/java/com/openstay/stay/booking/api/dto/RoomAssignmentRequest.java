package com.openstay.stay.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RoomAssignmentRequest(
        @NotBlank(message = "Room number is required")
        @Size(max = 50)
        String roomNo,

        @Size(max = 50)
        String floor
) {
}
