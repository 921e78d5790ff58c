package com.openstay.stay.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published after a cancellation is committed and its room returned to inventory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent {
    private Long bookingId;
    private String bookingRef;
    private Long listingId;
    private String roomType;
    private String email;
    private Instant timestamp;
}
