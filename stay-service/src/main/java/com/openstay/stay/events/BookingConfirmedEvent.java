package com.openstay.stay.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published after a booking is committed. Consumed by the notification service (guest and owner emails).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent {
    private Long bookingId;
    private String bookingRef;
    private Long listingId;
    private String roomType;
    private String guestName;
    private String email;
    private Long amountMinor;
    private LocalDate moveInDate;
    private Instant timestamp;
}
