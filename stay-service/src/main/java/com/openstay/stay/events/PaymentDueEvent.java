package com.openstay.stay.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Rent reminder for a booking still in DUE state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentDueEvent {
    private Long bookingId;
    private String guestName;
    private String email;
    private Long amountMinor;
    private Instant timestamp;
}
