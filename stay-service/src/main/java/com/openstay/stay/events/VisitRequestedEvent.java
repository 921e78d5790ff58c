package com.openstay.stay.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Tells the listing owner about a new or rescheduled visit request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRequestedEvent {
    private Long visitRequestId;
    private Long listingId;
    private String ownerEmail;
    private String userEmail;
    private String userName;
    private LocalDate visitDate;
    private LocalTime visitTime;
    /** True when an existing pending request was rescheduled rather than created. */
    private boolean rescheduled;
    private Instant timestamp;
}
