package com.openstay.stay.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Tells the requesting user that the owner approved or rejected a visit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitDecidedEvent {
    private Long visitRequestId;
    private Long listingId;
    private String userEmail;
    private String status;
    private LocalDate visitDate;
    private LocalTime visitTime;
    private Instant timestamp;
}
