package com.openstay.stay.visit.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.openstay.stay.visit.domain.model.VisitRequest;
import com.openstay.stay.visit.domain.model.VisitStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

public record VisitRequestResponse(
        Long id,
        String userEmail,
        String userName,
        Long listingId,
        String ownerEmail,
        LocalDate visitDate,
        @JsonFormat(pattern = "HH:mm")
        LocalTime visitTime,
        VisitStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static VisitRequestResponse from(VisitRequest request) {
        return new VisitRequestResponse(
                request.getId(),
                request.getUserEmail(),
                request.getUserName(),
                request.getListingId(),
                request.getOwnerEmail(),
                request.getVisitDate(),
                request.getVisitTime(),
                request.getStatus(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
