package com.openstay.stay.visit.domain.service;

import com.openstay.common.result.OperationResult;
import com.openstay.common.result.Operations;
import com.openstay.stay.visit.domain.model.VisitRequest;
import com.openstay.stay.visit.domain.model.VisitStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Visit scheduling per (user, listing). Repeating a request while one is pending reschedules it
 * instead of creating a second one.
 */
@Service
@RequiredArgsConstructor
public class VisitRequestRegistry {

    private final VisitRequestWriter writer;

    public OperationResult<VisitRequest> requestVisit(String userEmail, String userName, Long listingId,
                                                      String ownerEmail, LocalDate visitDate, LocalTime visitTime) {
        return Operations.capture("requestVisit",
                () -> writer.requestVisit(userEmail, userName, listingId, ownerEmail, visitDate, visitTime));
    }

    /**
     * Approves the request. Repeating it is a no-op; a rejected request fails with VisitAlreadyDecided.
     */
    public OperationResult<VisitRequest> approve(Long requestId) {
        return Operations.capture("approveVisit", () -> writer.decide(requestId, VisitStatus.APPROVED));
    }

    /**
     * Rejects the request. Repeating it is a no-op; an approved request fails with VisitAlreadyDecided.
     */
    public OperationResult<VisitRequest> reject(Long requestId) {
        return Operations.capture("rejectVisit", () -> writer.decide(requestId, VisitStatus.REJECTED));
    }

    public OperationResult<List<VisitRequest>> requestsForUser(String userEmail) {
        return Operations.capture("requestsForUser", () -> writer.requestsForUser(userEmail));
    }

    public OperationResult<List<VisitRequest>> requestsForListing(Long listingId) {
        return Operations.capture("requestsForListing", () -> writer.requestsForListing(listingId));
    }
}
