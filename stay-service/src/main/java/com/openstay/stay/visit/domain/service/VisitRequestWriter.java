package com.openstay.stay.visit.domain.service;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;
import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.stay.events.StayEventPublisher;
import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import com.openstay.stay.visit.domain.model.VisitRequest;
import com.openstay.stay.visit.domain.model.VisitStatus;
import com.openstay.stay.visit.domain.repository.VisitRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Transactional writes behind the visit request registry.
 *
 * Two concurrent first requests for the same pair both miss the pending lookup; the unique pending key
 * lets exactly one insert through and the loser is retried, finding the winner's row and rescheduling it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisitRequestWriter {

    private final VisitRequestRepository visitRequestRepository;
    private final ListingRepository listingRepository;
    private final StayEventPublisher eventPublisher;

    @Retryable(
            retryFor = DataIntegrityViolationException.class,
            maxAttempts = 2,
            backoff = @Backoff(delay = 20)
    )
    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public VisitRequest requestVisit(String userEmail, String userName, Long listingId, String ownerEmail,
                                     LocalDate visitDate, LocalTime visitTime) {
        validate(userEmail, userName, listingId, visitDate, visitTime);

        Listing listing = listingRepository.findById(listingId)
                .orElseThrow(() -> new ListingNotFoundException(listingId));
        String pendingKey = VisitRequest.pendingKeyFor(userEmail, listingId);

        VisitRequest pending = visitRequestRepository.findPendingForUpdate(pendingKey).orElse(null);
        if (pending != null) {
            pending.reschedule(visitDate, visitTime);
            pending.setUserName(userName);
            VisitRequest saved = visitRequestRepository.saveAndFlush(pending);
            eventPublisher.publishVisitRequested(saved, true);
            log.info("Visit request {} for listing {} rescheduled to {} {}", saved.getId(), listingId,
                    visitDate, visitTime);
            return saved;
        }

        VisitRequest created = VisitRequest.builder()
                .userEmail(userEmail.trim())
                .userName(userName)
                .listingId(listingId)
                .ownerEmail(StringUtils.hasText(ownerEmail) ? ownerEmail : listing.getOwnerEmail())
                .visitDate(visitDate)
                .visitTime(visitTime)
                .status(VisitStatus.PENDING)
                .pendingKey(pendingKey)
                .build();
        // Flushed here so a concurrent insert for the same pair surfaces inside the retry scope
        created = visitRequestRepository.saveAndFlush(created);
        eventPublisher.publishVisitRequested(created, false);
        log.info("Visit request {} created for listing {} on {} {}", created.getId(), listingId,
                visitDate, visitTime);
        return created;
    }

    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public VisitRequest decide(Long requestId, VisitStatus target) {
        VisitRequest request = visitRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Visit request", requestId));

        if (!request.decide(target)) {
            log.debug("Visit request {} already {}", requestId, target);
            return request;
        }
        VisitRequest saved = visitRequestRepository.saveAndFlush(request);
        eventPublisher.publishVisitDecided(saved);
        log.info("Visit request {} {}", requestId, target);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<VisitRequest> requestsForUser(String userEmail) {
        return visitRequestRepository.findByUserEmailIgnoreCaseOrderByCreatedAtDescIdDesc(userEmail.trim());
    }

    @Transactional(readOnly = true)
    public List<VisitRequest> requestsForListing(Long listingId) {
        return visitRequestRepository.findByListingIdOrderByCreatedAtDescIdDesc(listingId);
    }

    private static void validate(String userEmail, String userName, Long listingId,
                                 LocalDate visitDate, LocalTime visitTime) {
        if (!StringUtils.hasText(userEmail) || !StringUtils.hasText(userName)) {
            throw new BusinessException("User email and name are required", ErrorCode.VALIDATION_ERROR);
        }
        if (listingId == null || visitDate == null || visitTime == null) {
            throw new BusinessException("Listing, visit date and visit time are required",
                    ErrorCode.VALIDATION_ERROR);
        }
    }
}
