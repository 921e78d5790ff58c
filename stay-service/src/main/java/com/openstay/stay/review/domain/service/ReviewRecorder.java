package com.openstay.stay.review.domain.service;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;
import com.openstay.common.util.Constants;
import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import com.openstay.stay.review.domain.model.Review;
import com.openstay.stay.review.domain.repository.RatingTotals;
import com.openstay.stay.review.domain.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Inserts a review and rewrites the listing's rating in the same transaction.
 *
 * The listing row is locked first, so two reviews of one listing are applied one after the other and
 * the second recomputation always sees the first review.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewRecorder {

    private final ReviewRepository reviewRepository;
    private final ListingRepository listingRepository;

    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public Review addReview(Long listingId, String userName, Integer rating, String text, List<String> images) {
        if (!StringUtils.hasText(userName)) {
            throw new BusinessException("User name is required", ErrorCode.VALIDATION_ERROR);
        }
        if (rating == null || rating < Constants.MIN_RATING || rating > Constants.MAX_RATING) {
            throw new BusinessException(
                    String.format("Rating must be between %d and %d", Constants.MIN_RATING, Constants.MAX_RATING),
                    ErrorCode.VALIDATION_ERROR);
        }

        Listing listing = listingRepository.findByIdForUpdate(listingId)
                .orElseThrow(() -> new ListingNotFoundException(listingId));

        Review review = reviewRepository.saveAndFlush(Review.builder()
                .listingId(listingId)
                .userName(userName)
                .rating(rating)
                .text(text)
                .images(images != null ? new ArrayList<>(images) : new ArrayList<>())
                .build());

        RatingTotals totals = reviewRepository.totalsForListing(listingId);
        long count = totals.getReviewCount() != null ? totals.getReviewCount() : 0L;
        long sum = totals.getRatingSum() != null ? totals.getRatingSum() : 0L;
        BigDecimal average = count == 0
                ? BigDecimal.ZERO.setScale(Constants.RATING_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), Constants.RATING_SCALE, RoundingMode.HALF_UP);

        listing.applyRating(average, (int) count);
        listingRepository.saveAndFlush(listing);

        log.info("Review {} added to listing {}: rating now {} over {} reviews",
                review.getId(), listingId, average, count);
        return review;
    }

    @Transactional(readOnly = true)
    public List<Review> reviews(Long listingId) {
        if (!listingRepository.existsById(listingId)) {
            throw new ListingNotFoundException(listingId);
        }
        return reviewRepository.findByListingIdOrderByCreatedAtDescIdDesc(listingId);
    }
}
