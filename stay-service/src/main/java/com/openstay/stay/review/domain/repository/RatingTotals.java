package com.openstay.stay.review.domain.repository;

/**
 * Sum and count of a listing's review ratings. The sum is null when there are no reviews.
 */
public interface RatingTotals {

    Long getRatingSum();

    Long getReviewCount();
}
