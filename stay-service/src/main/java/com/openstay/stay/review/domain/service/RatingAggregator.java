package com.openstay.stay.review.domain.service;

import com.openstay.common.result.OperationResult;
import com.openstay.common.result.Operations;
import com.openstay.stay.review.domain.model.Review;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Appends reviews and keeps each listing's rating equal to the mean of its reviews, rounded to two decimals.
 */
@Service
@RequiredArgsConstructor
public class RatingAggregator {

    private final ReviewRecorder recorder;

    public OperationResult<Review> addReview(Long listingId, String userName, Integer rating, String text,
                                             List<String> images) {
        return Operations.capture("addReview", () -> recorder.addReview(listingId, userName, rating, text, images));
    }

    public OperationResult<List<Review>> reviews(Long listingId) {
        return Operations.capture("reviews", () -> recorder.reviews(listingId));
    }
}
