package com.openstay.stay.review.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.web.ResultResponses;
import com.openstay.stay.review.api.dto.AddReviewRequest;
import com.openstay.stay.review.api.dto.ReviewResponse;
import com.openstay.stay.review.domain.service.RatingAggregator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/listing")
@RequiredArgsConstructor
public class ReviewController {

    private final RatingAggregator ratingAggregator;

    @PostMapping("/{listingId}/review")
    public ResponseEntity<BaseResponse<ReviewResponse>> addReview(
            @PathVariable Long listingId,
            @Valid @RequestBody AddReviewRequest request) {
        return ResultResponses.toResponse(
                ratingAggregator.addReview(listingId, request.userName(), request.rating(), request.text(),
                        request.images()),
                HttpStatus.CREATED, ReviewResponse::from);
    }

    @GetMapping("/{listingId}/reviews")
    public ResponseEntity<BaseResponse<List<ReviewResponse>>> getReviews(@PathVariable Long listingId) {
        return ResultResponses.toResponse(ratingAggregator.reviews(listingId), HttpStatus.OK,
                reviews -> reviews.stream().map(ReviewResponse::from).toList());
    }
}
