package com.openstay.stay.review.api.dto;

import com.openstay.stay.review.domain.model.Review;

import java.time.LocalDateTime;
import java.util.List;

public record ReviewResponse(
        Long id,
        Long listingId,
        String userName,
        Integer rating,
        String text,
        List<String> images,
        LocalDateTime createdAt
) {
    public static ReviewResponse from(Review review) {
        return new ReviewResponse(
                review.getId(),
                review.getListingId(),
                review.getUserName(),
                review.getRating(),
                review.getText(),
                List.copyOf(review.getImages()),
                review.getCreatedAt()
        );
    }
}
