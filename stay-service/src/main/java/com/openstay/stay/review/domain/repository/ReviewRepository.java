package com.openstay.stay.review.domain.repository;

import com.openstay.stay.review.domain.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ReviewRepository extends JpaRepository<Review, Long> {

    List<Review> findByListingIdOrderByCreatedAtDescIdDesc(Long listingId);

    @Query("SELECT SUM(r.rating) AS ratingSum, COUNT(r) AS reviewCount FROM Review r WHERE r.listingId = :listingId")
    RatingTotals totalsForListing(@Param("listingId") Long listingId);
}
