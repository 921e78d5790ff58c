package com.openstay.stay.review.domain.model;

import com.openstay.stay.listing.domain.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Guest review of a listing. Append-only.
 */
@Entity
@Table(name = "reviews", indexes = @Index(name = "idx_reviews_listing_id", columnList = "listing_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "listing_id", nullable = false)
    private Long listingId;

    @Column(name = "user_name", nullable = false)
    private String userName;

    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "review_text", length = 4000)
    private String text;

    @Convert(converter = StringListConverter.class)
    @Column(name = "review_images", length = 4000)
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
