package com.openstay.stay.listing.api.dto;

import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.model.RoomType;

import java.math.BigDecimal;
import java.util.List;

public record ListingSummaryResponse(
        Long id,
        String title,
        String ownerEmail,
        BigDecimal rating,
        Integer ratingCount,
        List<RoomType> rooms
) {
    public static ListingSummaryResponse from(Listing listing) {
        return new ListingSummaryResponse(
                listing.getId(),
                listing.getTitle(),
                listing.getOwnerEmail(),
                listing.getRating(),
                listing.getRatingCount(),
                listing.getRooms()
        );
    }
}
