package com.openstay.stay.listing.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One category of room within a listing and its capacity.
 * Immutable: every inventory change produces a new value that replaces the old one in the listing's collection.
 *
 * Invariant: {@code 0 <= available <= totalCount}.
 */
public record RoomType(
        String type,
        int totalCount,
        int available,
        long priceMinor,
        long depositMinor,
        @JsonProperty("isAC") boolean airConditioned
) {
    public RoomType {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Room type name is required");
        }
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total count must not be negative for room type " + type);
        }
        if (available < 0 || available > totalCount) {
            throw new IllegalArgumentException(String.format(
                    "Available count %d outside [0, %d] for room type %s", available, totalCount, type));
        }
    }

    public boolean hasVacancy() {
        return available > 0;
    }

    /**
     * True when nothing of this type is currently occupied.
     */
    public boolean allAvailable() {
        return available == totalCount;
    }

    public RoomType withOneReserved() {
        if (!hasVacancy()) {
            throw new IllegalStateException("No vacancy left for room type " + type);
        }
        return new RoomType(type, totalCount, available - 1, priceMinor, depositMinor, airConditioned);
    }

    public RoomType withOneReleased() {
        if (allAvailable()) {
            throw new IllegalStateException("Room type " + type + " is already fully available");
        }
        return new RoomType(type, totalCount, available + 1, priceMinor, depositMinor, airConditioned);
    }
}
