package com.openstay.stay.listing.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingTest {

    private Listing listing() {
        return Listing.builder()
                .id(1L)
                .title("Sunrise PG")
                .rooms(List.of(
                        new RoomType("Single", 2, 2, 500000, 100000, false),
                        new RoomType("Double", 1, 1, 700000, 150000, true)))
                .build();
    }

    @Test
    @DisplayName("replaceRoom swaps the matching entry and keeps collection order")
    void replaceRoom_keepsOrder() {
        Listing listing = listing();

        listing.replaceRoom(new RoomType("Single", 2, 1, 500000, 100000, false));

        assertThat(listing.getRooms()).extracting(RoomType::type).containsExactly("Single", "Double");
        assertThat(listing.findRoom("Single")).map(RoomType::available).contains(1);
    }

    @Test
    @DisplayName("replaceRoom with an unknown type fails and leaves rooms untouched")
    void replaceRoom_unknownType() {
        Listing listing = listing();

        assertThatThrownBy(() -> listing.replaceRoom(new RoomType("Suite", 1, 1, 1, 1, false)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(listing.getRooms()).hasSize(2);
    }

    @Test
    @DisplayName("room type lookup is an exact, case-sensitive match")
    void findRoom_isExact() {
        assertThat(listing().findRoom("single")).isEmpty();
    }

    @Test
    @DisplayName("applyRating stores two decimals")
    void applyRating_scalesToTwoDecimals() {
        Listing listing = listing();

        listing.applyRating(new BigDecimal("4.5"), 2);

        assertThat(listing.getRating()).isEqualByComparingTo("4.50");
        assertThat(listing.getRating().scale()).isEqualTo(2);
        assertThat(listing.getRatingCount()).isEqualTo(2);
    }
}
