package com.openstay.stay.listing.domain.model;

import com.openstay.stay.listing.domain.converter.RoomTypeListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bookable accommodation. Listing CRUD happens elsewhere; this service owns only the room collection
 * and the derived rating fields, and mutates them under a per-listing guard.
 *
 * The room collection is stored as a single ordered document on the listing row and is always
 * replaced as a unit. The version column makes every rewrite a compare-and-swap.
 */
@Entity
@Table(name = "listings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Convert(converter = RoomTypeListConverter.class)
    @Column(name = "rooms", nullable = false, length = 8000)
    @Builder.Default
    private List<RoomType> rooms = new ArrayList<>();

    @Column(name = "rating", nullable = false, precision = 3, scale = 2)
    @Builder.Default
    private BigDecimal rating = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    @Column(name = "rating_count", nullable = false)
    @Builder.Default
    private Integer ratingCount = 0;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public List<RoomType> getRooms() {
        return Collections.unmodifiableList(rooms);
    }

    public Optional<RoomType> findRoom(String type) {
        return rooms.stream()
                .filter(room -> room.type().equals(type))
                .findFirst();
    }

    /**
     * Rewrites the whole collection with {@code updated} in place of the entry of the same type.
     */
    public void replaceRoom(RoomType updated) {
        List<RoomType> rewritten = new ArrayList<>(rooms.size());
        boolean replaced = false;
        for (RoomType room : rooms) {
            if (room.type().equals(updated.type())) {
                rewritten.add(updated);
                replaced = true;
            } else {
                rewritten.add(room);
            }
        }
        if (!replaced) {
            throw new IllegalArgumentException("Listing " + id + " has no room type " + updated.type());
        }
        this.rooms = rewritten;
    }

    public void applyRating(BigDecimal average, int count) {
        this.rating = average.setScale(2, RoundingMode.HALF_UP);
        this.ratingCount = count;
    }
}
