package com.openstay.stay.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Confirmed occupancy of one unit of a listing's room type.
 * Created when payment is confirmed, deleted on cancellation.
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_listing_id", columnList = "listing_id"),
                @Index(name = "idx_bookings_email", columnList = "email"),
                @Index(name = "idx_bookings_status", columnList = "status")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_bookings_booking_ref", columnNames = "booking_ref"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "listing_id", nullable = false)
    private Long listingId;

    @Column(name = "room_type", nullable = false, length = 50)
    private String roomType;

    @Column(name = "guest_name", nullable = false)
    private String guestName;

    @Column(name = "email")
    private String email;

    @Column(name = "mobile", length = 20)
    private String mobile;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private BookingStatus status;

    @Column(name = "booking_ref", nullable = false, length = 100)
    private String bookingRef;

    @Column(name = "amount_minor", nullable = false)
    private Long amountMinor;

    @Column(name = "move_in_date")
    private LocalDate moveInDate;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "room_no", length = 50)
    private String roomNo;

    @Column(name = "floor_label", length = 50)
    private String floor;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = BookingStatus.DUE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
