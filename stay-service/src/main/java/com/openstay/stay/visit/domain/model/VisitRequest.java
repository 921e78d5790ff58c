package com.openstay.stay.visit.domain.model;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;

/**
 * A user's request to visit a listing.
 *
 * At most one request per (user, listing) is pending at any time. The pending slot is the unique
 * {@code pending_key} column: it holds the normalized pair while the request is pending and is cleared
 * once the owner decides, so decided requests never block a new one.
 */
@Entity
@Table(name = "visit_requests",
        indexes = {
                @Index(name = "idx_visit_requests_user_email", columnList = "user_email"),
                @Index(name = "idx_visit_requests_listing_id", columnList = "listing_id")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_visit_requests_pending_key", columnNames = "pending_key"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @Column(name = "user_name", nullable = false)
    private String userName;

    @Column(name = "listing_id", nullable = false)
    private Long listingId;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Column(name = "visit_date", nullable = false)
    private LocalDate visitDate;

    @Column(name = "visit_time", nullable = false)
    private LocalTime visitTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private VisitStatus status;

    @Column(name = "pending_key", length = 320)
    private String pendingKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = VisitStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public static String pendingKeyFor(String userEmail, Long listingId) {
        return userEmail.trim().toLowerCase(Locale.ROOT) + "|" + listingId;
    }

    public boolean isPending() {
        return status == VisitStatus.PENDING;
    }

    public void reschedule(LocalDate date, LocalTime time) {
        this.visitDate = date;
        this.visitTime = time;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Moves the request to {@code target}.
     *
     * @return false when the request was already in {@code target}
     * @throws BusinessException VISIT_ALREADY_DECIDED when the request was decided the other way
     */
    public boolean decide(VisitStatus target) {
        if (target == VisitStatus.PENDING) {
            throw new IllegalArgumentException("A decision must be APPROVED or REJECTED");
        }
        if (status == target) {
            return false;
        }
        if (status != VisitStatus.PENDING) {
            throw new BusinessException(
                    String.format("Visit request %d is already %s", id, status), ErrorCode.VISIT_ALREADY_DECIDED);
        }
        this.status = target;
        this.pendingKey = null;
        this.updatedAt = LocalDateTime.now();
        return true;
    }
}
