package com.openstay.stay.listing.domain.repository;

import com.openstay.stay.listing.domain.model.Listing;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Listing lookup plus the row lock that serializes room and rating rewrites per listing.
 */
public interface ListingRepository extends JpaRepository<Listing, Long> {

    /**
     * SELECT FOR UPDATE on the listing row. Held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Listing l WHERE l.id = :id")
    Optional<Listing> findByIdForUpdate(@Param("id") Long id);
}
