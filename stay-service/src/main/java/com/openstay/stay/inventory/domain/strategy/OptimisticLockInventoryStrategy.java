package com.openstay.stay.inventory.domain.strategy;

import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inventory guard using version-based conflict detection (@Version on the listing).
 *
 * Flow:
 * 1. Read the listing with its version
 * 2. Rewrite the room collection
 * 3. Flush: UPDATE ... WHERE version = :read, throws OptimisticLockingFailureException if another writer won
 * 4. The whole transaction rolls back and is retried by the calling workflow
 */
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockInventoryStrategy implements InventoryLockStrategy {

    private final ListingRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Listing lockListing(Long listingId) {
        return repository.findById(listingId)
                .orElseThrow(() -> new ListingNotFoundException(listingId));
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
