package com.openstay.stay.inventory.domain.strategy;

import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inventory guard using a database row lock (SELECT FOR UPDATE) on the listing.
 *
 * Concurrent reservations on the same listing queue on the row; disjoint listings proceed in parallel.
 * The lock is released when the caller's transaction commits or rolls back.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockInventoryStrategy implements InventoryLockStrategy {

    private final ListingRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Listing lockListing(Long listingId) {
        Listing listing = repository.findByIdForUpdate(listingId)
                .orElseThrow(() -> new ListingNotFoundException(listingId));
        log.debug("Locked listing row {} (version {})", listingId, listing.getVersion());
        return listing;
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
