package com.openstay.stay.inventory.domain.strategy;

import com.openstay.stay.listing.domain.model.Listing;

/**
 * Guard for the read-modify-write of a listing's room collection.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the listing row
 * - optimistic: plain read, version checked when the rewrite is flushed
 * - distributed: Redisson lock per listing held until the transaction completes, plus the version check
 *
 * Must be called inside a transaction; the guard lasts until that transaction ends.
 */
public interface InventoryLockStrategy {

    /**
     * Loads the listing under this strategy's guard.
     *
     * @param listingId Listing to guard
     * @return Listing whose room collection may now be rewritten
     * @throws com.openstay.stay.listing.exception.ListingNotFoundException if there is no such listing
     */
    Listing lockListing(Long listingId);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, OPTIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
