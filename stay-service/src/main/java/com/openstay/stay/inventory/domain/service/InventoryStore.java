package com.openstay.stay.inventory.domain.service;

import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.stay.inventory.domain.model.ReleaseOutcome;
import com.openstay.stay.inventory.domain.strategy.InventoryLockStrategy;
import com.openstay.stay.inventory.exception.OutOfInventoryException;
import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.model.RoomType;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Per-listing room capacity with atomic reserve/release.
 *
 * Every mutation is one guarded read-modify-write of the listing's room collection: the configured
 * {@link InventoryLockStrategy} loads the listing, the matching RoomType is replaced, and the collection
 * is flushed with a version check. Strategy beans are injected as a map keyed by bean name and chosen by
 * {@code inventory.reservation.strategy} (pessimistic | optimistic | distributed).
 *
 * Reserve and release are not idempotent. Callers own the guarantee of one release per reservation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryStore {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, InventoryLockStrategy> lockStrategies;
    private final ListingRepository listingRepository;

    @Value("${inventory.reservation.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized InventoryStore with strategy: {}", getLockStrategy().getStrategyType());
    }

    /**
     * Takes one unit of {@code roomType} in the listing. Writes nothing when the type is missing or full.
     *
     * @return The room type after the reservation
     * @throws OutOfInventoryException if the type has no vacancy or is not offered
     * @throws ListingNotFoundException if the listing does not exist
     */
    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public RoomType reserve(Long listingId, String roomType) {
        Listing listing = getLockStrategy().lockListing(listingId);
        RoomType room = listing.findRoom(roomType)
                .orElseThrow(() -> OutOfInventoryException.notOffered(listingId, roomType));

        if (!room.hasVacancy()) {
            throw OutOfInventoryException.noVacancy(listingId, roomType);
        }

        RoomType reserved = room.withOneReserved();
        listing.replaceRoom(reserved);
        listingRepository.saveAndFlush(listing);
        log.info("Reserved {} in listing {}: {}/{} available", roomType, listingId,
                reserved.available(), reserved.totalCount());
        return reserved;
    }

    /**
     * Returns one unit of {@code roomType} to the listing, never beyond its total count.
     * A release against a fully available type is reported as {@link ReleaseOutcome#CLAMPED} and writes nothing.
     *
     * @throws ResourceNotFoundException if the listing does not offer the type
     * @throws ListingNotFoundException if the listing does not exist
     */
    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public ReleaseOutcome release(Long listingId, String roomType) {
        Listing listing = getLockStrategy().lockListing(listingId);
        RoomType room = listing.findRoom(roomType)
                .orElseThrow(() -> new ResourceNotFoundException("Room type", listingId + "/" + roomType));

        if (room.allAvailable()) {
            log.warn("ReleaseWithoutMatchingReservation: {} in listing {} already has {}/{} available, release ignored",
                    roomType, listingId, room.available(), room.totalCount());
            return ReleaseOutcome.CLAMPED;
        }

        RoomType released = room.withOneReleased();
        listing.replaceRoom(released);
        listingRepository.saveAndFlush(listing);
        log.info("Released {} in listing {}: {}/{} available", roomType, listingId,
                released.available(), released.totalCount());
        return ReleaseOutcome.RELEASED;
    }

    @Transactional(readOnly = true)
    public List<RoomType> rooms(Long listingId) {
        return listingRepository.findById(listingId)
                .map(Listing::getRooms)
                .orElseThrow(() -> new ListingNotFoundException(listingId));
    }

    /**
     * Looks up the configured strategy by bean name, falling back to pessimistic for unknown names.
     */
    private InventoryLockStrategy getLockStrategy() {
        String strategyKey = strategyType.toLowerCase();
        InventoryLockStrategy strategy = lockStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}
