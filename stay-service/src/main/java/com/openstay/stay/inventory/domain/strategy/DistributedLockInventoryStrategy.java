package com.openstay.stay.inventory.domain.strategy;

import com.openstay.common.exception.ServiceUnavailableException;
import com.openstay.common.util.Constants;
import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.listing.exception.ListingNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.TimeUnit;

/**
 * Inventory guard using a Redis/Redisson lock per listing, for deployments with several service instances.
 *
 * The lock is released after the transaction completes, never before the commit, so the next holder
 * always reads the committed collection. The listing version is still checked on flush.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "inventory.reservation.strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLockInventoryStrategy implements InventoryLockStrategy {

    private final ListingRepository repository;
    private final RedissonClient redissonClient;

    @Value("${inventory.lock.wait-seconds:5}")
    private long waitSeconds;

    @Value("${inventory.lock.lease-seconds:30}")
    private long leaseSeconds;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Listing lockListing(Long listingId) {
        String lockKey = Constants.LISTING_LOCK_PREFIX + listingId;
        RLock lock = redissonClient.getLock(lockKey);

        boolean acquired;
        try {
            acquired = lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for inventory lock " + lockKey, e);
        }
        if (!acquired) {
            throw new ServiceUnavailableException("Unable to acquire inventory lock for listing " + listingId);
        }
        log.debug("Acquired distributed lock: {}", lockKey);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                    log.debug("Released distributed lock: {}", lockKey);
                }
            }
        });

        return repository.findById(listingId)
                .orElseThrow(() -> new ListingNotFoundException(listingId));
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
