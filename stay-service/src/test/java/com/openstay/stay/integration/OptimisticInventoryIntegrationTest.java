package com.openstay.stay.integration;

import com.openstay.common.exception.ErrorCode;
import com.openstay.common.result.OperationResult;
import com.openstay.stay.booking.api.dto.ConfirmBookingRequest;
import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.domain.repository.BookingRepository;
import com.openstay.stay.booking.domain.service.BookingLedger;
import com.openstay.stay.events.StayEventPublisher;
import com.openstay.stay.listing.domain.model.Listing;
import com.openstay.stay.listing.domain.model.RoomType;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import com.openstay.stay.review.domain.repository.ReviewRepository;
import com.openstay.stay.review.domain.service.RatingAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Confirmations under the version-check guard. Concurrent writers to one listing collide on its version
 * column; losers are rerun until they either get a room or find the type full.
 */
@SpringBootTest(properties = {
        "inventory.reservation.strategy=optimistic",
        "spring.datasource.url=jdbc:h2:mem:stay_optimistic;LOCK_TIMEOUT=10000;DB_CLOSE_DELAY=-1"
})
class OptimisticInventoryIntegrationTest {

    @Autowired
    private BookingLedger bookingLedger;
    @Autowired
    private RatingAggregator ratingAggregator;
    @Autowired
    private ListingRepository listingRepository;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private ReviewRepository reviewRepository;

    @MockBean
    private StayEventPublisher eventPublisher;

    @BeforeEach
    void cleanDatabase() {
        bookingRepository.deleteAll();
        reviewRepository.deleteAll();
        listingRepository.deleteAll();
    }

    private Listing listingWithSingles(int total) {
        return listingRepository.save(Listing.builder()
                .title("Lakeview Hostel")
                .ownerEmail("owner@example.com")
                .rooms(List.of(new RoomType("Single", total, total, 450000, 90000, false)))
                .build());
    }

    private int availableSingles(Long listingId) {
        return listingRepository.findById(listingId).orElseThrow()
                .findRoom("Single").orElseThrow().available();
    }

    private ConfirmBookingRequest confirm(Long listingId, String guest) {
        return new ConfirmBookingRequest(guest, guest.toLowerCase() + "@example.com", null, listingId, "Single",
                450000L, null, null);
    }

    @Test
    @DisplayName("ten callers on five singles: five bookings, the rest OutOfInventory, none failed")
    void concurrentConfirmations_fillCapacity() throws Exception {
        Long listingId = listingWithSingles(5).getId();

        List<OperationResult<Booking>> results = runConcurrently(10,
                i -> bookingLedger.confirmBooking(confirm(listingId, "Guest" + i)));

        assertThat(results).filteredOn(OperationResult::isSuccess).hasSize(5);
        assertThat(results).filteredOn(result -> !result.isSuccess())
                .allSatisfy(result -> assertThat(result.getError()).contains(ErrorCode.OUT_OF_INVENTORY));
        assertThat(availableSingles(listingId)).isZero();
        assertThat(bookingRepository.findByListingIdOrderByCreatedAtDescIdDesc(listingId)).hasSize(5);
    }

    @Test
    @DisplayName("reviews rewriting the listing alongside confirmations do not fail any booking")
    void confirmationsInterleavedWithReviews_allSucceed() throws Exception {
        Long listingId = listingWithSingles(50).getId();

        List<OperationResult<?>> results = this.<OperationResult<?>>runConcurrently(8, i -> i % 2 == 0
                ? bookingLedger.confirmBooking(confirm(listingId, "Guest" + i))
                : ratingAggregator.addReview(listingId, "Reviewer" + i, 4, "Quiet floor", null));

        assertThat(results).allMatch(OperationResult::isSuccess);
        assertThat(availableSingles(listingId)).isEqualTo(46);
        Listing listing = listingRepository.findById(listingId).orElseThrow();
        assertThat(listing.getRatingCount()).isEqualTo(4);
        assertThat(listing.getRating()).isEqualByComparingTo("4.00");
    }

    private interface IndexedCall<T> {
        T call(int index);
    }

    private <T> List<T> runConcurrently(int callers, IndexedCall<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                int index = i;
                Callable<T> task = () -> {
                    start.await();
                    return call.call(index);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
