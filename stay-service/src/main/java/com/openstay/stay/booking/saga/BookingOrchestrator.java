package com.openstay.stay.booking.saga;

import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.stay.booking.api.dto.ConfirmBookingRequest;
import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.domain.model.BookingStatus;
import com.openstay.stay.booking.domain.model.CurrentStay;
import com.openstay.stay.booking.domain.repository.BookingRepository;
import com.openstay.stay.booking.domain.service.BookingReferenceGenerator;
import com.openstay.stay.events.StayEventPublisher;
import com.openstay.stay.inventory.domain.model.ReleaseOutcome;
import com.openstay.stay.inventory.domain.service.InventoryStore;
import com.openstay.stay.listing.domain.model.RoomType;
import com.openstay.stay.listing.domain.repository.ListingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Transactional workflow behind the booking ledger.
 *
 * Confirmation flow, one transaction:
 * 1. Lock the listing and validate the room type
 * 2. Reserve one unit (Inventory Store)
 * 3. Assign a booking reference
 * 4. Persist the booking as PAID
 *
 * Cancellation flow, one transaction:
 * 1. Lock the booking row
 * 2. Release one unit (Inventory Store)
 * 3. Delete the booking
 *
 * Any failure after step 2 rolls the inventory change back with the rest of the transaction; there is no
 * separate compensating call to forget. A version conflict on the listing (optimistic strategy) reruns the
 * whole transaction with a jittered backoff until the reservation goes through or the room type runs out.
 * Business rejections and timeouts are never retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingOrchestrator {

    private final InventoryStore inventoryStore;
    private final BookingRepository bookingRepository;
    private final ListingRepository listingRepository;
    private final BookingReferenceGenerator referenceGenerator;
    private final StayEventPublisher eventPublisher;

    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttemptsExpression = "${stay.retry.version-conflict.max-attempts:25}",
            backoff = @Backoff(
                    delayExpression = "${stay.retry.version-conflict.delay-ms:10}",
                    maxDelayExpression = "${stay.retry.version-conflict.max-delay-ms:200}",
                    multiplier = 1.5,
                    random = true)
    )
    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public Booking confirmBooking(ConfirmBookingRequest request) {
        log.info("Confirming booking for listing {}, room type {}, ref {}",
                request.listingId(), request.roomType(), request.bookingRef());

        if (StringUtils.hasText(request.bookingRef())) {
            Optional<Booking> existing = bookingRepository.findByBookingRef(request.bookingRef());
            if (existing.isPresent()) {
                log.info("Booking ref {} already confirmed as booking {}, nothing reserved",
                        request.bookingRef(), existing.get().getId());
                return existing.get();
            }
        }

        // Steps 1-2: the listing is read only under the inventory guard, so its room collection is never stale.
        // Throws ListingNotFoundException or OutOfInventoryException without writing.
        RoomType reserved = inventoryStore.reserve(request.listingId(), request.roomType());

        // Step 3
        String bookingRef = StringUtils.hasText(request.bookingRef())
                ? request.bookingRef()
                : referenceGenerator.next();

        // Step 4: flushed here so a constraint violation rolls back the reservation above
        Booking booking = Booking.builder()
                .listingId(request.listingId())
                .roomType(request.roomType())
                .guestName(request.name())
                .email(request.email())
                .mobile(request.mobile())
                .status(BookingStatus.PAID)
                .bookingRef(bookingRef)
                .amountMinor(request.amountMinor())
                .moveInDate(request.moveInDate() != null ? request.moveInDate() : LocalDate.now())
                .paidAt(LocalDateTime.now())
                .build();
        booking = bookingRepository.saveAndFlush(booking);

        eventPublisher.publishBookingConfirmed(booking);
        log.info("Booking {} ({}) confirmed, {} {} left in listing {}", booking.getId(), bookingRef,
                reserved.available(), reserved.type(), request.listingId());
        return booking;
    }

    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttemptsExpression = "${stay.retry.version-conflict.max-attempts:25}",
            backoff = @Backoff(
                    delayExpression = "${stay.retry.version-conflict.delay-ms:10}",
                    maxDelayExpression = "${stay.retry.version-conflict.max-delay-ms:200}",
                    multiplier = 1.5,
                    random = true)
    )
    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public Booking cancelBooking(Long bookingId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

        ReleaseOutcome outcome = inventoryStore.release(booking.getListingId(), booking.getRoomType());
        bookingRepository.delete(booking);
        bookingRepository.flush();

        eventPublisher.publishBookingCancelled(booking);
        log.info("Booking {} cancelled, inventory {}", bookingId, outcome);
        return booking;
    }

    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public Booking updateMoveInDate(Long bookingId, LocalDate moveInDate) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        booking.setMoveInDate(moveInDate);
        log.info("Booking {} move-in date set to {}", bookingId, moveInDate);
        return bookingRepository.saveAndFlush(booking);
    }

    @Transactional(timeoutString = "${stay.transaction.timeout-seconds:10}")
    public Booking assignRoom(Long bookingId, String roomNo, String floor) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        booking.setRoomNo(roomNo);
        booking.setFloor(floor);
        log.info("Booking {} assigned room {} on floor {}", bookingId, roomNo, floor);
        return bookingRepository.saveAndFlush(booking);
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    @Transactional(readOnly = true)
    public List<Booking> bookingsForListing(Long listingId) {
        return bookingRepository.findByListingIdOrderByCreatedAtDescIdDesc(listingId);
    }

    @Transactional(readOnly = true)
    public Optional<CurrentStay> currentStay(String email) {
        return bookingRepository.findFirstByEmailOrderByCreatedAtDescIdDesc(email)
                .flatMap(booking -> listingRepository.findById(booking.getListingId())
                        .map(listing -> new CurrentStay(booking, listing)));
    }

    @Transactional(readOnly = true)
    public int remindDueBookings() {
        List<Booking> due = bookingRepository.findByStatusAndEmailIsNotNull(BookingStatus.DUE);
        due.forEach(eventPublisher::publishPaymentDue);
        log.info("Queued payment reminders for {} due bookings", due.size());
        return due.size();
    }
}
