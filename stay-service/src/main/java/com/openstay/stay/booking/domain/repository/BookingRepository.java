package com.openstay.stay.booking.domain.repository;

import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.booking.domain.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Locks the booking row so that concurrent cancellations of the same booking release inventory once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    Optional<Booking> findByBookingRef(String bookingRef);

    List<Booking> findByListingIdOrderByCreatedAtDescIdDesc(Long listingId);

    Optional<Booking> findFirstByEmailOrderByCreatedAtDescIdDesc(String email);

    List<Booking> findByStatusAndEmailIsNotNull(BookingStatus status);
}
