package com.openstay.stay.events;

import com.openstay.stay.booking.domain.model.Booking;
import com.openstay.stay.visit.domain.model.VisitRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking and visit events. This is how the core "sends a notification":
 * email delivery consumes these topics.
 *
 * Events raised inside a transaction are sent only after it commits, so a rolled-back booking never
 * produces a confirmation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StayEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";
    static final String TOPIC_BOOKING_PAYMENT_DUE = "booking-payment-due";
    static final String TOPIC_VISIT_REQUESTED = "visit-requested";
    static final String TOPIC_VISIT_DECIDED = "visit-decided";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishBookingConfirmed(Booking booking) {
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .bookingRef(booking.getBookingRef())
                .listingId(booking.getListingId())
                .roomType(booking.getRoomType())
                .guestName(booking.getGuestName())
                .email(booking.getEmail())
                .amountMinor(booking.getAmountMinor())
                .moveInDate(booking.getMoveInDate())
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CONFIRMED, String.valueOf(booking.getId()), event);
    }

    public void publishBookingCancelled(Booking booking) {
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .bookingRef(booking.getBookingRef())
                .listingId(booking.getListingId())
                .roomType(booking.getRoomType())
                .email(booking.getEmail())
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CANCELLED, String.valueOf(booking.getId()), event);
    }

    public void publishPaymentDue(Booking booking) {
        PaymentDueEvent event = PaymentDueEvent.builder()
                .bookingId(booking.getId())
                .guestName(booking.getGuestName())
                .email(booking.getEmail())
                .amountMinor(booking.getAmountMinor())
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_PAYMENT_DUE, String.valueOf(booking.getId()), event);
    }

    public void publishVisitRequested(VisitRequest request, boolean rescheduled) {
        VisitRequestedEvent event = VisitRequestedEvent.builder()
                .visitRequestId(request.getId())
                .listingId(request.getListingId())
                .ownerEmail(request.getOwnerEmail())
                .userEmail(request.getUserEmail())
                .userName(request.getUserName())
                .visitDate(request.getVisitDate())
                .visitTime(request.getVisitTime())
                .rescheduled(rescheduled)
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_VISIT_REQUESTED, String.valueOf(request.getId()), event);
    }

    public void publishVisitDecided(VisitRequest request) {
        VisitDecidedEvent event = VisitDecidedEvent.builder()
                .visitRequestId(request.getId())
                .listingId(request.getListingId())
                .userEmail(request.getUserEmail())
                .status(request.getStatus().name())
                .visitDate(request.getVisitDate())
                .visitTime(request.getVisitTime())
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_VISIT_DECIDED, String.valueOf(request.getId()), event);
    }

    private void publishAfterCommit(String topic, String key, Object event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(topic, key, event);
                }
            });
        } else {
            send(topic, key, event);
        }
    }

    /**
     * The state change is already committed when this runs, so a broker failure is logged and not
     * propagated to the caller.
     */
    private void send(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Event published successfully to topic {}: offset={}",
                            topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event to topic {} for key {}", topic, key, ex);
                }
            });
        } catch (RuntimeException ex) {
            log.error("Failed to hand event to Kafka producer for topic {} key {}", topic, key, ex);
        }
    }
}
