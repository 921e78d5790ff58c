package com.openstay.stay.visit.domain.model;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VisitRequestTest {

    private VisitRequest pending() {
        return VisitRequest.builder()
                .id(1L)
                .userEmail("asha@example.com")
                .userName("Asha")
                .listingId(3L)
                .visitDate(LocalDate.of(2026, 11, 1))
                .visitTime(LocalTime.of(10, 0))
                .status(VisitStatus.PENDING)
                .pendingKey(VisitRequest.pendingKeyFor("asha@example.com", 3L))
                .build();
    }

    @Test
    @DisplayName("pending key ignores email case and surrounding whitespace")
    void pendingKey_isNormalized() {
        assertThat(VisitRequest.pendingKeyFor("  Asha@Example.com ", 3L))
                .isEqualTo(VisitRequest.pendingKeyFor("asha@example.com", 3L))
                .isEqualTo("asha@example.com|3");
    }

    @Test
    @DisplayName("deciding frees the pending slot")
    void decide_clearsPendingKey() {
        VisitRequest request = pending();

        assertThat(request.decide(VisitStatus.APPROVED)).isTrue();

        assertThat(request.getStatus()).isEqualTo(VisitStatus.APPROVED);
        assertThat(request.getPendingKey()).isNull();
        assertThat(request.isPending()).isFalse();
    }

    @Test
    @DisplayName("repeating the same decision is a no-op; the opposite decision is refused")
    void decide_terminalStates() {
        VisitRequest request = pending();
        request.decide(VisitStatus.REJECTED);

        assertThat(request.decide(VisitStatus.REJECTED)).isFalse();
        assertThatThrownBy(() -> request.decide(VisitStatus.APPROVED))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.VISIT_ALREADY_DECIDED);
        assertThat(request.getStatus()).isEqualTo(VisitStatus.REJECTED);
    }

    @Test
    @DisplayName("reschedule replaces date and time only")
    void reschedule() {
        VisitRequest request = pending();

        request.reschedule(LocalDate.of(2026, 11, 5), LocalTime.of(16, 30));

        assertThat(request.getVisitDate()).isEqualTo(LocalDate.of(2026, 11, 5));
        assertThat(request.getVisitTime()).isEqualTo(LocalTime.of(16, 30));
        assertThat(request.getStatus()).isEqualTo(VisitStatus.PENDING);
        assertThat(request.getPendingKey()).isEqualTo("asha@example.com|3");
    }
}
