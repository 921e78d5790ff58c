package com.openstay.stay.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openstay.stay.booking.domain.model.CurrentStay;
import com.openstay.stay.listing.api.dto.ListingSummaryResponse;

import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CurrentStayResponse(
        boolean hasStay,
        ListingSummaryResponse listing,
        BookingResponse booking
) {
    public static CurrentStayResponse from(Optional<CurrentStay> stay) {
        return stay
                .map(s -> new CurrentStayResponse(true,
                        ListingSummaryResponse.from(s.listing()),
                        BookingResponse.from(s.booking())))
                .orElseGet(() -> new CurrentStayResponse(false, null, null));
    }
}
