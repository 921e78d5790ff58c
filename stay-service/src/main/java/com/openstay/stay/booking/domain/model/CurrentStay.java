package com.openstay.stay.booking.domain.model;

import com.openstay.stay.listing.domain.model.Listing;

/**
 * A guest's most recent booking together with the listing it is for.
 */
public record CurrentStay(Booking booking, Listing listing) {
}
