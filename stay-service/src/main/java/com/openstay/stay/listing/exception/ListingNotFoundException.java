package com.openstay.stay.listing.exception;

import com.openstay.common.exception.ErrorCode;
import com.openstay.common.exception.ResourceNotFoundException;

public class ListingNotFoundException extends ResourceNotFoundException {
    public ListingNotFoundException(Long listingId) {
        super("Listing", listingId, ErrorCode.LISTING_NOT_FOUND);
    }
}
