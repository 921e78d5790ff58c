package com.openstay.stay.inventory.exception;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCode;

/**
 * Reservation attempted against a room type with no vacancy, or one the listing does not offer.
 */
public class OutOfInventoryException extends BusinessException {
    public OutOfInventoryException(String message) {
        super(message, ErrorCode.OUT_OF_INVENTORY);
    }

    public static OutOfInventoryException noVacancy(Long listingId, String roomType) {
        return new OutOfInventoryException(String.format(
                "No %s rooms left in listing %d", roomType, listingId));
    }

    public static OutOfInventoryException notOffered(Long listingId, String roomType) {
        return new OutOfInventoryException(String.format(
                "Listing %d does not offer room type %s", listingId, roomType));
    }
}
