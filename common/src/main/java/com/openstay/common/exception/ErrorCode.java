package com.openstay.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by all core operations.
 * The tag is what clients see in the {@code error} field; the status is what the HTTP layer answers with.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR("ValidationError", HttpStatus.BAD_REQUEST),
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
    LISTING_NOT_FOUND("ListingNotFound", HttpStatus.NOT_FOUND),
    OUT_OF_INVENTORY("OutOfInventory", HttpStatus.CONFLICT),
    VISIT_ALREADY_DECIDED("VisitAlreadyDecided", HttpStatus.CONFLICT),
    SERVICE_UNAVAILABLE("ServiceUnavailable", HttpStatus.SERVICE_UNAVAILABLE),
    PERSISTENCE_FAILURE("PersistenceFailure", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR("InternalError", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String tag;
    private final HttpStatus status;

    ErrorCode(String tag, HttpStatus status) {
        this.tag = tag;
        this.status = status;
    }
}
