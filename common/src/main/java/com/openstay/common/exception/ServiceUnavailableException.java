package com.openstay.common.exception;

/**
 * Thrown when a guard the operation depends on (lock, store) could not be obtained in time.
 * The operation did not take effect; the client may retry. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends BusinessException {

    public ServiceUnavailableException(String message) {
        super(message, ErrorCode.SERVICE_UNAVAILABLE);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause, ErrorCode.SERVICE_UNAVAILABLE);
    }
}
