package com.openstay.common.exception;

import lombok.Getter;

/**
 * Business exception for domain-specific errors.
 * Thrown inside a transaction so that it rolls back; converted to a tagged result at the operation boundary.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
