package com.openstay.common.exception;

/**
 * Exception thrown when a requested resource is not found.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String resourceType, Object identifier) {
        this(resourceType, identifier, ErrorCode.NOT_FOUND);
    }

    protected ResourceNotFoundException(String resourceType, Object identifier, ErrorCode errorCode) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), errorCode);
    }
}
