package com.dinebooking.common.exception;

/**
 * Thrown when a restaurant, sector, table, reservation or blackout does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String NOT_FOUND = "not_found";

    public ResourceNotFoundException(String message) {
        super(message, NOT_FOUND);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), NOT_FOUND);
    }
}
