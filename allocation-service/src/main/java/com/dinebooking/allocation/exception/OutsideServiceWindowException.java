package com.dinebooking.allocation.exception;

import com.dinebooking.common.exception.BusinessException;

/**
 * Requested window does not intersect any of the restaurant's service windows.
 */
public class OutsideServiceWindowException extends BusinessException {

    public static final String OUTSIDE_SERVICE_WINDOW = "outside_service_window";

    public OutsideServiceWindowException(String message) {
        super(message, OUTSIDE_SERVICE_WINDOW);
    }
}
