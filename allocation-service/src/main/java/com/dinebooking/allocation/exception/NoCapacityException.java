package com.dinebooking.allocation.exception;

import com.dinebooking.common.exception.BusinessException;

/**
 * No table or combination can seat the party in the requested window, or the chosen
 * candidate was taken between discovery and commit.
 */
public class NoCapacityException extends BusinessException {

    public static final String NO_CAPACITY = "no_capacity";

    public NoCapacityException(String message) {
        super(message, NO_CAPACITY);
    }
}
