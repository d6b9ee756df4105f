package com.dinebooking.allocation.exception;

import com.dinebooking.common.exception.BusinessException;

/**
 * Malformed or inconsistent request, including reuse of an idempotency key with a different payload.
 */
public class InvalidInputException extends BusinessException {

    public InvalidInputException(String message) {
        super(message, INVALID_INPUT);
    }
}
