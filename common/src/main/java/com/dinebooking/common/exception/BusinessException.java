package com.dinebooking.common.exception;

import lombok.Getter;

/**
 * Base type for domain errors that map onto the public error taxonomy.
 * The error code is what clients switch on; the message is for humans.
 */
@Getter
public class BusinessException extends RuntimeException {
    public static final String INVALID_INPUT = "invalid_input";

    private final String errorCode;

    public BusinessException(String message) {
        this(message, INVALID_INPUT);
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
