package com.dinebooking.common.util;

/**
 * Formats shared by request validation across services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String DATE_PATTERN = "^\\d{4}-\\d{2}-\\d{2}$";
    public static final String TIME_OF_DAY_PATTERN = "^\\d{2}:\\d{2}$";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
}
