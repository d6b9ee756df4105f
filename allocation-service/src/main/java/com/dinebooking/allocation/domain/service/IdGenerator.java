package com.dinebooking.allocation.domain.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Public ids: a type prefix plus eight upper-case hex characters.
 */
@Component
public class IdGenerator {

    public String reservationId() {
        return "RES_" + randomHex();
    }

    public String blackoutId() {
        return "BLK_" + randomHex();
    }

    private String randomHex() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
