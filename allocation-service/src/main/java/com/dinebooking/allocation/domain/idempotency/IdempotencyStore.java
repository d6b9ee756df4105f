package com.dinebooking.allocation.domain.idempotency;

import com.dinebooking.allocation.api.dto.ReservationResponse;

import java.util.Optional;

/**
 * Deduplicates reservation commits by client-supplied key within a TTL.
 * Reusing a live key with a different payload is an {@code invalid_input} error.
 */
public interface IdempotencyStore {

    /**
     * Completed result for a live key with a matching payload, or empty for an unknown,
     * expired or still in-flight key.
     */
    Optional<ReservationResponse> find(String key, String fingerprint);

    /**
     * Atomically claims {@code key}. A concurrent request with the same payload waits for the
     * owner and replays its result instead of committing a second time.
     */
    IdempotencyClaim claim(String key, String fingerprint);

    void complete(IdempotencyClaim claim, ReservationResponse result);

    /**
     * Drops an owned claim after a failed attempt so the key can be retried.
     */
    void abandon(IdempotencyClaim claim);

    int purgeExpired();
}
