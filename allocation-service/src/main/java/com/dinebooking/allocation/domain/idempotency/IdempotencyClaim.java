package com.dinebooking.allocation.domain.idempotency;

import com.dinebooking.allocation.api.dto.ReservationResponse;

import java.util.Optional;

/**
 * Outcome of {@link IdempotencyStore#claim}: either this caller owns the key and must
 * complete or abandon it, or an earlier result is replayed.
 */
public final class IdempotencyClaim {

    private final String key;
    private final String fingerprint;
    private final ReservationResponse replay;
    private final Object token;

    private IdempotencyClaim(String key, String fingerprint, ReservationResponse replay, Object token) {
        this.key = key;
        this.fingerprint = fingerprint;
        this.replay = replay;
        this.token = token;
    }

    static IdempotencyClaim owner(String key, String fingerprint, Object token) {
        return new IdempotencyClaim(key, fingerprint, null, token);
    }

    static IdempotencyClaim replay(String key, String fingerprint, ReservationResponse result) {
        return new IdempotencyClaim(key, fingerprint, result, null);
    }

    public String getKey() {
        return key;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public boolean isOwner() {
        return replay == null;
    }

    public Optional<ReservationResponse> getReplay() {
        return Optional.ofNullable(replay);
    }

    Object getToken() {
        return token;
    }
}
