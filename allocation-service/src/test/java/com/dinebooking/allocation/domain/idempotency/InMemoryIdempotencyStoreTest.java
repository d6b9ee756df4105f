package com.dinebooking.allocation.domain.idempotency;

import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.config.AllocationProperties;
import com.dinebooking.allocation.exception.InvalidInputException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryIdempotencyStoreTest {

    private static final Instant NOW = Instant.parse("2030-03-15T18:00:00Z");
    private static final String KEY = "key-1";
    private static final String PAYLOAD = "fingerprint-a";
    private static final ReservationResponse RESULT = new ReservationResponse(
            "RES_0000ABCD", "R1", "S1", List.of("T1"), 2,
            Instant.parse("2030-03-15T23:00:00Z"), Instant.parse("2030-03-16T00:00:00Z"),
            60, "CONFIRMED", NOW, NOW);

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(clock, AllocationProperties.defaults());
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("first claim owns the key; once completed the same payload replays the result")
    void claimCompleteReplay() {
        IdempotencyClaim claim = store.claim(KEY, PAYLOAD);
        assertThat(claim.isOwner()).isTrue();
        assertThat(store.find(KEY, PAYLOAD)).isEmpty();

        store.complete(claim, RESULT);

        assertThat(store.find(KEY, PAYLOAD)).contains(RESULT);
        IdempotencyClaim retry = store.claim(KEY, PAYLOAD);
        assertThat(retry.isOwner()).isFalse();
        assertThat(retry.getReplay()).contains(RESULT);
    }

    @Test
    @DisplayName("reusing a live key with another payload is invalid_input")
    void payloadMismatch() {
        store.complete(store.claim(KEY, PAYLOAD), RESULT);

        assertThatThrownBy(() -> store.find(KEY, "fingerprint-b"))
                .isInstanceOf(InvalidInputException.class)
                .extracting("errorCode").isEqualTo("invalid_input");
        assertThatThrownBy(() -> store.claim(KEY, "fingerprint-b"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("a different payload is rejected even while the original is in flight")
    void payloadMismatchWhilePending() {
        store.claim(KEY, PAYLOAD);

        assertThatThrownBy(() -> store.claim(KEY, "fingerprint-b"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("after the TTL the key is treated as new")
    void expiry() {
        store.complete(store.claim(KEY, PAYLOAD), RESULT);

        clock.advance(Duration.ofSeconds(59));
        assertThat(store.find(KEY, PAYLOAD)).contains(RESULT);

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.find(KEY, PAYLOAD)).isEmpty();
        assertThat(store.claim(KEY, "fingerprint-b").isOwner()).isTrue();
    }

    @Test
    @DisplayName("an abandoned claim frees the key for a retry")
    void abandonFreesKey() {
        IdempotencyClaim claim = store.claim(KEY, PAYLOAD);

        store.abandon(claim);

        assertThat(store.size()).isZero();
        assertThat(store.claim(KEY, PAYLOAD).isOwner()).isTrue();
    }

    @Test
    @DisplayName("a concurrent duplicate waits for the owner and replays its result")
    void concurrentDuplicateReplays() throws Exception {
        IdempotencyClaim owner = store.claim(KEY, PAYLOAD);
        CountDownLatch started = new CountDownLatch(1);

        Future<IdempotencyClaim> duplicate = executor.submit(() -> {
            started.countDown();
            return store.claim(KEY, PAYLOAD);
        });
        started.await(5, TimeUnit.SECONDS);
        Thread.sleep(50);
        store.complete(owner, RESULT);

        IdempotencyClaim replay = duplicate.get(5, TimeUnit.SECONDS);
        assertThat(replay.isOwner()).isFalse();
        assertThat(replay.getReplay()).contains(RESULT);
    }

    @Test
    @DisplayName("a waiting duplicate takes over when the owner abandons")
    void waiterTakesOverAfterAbandon() throws Exception {
        IdempotencyClaim owner = store.claim(KEY, PAYLOAD);

        Future<IdempotencyClaim> duplicate = executor.submit(() -> store.claim(KEY, PAYLOAD));
        Thread.sleep(50);
        store.abandon(owner);

        assertThat(duplicate.get(5, TimeUnit.SECONDS).isOwner()).isTrue();
    }

    @Test
    @DisplayName("purge removes only expired entries")
    void purgeExpired() {
        store.complete(store.claim("old", PAYLOAD), RESULT);
        clock.advance(Duration.ofSeconds(30));
        store.complete(store.claim("recent", PAYLOAD), RESULT);
        store.claim("pending", PAYLOAD);
        clock.advance(Duration.ofSeconds(40));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find("recent", PAYLOAD)).contains(RESULT);
    }
}
