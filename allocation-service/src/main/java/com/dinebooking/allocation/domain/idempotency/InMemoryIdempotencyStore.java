package com.dinebooking.allocation.domain.idempotency;

import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.config.AllocationProperties;
import com.dinebooking.allocation.exception.InvalidInputException;
import com.dinebooking.allocation.exception.TableLockedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Process-local idempotency table. Claims are inserted with {@link ConcurrentMap#compute},
 * so two first-time requests with the same key cannot both become owners.
 * Expired entries are dropped on access and by a periodic sweep.
 */
@Slf4j
@Component
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final Duration pendingWait;

    public InMemoryIdempotencyStore(Clock clock, AllocationProperties properties) {
        this.clock = clock;
        this.ttl = properties.idempotency().ttl();
        this.pendingWait = properties.idempotency().pendingWait();
    }

    @Override
    public Optional<ReservationResponse> find(String key, String fingerprint) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        requireSamePayload(key, entry, fingerprint);
        return entry.completedResult();
    }

    @Override
    public IdempotencyClaim claim(String key, String fingerprint) {
        while (true) {
            Entry fresh = new Entry(fingerprint);
            Instant now = clock.instant();
            Entry current = entries.compute(key, (k, existing) ->
                    existing == null || existing.isExpired(now) ? fresh : existing);

            if (current == fresh) {
                return IdempotencyClaim.owner(key, fingerprint, fresh);
            }
            requireSamePayload(key, current, fingerprint);

            Optional<ReservationResponse> done = current.completedResult();
            if (done.isPresent()) {
                log.debug("Idempotency hit for key: {}", key);
                return IdempotencyClaim.replay(key, fingerprint, done.get());
            }

            Optional<ReservationResponse> awaited = await(key, current);
            if (awaited.isPresent()) {
                log.debug("Idempotency hit for key {} after waiting for in-flight request", key);
                return IdempotencyClaim.replay(key, fingerprint, awaited.get());
            }
            // the in-flight owner abandoned its claim; compete for the key again
        }
    }

    @Override
    public void complete(IdempotencyClaim claim, ReservationResponse result) {
        Entry entry = ownedEntry(claim);
        entry.expiresAt = clock.instant().plus(ttl);
        entry.result.complete(result);
        log.debug("Stored idempotency result for key {} (ttl {}s)", claim.getKey(), ttl.toSeconds());
    }

    @Override
    public void abandon(IdempotencyClaim claim) {
        if (!claim.isOwner()) {
            return;
        }
        Entry entry = ownedEntry(claim);
        entries.remove(claim.getKey(), entry);
        entry.result.cancel(false);
        log.debug("Abandoned idempotency claim for key: {}", claim.getKey());
    }

    @Scheduled(fixedDelayString = "${allocation.idempotency.purge-interval-ms:60000}")
    public void purgeExpiredOnSchedule() {
        purgeExpired();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.info("Purged {} expired idempotency keys", purged);
        }
        return Math.max(purged, 0);
    }

    int size() {
        return entries.size();
    }

    private Optional<ReservationResponse> await(String key, Entry pending) {
        try {
            return Optional.of(pending.result.get(pendingWait.toMillis(), TimeUnit.MILLISECONDS));
        } catch (CancellationException e) {
            return Optional.empty();
        } catch (TimeoutException e) {
            throw new TableLockedException(
                    "A request with idempotency key " + key + " is still in progress", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TableLockedException("Interrupted while waiting on idempotency key " + key, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Idempotent request " + key + " failed", e.getCause());
        }
    }

    private void requireSamePayload(String key, Entry entry, String fingerprint) {
        if (!entry.fingerprint.equals(fingerprint)) {
            log.warn("Idempotency key {} reused with a different payload", key);
            throw new InvalidInputException("Idempotency key " + key + " was already used with a different payload");
        }
    }

    private Entry ownedEntry(IdempotencyClaim claim) {
        if (!claim.isOwner() || !(claim.getToken() instanceof Entry entry)) {
            throw new IllegalStateException("Claim for key " + claim.getKey() + " is not owned by this caller");
        }
        return entry;
    }

    private static final class Entry {
        private final String fingerprint;
        private final CompletableFuture<ReservationResponse> result = new CompletableFuture<>();
        // null while the owning request is in flight
        private volatile Instant expiresAt;

        private Entry(String fingerprint) {
            this.fingerprint = fingerprint;
        }

        private boolean isExpired(Instant now) {
            Instant expiry = expiresAt;
            return expiry != null && !now.isBefore(expiry);
        }

        private Optional<ReservationResponse> completedResult() {
            if (result.isDone() && !result.isCompletedExceptionally()) {
                return Optional.of(result.join());
            }
            return Optional.empty();
        }
    }
}
