package com.dinebooking.allocation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tunables under {@code allocation.*} in application.yml.
 */
@ConfigurationProperties(prefix = "allocation")
public record AllocationProperties(
        @DefaultValue("15") int slotMinutes,
        @DefaultValue("30") int minDurationMinutes,
        @DefaultValue("180") int maxDurationMinutes,
        @DefaultValue Lock lock,
        @DefaultValue Idempotency idempotency) {

    public static AllocationProperties defaults() {
        return new AllocationProperties(15, 30, 180,
                new Lock(Duration.ofSeconds(5)),
                new Idempotency(Duration.ofSeconds(60), Duration.ofSeconds(10), 60_000L));
    }

    /**
     * @param timeout total wait for all locks of one commit
     */
    public record Lock(@DefaultValue("5s") Duration timeout) {
    }

    /**
     * @param ttl             lifetime of a completed entry
     * @param pendingWait     how long a duplicate request waits for an in-flight original
     * @param purgeIntervalMs delay between expiry sweeps
     */
    public record Idempotency(
            @DefaultValue("60s") Duration ttl,
            @DefaultValue("10s") Duration pendingWait,
            @DefaultValue("60000") long purgeIntervalMs) {
    }
}
