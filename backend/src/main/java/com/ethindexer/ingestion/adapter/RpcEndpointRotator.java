package com.ethindexer.ingestion.adapter;

import com.ethindexer.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Round-robin RPC endpoint selection with per-endpoint cool-down and the retry delay schedule.
 * A cooled-down endpoint is skipped until its cool-down expires, unless every endpoint is cooling down.
 */
@Slf4j
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();
    private final LongSupplier clockMs;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        this(endpoints, retryPolicy, System::currentTimeMillis);
    }

    RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, LongSupplier clockMs) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.clockMs = clockMs;
    }

    /**
     * Next endpoint in round-robin order, skipping endpoints that are cooling down.
     */
    public String getNextEndpoint() {
        long now = clockMs.getAsLong();
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            Long until = cooldownUntilMs.get(endpoint);
            if (until == null || until <= now) {
                return endpoint;
            }
            log.debug("Skipping cooled-down endpoint {} for {} ms", endpoint, until - now);
        }
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    public void markCoolingDown(String endpoint, long cooldownMs, String reason) {
        long now = clockMs.getAsLong();
        Long previous = cooldownUntilMs.put(endpoint, now + Math.max(0L, cooldownMs));
        if (previous == null || previous <= now) {
            log.warn("Endpoint {} cooled down for {} ms due to {}", endpoint, cooldownMs, reason);
        }
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }
}
