package com.gateway.shared.idempotency;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Process-local idempotency index for local runs and tests.
 * Claims are atomic per key through {@link ConcurrentMap#compute}.
 */
public class InMemoryIdempotencyIndex implements IdempotencyIndex {

    private final ConcurrentMap<String, Claim> claims = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public InMemoryIdempotencyIndex(Duration ttl, Clock clock, Supplier<String> idGenerator) {
        this.ttl = ttl;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    @Override
    public String resolve(String idempotencyKey) {
        if (IdempotencyIndex.isAbsent(idempotencyKey)) {
            return idGenerator.get();
        }
        Instant now = clock.instant();
        Claim claim = claims.compute(idempotencyKey, (key, existing) ->
                existing != null && existing.getExpiresAt().isAfter(now)
                        ? existing
                        : new Claim(idGenerator.get(), now.plus(ttl)));
        return claim.getId();
    }

    int size() {
        return claims.size();
    }

    @Value
    private static class Claim {
        String id;
        Instant expiresAt;
    }
}
