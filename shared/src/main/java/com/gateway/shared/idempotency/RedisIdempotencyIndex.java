package com.gateway.shared.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Idempotency Index — Redis-backed key claim.
 *
 * A new identifier is claimed with SET NX EX, which is atomic: exactly one caller
 * wins the key. Losers read back the winner's identifier.
 *
 * Key format:  idempotency:{namespace}:{idempotencyKey}
 * TTL:         24 hours by default
 */
@Slf4j
public class RedisIdempotencyIndex implements IdempotencyIndex {

    private static final String KEY_PREFIX = "idempotency:";
    private static final int MAX_CLAIM_ATTEMPTS = 3;

    private final StringRedisTemplate redisTemplate;
    private final String namespace;
    private final Duration ttl;
    private final Supplier<String> idGenerator;

    public RedisIdempotencyIndex(StringRedisTemplate redisTemplate, String namespace,
                                 Duration ttl, Supplier<String> idGenerator) {
        this.redisTemplate = redisTemplate;
        this.namespace = namespace;
        this.ttl = ttl;
        this.idGenerator = idGenerator;
    }

    @Override
    public String resolve(String idempotencyKey) {
        if (IdempotencyIndex.isAbsent(idempotencyKey)) {
            return idGenerator.get();
        }
        String key = KEY_PREFIX + namespace + ":" + idempotencyKey;

        for (int attempt = 1; attempt <= MAX_CLAIM_ATTEMPTS; attempt++) {
            String candidate = idGenerator.get();
            Boolean claimed = redisTemplate.opsForValue().setIfAbsent(key, candidate, ttl);
            if (Boolean.TRUE.equals(claimed)) {
                log.debug("Idempotency key claimed: key={}, id={}", idempotencyKey, candidate);
                return candidate;
            }

            String existing = redisTemplate.opsForValue().get(key);
            if (existing != null) {
                log.debug("Idempotency key already mapped: key={}, id={}", idempotencyKey, existing);
                return existing;
            }
            // mapping expired between the failed claim and the read
            log.debug("Idempotency mapping vanished, retrying claim: key={}, attempt={}", idempotencyKey, attempt);
        }
        throw new IdempotencyException("Unable to resolve idempotency key: " + idempotencyKey);
    }
}
