package com.gateway.checkout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.checkout.repository.InMemorySessionEventStore;
import com.gateway.checkout.repository.JpaSessionEventStore;
import com.gateway.checkout.repository.SessionEventStore;
import com.gateway.checkout.repository.SessionVersionRecordRepository;
import com.gateway.shared.idempotency.IdempotencyIndex;
import com.gateway.shared.idempotency.InMemoryIdempotencyIndex;
import com.gateway.shared.idempotency.RedisIdempotencyIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Session store and idempotency index, chosen by {@code checkout.storage.mode}.
 *
 *   persistent (default)  PostgreSQL version log + Redis key claims
 *   memory                process-local maps, for local runs without infrastructure
 */
@Slf4j
@Configuration
public class CheckoutStorageConfig {

    static final String SESSION_ID_PREFIX = "cs_";

    static Supplier<String> sessionIdGenerator() {
        return () -> SESSION_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    @Configuration
    @ConditionalOnProperty(prefix = "checkout.storage", name = "mode", havingValue = "persistent", matchIfMissing = true)
    static class PersistentStorage {

        @Bean
        public SessionEventStore sessionEventStore(SessionVersionRecordRepository repository, ObjectMapper objectMapper) {
            log.info("Session store: PostgreSQL");
            return new JpaSessionEventStore(repository, objectMapper);
        }

        @Bean
        public IdempotencyIndex idempotencyIndex(StringRedisTemplate redisTemplate, CheckoutProperties properties) {
            CheckoutProperties.Storage storage = properties.getStorage();
            log.info("Idempotency index: Redis, ttl={}", storage.getIdempotencyTtl());
            return new RedisIdempotencyIndex(redisTemplate, storage.getIdempotencyNamespace(),
                    storage.getIdempotencyTtl(), sessionIdGenerator());
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "checkout.storage", name = "mode", havingValue = "memory")
    static class InMemoryStorage {

        @Bean
        public SessionEventStore sessionEventStore() {
            log.warn("Session store: in-memory; sessions are lost on restart");
            return new InMemorySessionEventStore();
        }

        @Bean
        public IdempotencyIndex idempotencyIndex(CheckoutProperties properties, Clock clock) {
            return new InMemoryIdempotencyIndex(properties.getStorage().getIdempotencyTtl(), clock, sessionIdGenerator());
        }
    }
}
