package com.salesinsight.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Redis storage for analytics results.
 *
 * Layout:
 * - analytics:{operation}:{sha256}  JSON envelope per query, with TTL
 * - analytics:index                 set of live entry keys (introspection, bulk delete)
 * - analytics:generation            counter bumped by every global invalidation
 *
 * Why a generation counter?
 * - Deleting the indexed keys is not atomic with concurrent writers
 * - An entry computed before an invalidation carries the old generation
 *   and is rejected on read even if its delete raced with the write
 *
 * Failure Handling:
 * - Circuit breaker around every Redis call
 * - Fallbacks degrade to a cache miss / skipped write, never to a failed query
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    public static final String KEY_PREFIX = "analytics:";
    static final String INDEX_KEY = KEY_PREFIX + "index";
    static final String GENERATION_KEY = KEY_PREFIX + "generation";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Read an envelope. A payload that no longer deserializes is treated as a miss.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<CacheEnvelope<T>> get(String key, Class<T> payloadType) {
        String cached = redisTemplate.opsForValue().get(key);

        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            JavaType type = objectMapper.getTypeFactory()
                    .constructParametricType(CacheEnvelope.class, payloadType);
            CacheEnvelope<T> envelope = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(envelope);

        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Store an envelope and register its key in the index.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, CacheEnvelope<?> envelope, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            // cache write failure shouldn't fail the query
            log.error("Error serializing cache entry {}: {}", key, e.getOriginalMessage());
            return;
        }

        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        redisTemplate.opsForSet().add(INDEX_KEY, key);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    /**
     * Bump the generation and drop every indexed entry.
     *
     * @return number of entries removed
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateAllFallback")
    public long invalidateAll() {
        Long generation = redisTemplate.opsForValue().increment(GENERATION_KEY);
        Set<String> keys = redisTemplate.opsForSet().members(INDEX_KEY);

        long removed = 0;
        if (keys != null && !keys.isEmpty()) {
            Long deleted = redisTemplate.delete(keys);
            removed = deleted != null ? deleted : 0;
            // only the members we saw: keys written meanwhile belong to the new generation
            redisTemplate.opsForSet().remove(INDEX_KEY, keys.toArray());
        }

        log.info("Analytics cache invalidated: generation={}, removed={}", generation, removed);
        return removed;
    }

    /**
     * Current generation, 0 before the first invalidation.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "generationFallback")
    public long currentGeneration() {
        String value = redisTemplate.opsForValue().get(GENERATION_KEY);
        return value == null ? 0 : Long.parseLong(value);
    }

    /**
     * Live entry keys. Index members whose entry already expired are pruned.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "liveKeysFallback")
    public Set<String> liveKeys() {
        Set<String> indexed = redisTemplate.opsForSet().members(INDEX_KEY);
        if (indexed == null || indexed.isEmpty()) {
            return Collections.emptySet();
        }

        Set<String> live = new TreeSet<>();
        for (String key : indexed) {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
                live.add(key);
            } else {
                redisTemplate.opsForSet().remove(INDEX_KEY, key);
            }
        }
        return live;
    }

    /**
     * Generate cache key from an operation name and its parameters.
     *
     * Parameters are sorted by name so the key does not depend on the order
     * the caller supplied them in.
     */
    public String generateCacheKey(String operation, Map<String, ?> params) {
        StringBuilder canonical = new StringBuilder(operation);
        for (Map.Entry<String, ?> param : new TreeMap<>(params).entrySet()) {
            Object value = param.getValue();
            canonical.append('|').append(param.getKey()).append('=')
                    .append(value != null ? value.toString() : "null");
        }
        return KEY_PREFIX + operation + ":" + DigestUtils.sha256Hex(canonical.toString());
    }

    /**
     * Operation name embedded in a key produced by {@link #generateCacheKey}.
     */
    public static String operationOf(String key) {
        String rest = key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
        int separator = rest.lastIndexOf(':');
        return separator > 0 ? rest.substring(0, separator) : rest;
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<CacheEnvelope<T>> getCacheFallback(String key, Class<T> payloadType, Exception e) {
        log.warn("Redis unavailable ({}), falling back to database", e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, CacheEnvelope<?> envelope, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write", e.getMessage());
    }

    private long invalidateAllFallback(Exception e) {
        log.warn("Redis unavailable ({}), analytics cache not invalidated; entries expire by TTL", e.getMessage());
        return 0;
    }

    private long generationFallback(Exception e) {
        log.warn("Redis unavailable ({}), cache generation unknown", e.getMessage());
        return -1;
    }

    private Set<String> liveKeysFallback(Exception e) {
        log.warn("Redis unavailable ({}), cache introspection skipped", e.getMessage());
        return Collections.emptySet();
    }
}
