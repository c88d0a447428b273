package com.salesinsight.domain.service;

import com.salesinsight.domain.model.CacheStats;
import com.salesinsight.domain.model.CacheableResult;
import com.salesinsight.infrastructure.cache.CacheEnvelope;
import com.salesinsight.infrastructure.cache.QueryCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Result cache in front of every analytics operation.
 *
 * Query Flow:
 * 1. Key = operation + parameters sorted by name (hashed)
 * 2. Read the current generation, then the entry
 * 3. Entry present and of the current generation: return it marked cached
 * 4. Otherwise compute, stamp computedAt, store with the generation read in step 2
 *
 * Invalidation is global (import completed, import deleted, explicit refresh).
 * A result computed while an invalidation happens is stored under the old
 * generation and never served.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsResultCache {

    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.analytics:3600}")
    private long analyticsTtl = 3600;

    public <T extends CacheableResult> T getOrCompute(String operation,
                                                      Map<String, ?> params,
                                                      boolean forceRefresh,
                                                      Class<T> type,
                                                      Supplier<T> loader) {
        String cacheKey = cacheService.generateCacheKey(operation, params);
        long generation = cacheService.currentGeneration();

        if (!forceRefresh) {
            Optional<CacheEnvelope<T>> cached = cacheService.get(cacheKey, type);

            if (cached.isPresent() && cached.get().getGeneration() == generation
                    && cached.get().getPayload() != null) {
                log.debug("Cache hit for {}: {}", operation, cacheKey);
                count(operation, "hit");

                T result = cached.get().getPayload();
                result.setCached(true);
                result.setComputedAt(cached.get().getComputedAt());
                return result;
            }
            count(operation, cached.isPresent() ? "stale" : "miss");
        } else {
            count(operation, "refresh");
        }

        log.debug("Computing {} ({})", operation, cacheKey);
        Timer.Sample sample = Timer.start(meterRegistry);

        T result = loader.get();
        Instant computedAt = Instant.now();
        result.setCached(false);
        result.setComputedAt(computedAt);

        sample.stop(Timer.builder("analytics.query.latency")
                .tag("operation", operation)
                .register(meterRegistry));

        // generation unknown means Redis is unreachable, nothing worth writing
        if (generation >= 0) {
            cacheService.set(cacheKey, new CacheEnvelope<>(operation, result, computedAt, generation), analyticsTtl);
        }
        return result;
    }

    /**
     * Drop every cached analytics result.
     */
    public long invalidateAll(String reason) {
        long removed = cacheService.invalidateAll();
        log.info("Analytics cache cleared ({}): {} entries", reason, removed);
        return removed;
    }

    public CacheStats stats() {
        Set<String> keys = cacheService.liveKeys();

        Map<String, Long> byOperation = new TreeMap<>();
        for (String key : keys) {
            byOperation.merge(QueryCacheService.operationOf(key), 1L, Long::sum);
        }

        return CacheStats.builder()
                .entries(keys.size())
                .generation(cacheService.currentGeneration())
                .entriesByOperation(byOperation)
                .keys(keys.stream().sorted().toList())
                .build();
    }

    private void count(String operation, String result) {
        Counter.builder("analytics.cache")
                .tag("operation", operation)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
