package com.salesinsight.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What is stored under an analytics cache key. generation is the cache
 * generation current when the payload was computed; an entry from an older
 * generation is treated as a miss.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEnvelope<T> {

    private String operation;
    private T payload;
    private Instant computedAt;
    private long generation;
}
