package com.salesinsight.domain.model;

import java.time.Instant;

/**
 * A query result that can be served from the analytics result cache.
 * The cache stamps it on the way out so clients can tell a cached value
 * from a fresh one.
 */
public interface CacheableResult {

    void setCached(boolean cached);

    void setComputedAt(Instant computedAt);
}
