package com.salesinsight.domain.importing;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-job memo of normalized name -> entity id, plus the ids of entities
 * this job created. Used by a single import thread; not shared between jobs.
 */
public class ResolverSession {

    private final Map<String, UUID> customers = new HashMap<>();
    private final Map<String, UUID> products = new HashMap<>();
    private final Map<String, UUID> stores = new HashMap<>();
    private final Set<UUID> createdEntityIds = new LinkedHashSet<>();

    Map<String, UUID> cacheFor(EntityResolver.Kind kind) {
        switch (kind) {
            case CUSTOMER:
                return customers;
            case PRODUCT:
                return products;
            case STORE:
                return stores;
            default:
                throw new IllegalArgumentException("Unknown entity kind: " + kind);
        }
    }

    void recordCreated(UUID entityId) {
        createdEntityIds.add(entityId);
    }

    public Set<UUID> getCreatedEntityIds() {
        return Collections.unmodifiableSet(createdEntityIds);
    }
}
