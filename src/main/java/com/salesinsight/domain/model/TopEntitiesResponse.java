package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-N ranking, ordered by revenue descending then entity id ascending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopEntitiesResponse implements CacheableResult {

    private String entityType;
    private LocalDate startDate;
    private LocalDate endDate;
    private int limit;

    @Builder.Default
    private List<TopEntityRow> items = new ArrayList<>();

    private boolean cached;
    private Instant computedAt;
}
