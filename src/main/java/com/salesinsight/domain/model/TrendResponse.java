package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendResponse implements CacheableResult {

    private TrendGranularity granularity;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean dense;

    @Builder.Default
    private List<TrendBucket> buckets = new ArrayList<>();

    private boolean cached;
    private Instant computedAt;
}
