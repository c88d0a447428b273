package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LflResponse implements CacheableResult {

    // dd.MM.yyyy - dd.MM.yyyy
    private String period1Label;
    private String period2Label;

    @Builder.Default
    private List<LflComparison> comparisons = new ArrayList<>();

    private boolean cached;
    private Instant computedAt;
}
