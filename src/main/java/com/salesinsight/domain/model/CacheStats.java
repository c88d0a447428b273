package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long entries;
    private long generation;

    @Builder.Default
    private Map<String, Long> entriesByOperation = new TreeMap<>();

    @Builder.Default
    private List<String> keys = new ArrayList<>();
}
