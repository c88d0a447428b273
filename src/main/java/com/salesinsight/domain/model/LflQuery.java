package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Like-for-like comparison of two disjoint periods. A null metric compares all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LflQuery {

    private LocalDate period1Start;
    private LocalDate period1End;
    private LocalDate period2Start;
    private LocalDate period2End;

    private ComparisonMetric metric;

    private UUID customerId;
    private UUID productId;
    private String agentCode;
    private String region;
    private String category;

    private boolean forceRefresh;

    public SalesFilter toFilter() {
        return SalesFilter.builder()
                .customerId(customerId)
                .productId(productId)
                .agentCode(agentCode)
                .region(region)
                .category(category)
                .build();
    }
}
