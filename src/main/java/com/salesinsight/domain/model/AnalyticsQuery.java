package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Request model for dashboard, ranking and trend queries.
 *
 * Missing dates default to the configured trailing window; the service
 * resolves them so the cache key always carries concrete dates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsQuery {

    private LocalDate startDate;
    private LocalDate endDate;

    private UUID customerId;
    private UUID productId;
    private UUID storeId;
    private String region;
    private String category;
    private String agentCode;

    // Top-N only
    private Integer limit;

    // Trend only
    private TrendGranularity granularity;
    private boolean dense;

    private boolean forceRefresh;

    public SalesFilter toFilter() {
        return SalesFilter.builder()
                .customerId(customerId)
                .productId(productId)
                .storeId(storeId)
                .region(blankToNull(region))
                .category(blankToNull(category))
                .agentCode(blankToNull(agentCode))
                .build();
    }

    public TrendGranularity getGranularity() {
        return granularity != null ? granularity : TrendGranularity.DAY;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
