package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardMetrics implements CacheableResult {

    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal totalRevenue;
    private long totalSales;
    private BigDecimal averageCheck;
    private BigDecimal totalQuantity;
    private long uniqueCustomers;

    private boolean cached;
    private Instant computedAt;
}
