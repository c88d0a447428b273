package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanFactResponse implements CacheableResult {

    private LocalDate startDate;
    private LocalDate endDate;
    private UUID productId;
    private UUID customerId;
    private String agentCode;
    private String region;
    private String category;

    private boolean hasPlan;
    private int matchedPlans;

    @Builder.Default
    private List<PlanFactMetric> metrics = new ArrayList<>();

    private BigDecimal overallCompletion;

    private boolean cached;
    private Instant computedAt;
}
