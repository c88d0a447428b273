package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanFactMetric {

    private ComparisonMetric metric;
    private BigDecimal planned;
    private BigDecimal actual;
    private BigDecimal variance;
    // 0 when nothing was planned
    private BigDecimal variancePercent;
    private BigDecimal fulfillmentPercent;
}
