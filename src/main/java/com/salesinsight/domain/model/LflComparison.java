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
public class LflComparison {

    private ComparisonMetric metric;
    private BigDecimal period1Value;
    private BigDecimal period2Value;
    private BigDecimal changeAbsolute;
    // null when period1Value is 0
    private BigDecimal changePercent;
}
