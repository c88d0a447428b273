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
public class TrendBucket {

    // yyyy-MM-dd, YYYY-Www or yyyy-MM
    private String period;
    private BigDecimal amount;
    private long orders;
    private BigDecimal averageCheck;

    public static TrendBucket empty(String period) {
        return new TrendBucket(period, Ratios.zero(), 0, Ratios.zero());
    }
}
