package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Classification input for one product: window revenue and demand per period key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDemand {

    private UUID productId;
    private String name;
    private String category;

    @Builder.Default
    private BigDecimal revenue = BigDecimal.ZERO;

    @Builder.Default
    private Map<String, BigDecimal> demandByPeriod = new HashMap<>();

    public void addRevenue(BigDecimal amount) {
        revenue = revenue.add(amount);
    }

    public void addDemand(String periodKey, BigDecimal amount) {
        demandByPeriod.merge(periodKey, amount, BigDecimal::add);
    }

    /**
     * Demand for every given period, 0 where the product did not sell.
     */
    public List<BigDecimal> series(List<String> periodKeys) {
        List<BigDecimal> values = new ArrayList<>(periodKeys.size());
        for (String key : periodKeys) {
            values.add(demandByPeriod.getOrDefault(key, BigDecimal.ZERO));
        }
        return values;
    }
}
