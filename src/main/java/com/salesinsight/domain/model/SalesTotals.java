package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Revenue, order count, quantity and distinct customers of one slice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesTotals {

    private BigDecimal revenue;
    private long orders;
    private BigDecimal quantity;
    private long uniqueCustomers;

    public static SalesTotals empty() {
        return new SalesTotals(BigDecimal.ZERO, 0, BigDecimal.ZERO, 0);
    }

    public BigDecimal averageCheck() {
        return Ratios.average(revenue, orders);
    }
}
