package com.salesinsight.domain.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanTargetRequest {

    @NotNull
    private LocalDate periodStart;

    @NotNull
    private LocalDate periodEnd;

    private UUID productId;
    private UUID customerId;
    private String agentCode;
    private String region;
    private String category;

    @PositiveOrZero
    private BigDecimal plannedRevenue;

    @PositiveOrZero
    private BigDecimal plannedQuantity;

    @PositiveOrZero
    private Long plannedOrders;
}
