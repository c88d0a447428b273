package com.salesinsight.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Planned sales for a period, optionally narrowed to one slice
 * (product, customer, agent, region, category). A null dimension means the
 * plan is not narrowed on it.
 */
@Entity
@Table(name = "plan_targets", indexes = {
    @Index(name = "idx_plan_targets_period", columnList = "periodStart,periodEnd")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanTargetEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false)
    private LocalDate periodStart;

    @Column(nullable = false)
    private LocalDate periodEnd;

    @Column(columnDefinition = "UUID")
    private UUID productId;

    @Column(columnDefinition = "UUID")
    private UUID customerId;

    @Column(length = 100)
    private String agentCode;

    @Column(length = 100)
    private String region;

    @Column(length = 255)
    private String category;

    @Column(nullable = false, precision = 15, scale = 2)
    @Builder.Default
    private BigDecimal plannedRevenue = BigDecimal.ZERO;

    @Column(nullable = false, precision = 15, scale = 3)
    @Builder.Default
    private BigDecimal plannedQuantity = BigDecimal.ZERO;

    @Column(nullable = false)
    private long plannedOrders;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
