package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A plan matches when its period starts inside [startDate, endDate] and each
 * of its dimensions equals the one given here, null included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanFactQuery {

    private LocalDate startDate;
    private LocalDate endDate;

    private UUID productId;
    private UUID customerId;
    private String agentCode;
    private String region;
    private String category;

    private boolean forceRefresh;
}
