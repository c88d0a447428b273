package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopEntityRow {

    private int rank;
    private UUID entityId;
    private String name;
    private BigDecimal totalAmount;
    private long orders;
    private BigDecimal quantity;
    private BigDecimal averageCheck;
}
