package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One product's place in the ABC/XYZ matrix. xyzClass and
 * coefficientOfVariation are null for products excluded from XYZ
 * (mean demand of zero).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedProduct {

    private UUID productId;
    private String name;
    private String category;
    private BigDecimal revenue;
    private BigDecimal revenueShare;
    private BigDecimal cumulativeShare;
    private AbcClass abcClass;
    private BigDecimal meanDemand;
    private BigDecimal coefficientOfVariation;
    private XyzClass xyzClass;

    public MatrixCell matrixCell() {
        return xyzClass == null ? null : MatrixCell.of(abcClass, xyzClass);
    }
}
