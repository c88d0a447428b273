package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ABC/XYZ matrix over a lookback window.
 *
 * products is in ABC order (revenue descending). matrix always has all nine
 * cells; products excluded from XYZ appear in products and the ABC summaries
 * but in no cell.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbcXyzMatrixResponse implements CacheableResult {

    private LocalDate startDate;
    private LocalDate endDate;
    private int days;
    private TrendGranularity granularity;
    private DemandMeasure demandMeasure;
    private int periods;

    private BigDecimal totalRevenue;
    private int totalProducts;
    private int excludedFromXyz;

    @Builder.Default
    private List<ClassifiedProduct> products = new ArrayList<>();

    @Builder.Default
    private Map<MatrixCell, List<ClassifiedProduct>> matrix = new EnumMap<>(MatrixCell.class);

    @Builder.Default
    private Map<AbcClass, Long> abcCounts = new EnumMap<>(AbcClass.class);

    @Builder.Default
    private Map<XyzClass, Long> xyzCounts = new EnumMap<>(XyzClass.class);

    @Builder.Default
    private Map<MatrixCell, Long> cellCounts = new EnumMap<>(MatrixCell.class);

    @Builder.Default
    private Map<AbcClass, BigDecimal> abcRevenue = new EnumMap<>(AbcClass.class);

    private boolean cached;
    private Instant computedAt;
}
