package com.salesinsight.domain.service;

import com.salesinsight.domain.model.AbcClass;
import com.salesinsight.domain.model.AbcXyzMatrixResponse;
import com.salesinsight.domain.model.ClassifiedProduct;
import com.salesinsight.domain.model.MatrixCell;
import com.salesinsight.domain.model.ProductDemand;
import com.salesinsight.domain.model.Ratios;
import com.salesinsight.domain.model.XyzClass;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ABC/XYZ classification. No I/O: takes per-product revenue and demand
 * series, returns the matrix.
 *
 * ABC: products sorted by revenue descending (ties by product id). The
 * cumulative share includes the product being classified, so a product
 * that crosses 80 % is already B. Comparisons are done on exact decimals
 * (cumulative * 100 against threshold * total), never on rounded shares.
 *
 * XYZ: coefficient of variation of the demand series, population standard
 * deviation over mean, in percent. Every period of the window is part of the
 * series. A product with zero mean demand has no XYZ class.
 */
@Component
public class AbcXyzClassifier {

    static final BigDecimal A_THRESHOLD = BigDecimal.valueOf(80);
    static final BigDecimal B_THRESHOLD = BigDecimal.valueOf(95);
    static final BigDecimal X_THRESHOLD = BigDecimal.valueOf(10);
    static final BigDecimal Y_THRESHOLD = BigDecimal.valueOf(25);

    private static final MathContext PRECISION = MathContext.DECIMAL64;

    /**
     * Classify the given products. periodKeys is the full, ordered list of
     * periods in the window.
     */
    public AbcXyzMatrixResponse classify(List<ProductDemand> products, List<String> periodKeys) {
        List<ProductDemand> ordered = new ArrayList<>(products);
        ordered.sort(Comparator.comparing(ProductDemand::getRevenue).reversed()
                .thenComparing(ProductDemand::getProductId));

        BigDecimal total = BigDecimal.ZERO;
        for (ProductDemand product : ordered) {
            total = total.add(product.getRevenue());
        }

        Map<MatrixCell, List<ClassifiedProduct>> matrix = new EnumMap<>(MatrixCell.class);
        Map<MatrixCell, Long> cellCounts = new EnumMap<>(MatrixCell.class);
        for (MatrixCell cell : MatrixCell.values()) {
            matrix.put(cell, new ArrayList<>());
            cellCounts.put(cell, 0L);
        }
        Map<AbcClass, Long> abcCounts = new EnumMap<>(AbcClass.class);
        Map<AbcClass, BigDecimal> abcRevenue = new EnumMap<>(AbcClass.class);
        for (AbcClass abc : AbcClass.values()) {
            abcCounts.put(abc, 0L);
            abcRevenue.put(abc, BigDecimal.ZERO);
        }
        Map<XyzClass, Long> xyzCounts = new EnumMap<>(XyzClass.class);
        for (XyzClass xyz : XyzClass.values()) {
            xyzCounts.put(xyz, 0L);
        }

        List<ClassifiedProduct> classified = new ArrayList<>(ordered.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        int excluded = 0;

        for (ProductDemand product : ordered) {
            cumulative = cumulative.add(product.getRevenue());
            AbcClass abc = abcClass(cumulative, total);

            List<BigDecimal> series = product.series(periodKeys);
            BigDecimal mean = mean(series);
            BigDecimal cv = null;
            XyzClass xyz = null;
            if (mean.signum() > 0) {
                cv = standardDeviation(series, mean).divide(mean, PRECISION).multiply(Ratios.HUNDRED);
                xyz = xyzClass(cv);
            } else {
                excluded++;
            }

            ClassifiedProduct result = ClassifiedProduct.builder()
                    .productId(product.getProductId())
                    .name(product.getName())
                    .category(product.getCategory())
                    .revenue(product.getRevenue())
                    .revenueShare(Ratios.percentOf(product.getRevenue(), total))
                    .cumulativeShare(Ratios.percentOf(cumulative, total))
                    .abcClass(abc)
                    .meanDemand(mean.setScale(3, RoundingMode.HALF_UP))
                    .coefficientOfVariation(cv == null ? null : cv.setScale(2, RoundingMode.HALF_UP))
                    .xyzClass(xyz)
                    .build();
            classified.add(result);

            abcCounts.merge(abc, 1L, Long::sum);
            abcRevenue.merge(abc, product.getRevenue(), BigDecimal::add);
            if (xyz != null) {
                MatrixCell cell = MatrixCell.of(abc, xyz);
                matrix.get(cell).add(result);
                cellCounts.merge(cell, 1L, Long::sum);
                xyzCounts.merge(xyz, 1L, Long::sum);
            }
        }

        return AbcXyzMatrixResponse.builder()
                .periods(periodKeys.size())
                .totalRevenue(total)
                .totalProducts(classified.size())
                .excludedFromXyz(excluded)
                .products(classified)
                .matrix(matrix)
                .abcCounts(abcCounts)
                .xyzCounts(xyzCounts)
                .cellCounts(cellCounts)
                .abcRevenue(abcRevenue)
                .build();
    }

    static AbcClass abcClass(BigDecimal cumulative, BigDecimal total) {
        if (total.signum() == 0) {
            return AbcClass.C;
        }
        BigDecimal scaledCumulative = cumulative.multiply(Ratios.HUNDRED);
        if (scaledCumulative.compareTo(total.multiply(A_THRESHOLD)) <= 0) {
            return AbcClass.A;
        }
        if (scaledCumulative.compareTo(total.multiply(B_THRESHOLD)) <= 0) {
            return AbcClass.B;
        }
        return AbcClass.C;
    }

    static XyzClass xyzClass(BigDecimal coefficientOfVariation) {
        if (coefficientOfVariation.compareTo(X_THRESHOLD) < 0) {
            return XyzClass.X;
        }
        if (coefficientOfVariation.compareTo(Y_THRESHOLD) < 0) {
            return XyzClass.Y;
        }
        return XyzClass.Z;
    }

    private static BigDecimal mean(List<BigDecimal> series) {
        if (series.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal value : series) {
            sum = sum.add(value);
        }
        return sum.divide(BigDecimal.valueOf(series.size()), PRECISION);
    }

    private static BigDecimal standardDeviation(List<BigDecimal> series, BigDecimal mean) {
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal value : series) {
            BigDecimal deviation = value.subtract(mean);
            squares = squares.add(deviation.multiply(deviation));
        }
        BigDecimal variance = squares.divide(BigDecimal.valueOf(series.size()), PRECISION);
        return variance.sqrt(PRECISION);
    }
}
