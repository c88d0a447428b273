package com.salesinsight.domain.service;

import com.salesinsight.domain.exception.InvalidQueryException;
import com.salesinsight.domain.model.AbcXyzMatrixResponse;
import com.salesinsight.domain.model.AbcXyzQuery;
import com.salesinsight.domain.model.DateRange;
import com.salesinsight.domain.model.DemandMeasure;
import com.salesinsight.domain.model.ProductDemand;
import com.salesinsight.domain.model.SalesCalendar;
import com.salesinsight.domain.model.TrendGranularity;
import com.salesinsight.infrastructure.persistence.repository.SalesFactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Loads per-product demand for a lookback window and hands it to the
 * {@link AbcXyzClassifier}.
 *
 * The lookback window is cut down to whole periods, so with monthly buckets
 * the 90 days ending mid-October cover August and September only. Only
 * products with at least one fact in that window take part.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationService {

    static final String OP_ABC_XYZ = "abc-xyz";

    private final SalesFactRepository salesFactRepository;
    private final AbcXyzClassifier classifier;
    private final AnalyticsResultCache resultCache;

    @Value("${app.analytics.default-lookback-days:90}")
    private int defaultLookbackDays = 90;

    @Value("${app.analytics.max-lookback-days:1825}")
    private int maxLookbackDays = 1825;

    @Transactional(readOnly = true, timeout = 30)
    public AbcXyzMatrixResponse abcXyz(AbcXyzQuery query) {
        int days = query.getDays() != null ? query.getDays() : defaultLookbackDays;
        if (days <= 0) {
            throw new InvalidQueryException("days must be positive: " + days);
        }
        if (days > maxLookbackDays) {
            throw new InvalidQueryException("days must not exceed " + maxLookbackDays + ": " + days);
        }

        LocalDate requestedEnd = query.getEndDate() != null ? query.getEndDate() : LocalDate.now();
        TrendGranularity granularity = query.getGranularity();
        DemandMeasure measure = query.getDemandMeasure();

        // partial boundary periods would read as demand swings
        DateRange window = SalesCalendar.wholePeriods(requestedEnd.minusDays(days - 1L), requestedEnd, granularity);
        if (window == null) {
            throw new InvalidQueryException("A window of " + days + " days ending " + requestedEnd
                    + " holds no complete " + granularity.name().toLowerCase(Locale.ROOT) + " period");
        }
        LocalDate start = window.getStart();
        LocalDate end = window.getEnd();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("startDate", start);
        params.put("endDate", end);
        params.put("granularity", granularity);
        params.put("demandMeasure", measure);

        return resultCache.getOrCompute(OP_ABC_XYZ, params, query.isForceRefresh(), AbcXyzMatrixResponse.class, () -> {
            List<ProductDemand> products = loadDemand(start, end, granularity, measure);
            List<String> periods = SalesCalendar.periodKeys(start, end, granularity);

            AbcXyzMatrixResponse response = classifier.classify(products, periods);
            response.setStartDate(start);
            response.setEndDate(end);
            response.setDays(days);
            response.setGranularity(granularity);
            response.setDemandMeasure(measure);

            log.info("ABC/XYZ classified {} products over {} periods ({} excluded from XYZ)",
                    response.getTotalProducts(), periods.size(), response.getExcludedFromXyz());
            return response;
        });
    }

    List<ProductDemand> loadDemand(LocalDate start, LocalDate end, TrendGranularity granularity, DemandMeasure measure) {
        Map<UUID, ProductDemand> byProduct = new LinkedHashMap<>();

        for (Object[] row : salesFactRepository.productDailyDemand(start, end)) {
            UUID productId = QueryRows.uuid(row[0]);
            ProductDemand demand = byProduct.computeIfAbsent(productId, id -> ProductDemand.builder()
                    .productId(id)
                    .name((String) row[1])
                    .category((String) row[2])
                    .build());

            BigDecimal revenue = QueryRows.decimal(row[4]);
            BigDecimal quantity = QueryRows.decimal(row[5]);
            String period = SalesCalendar.periodKey(QueryRows.date(row[3]), granularity);

            demand.addRevenue(revenue);
            demand.addDemand(period, measure == DemandMeasure.REVENUE ? revenue : quantity);
        }
        return new ArrayList<>(byProduct.values());
    }
}
