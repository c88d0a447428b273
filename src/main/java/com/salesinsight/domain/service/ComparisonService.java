package com.salesinsight.domain.service;

import com.salesinsight.domain.exception.InvalidQueryException;
import com.salesinsight.domain.model.ComparisonMetric;
import com.salesinsight.domain.model.DateRange;
import com.salesinsight.domain.model.LflComparison;
import com.salesinsight.domain.model.LflQuery;
import com.salesinsight.domain.model.LflResponse;
import com.salesinsight.domain.model.PlanFactMetric;
import com.salesinsight.domain.model.PlanFactQuery;
import com.salesinsight.domain.model.PlanFactResponse;
import com.salesinsight.domain.model.PlanTargetRequest;
import com.salesinsight.domain.model.Ratios;
import com.salesinsight.domain.model.SalesFilter;
import com.salesinsight.domain.model.SalesTotals;
import com.salesinsight.infrastructure.persistence.entity.PlanTargetEntity;
import com.salesinsight.infrastructure.persistence.repository.PlanTargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plan-vs-actual variance and like-for-like period comparison.
 *
 * Actuals come from {@link AggregationService#totals}, so both comparisons
 * read the same facts the dashboard does. Every ratio goes through
 * {@link Ratios}: a zero plan gives 0 % fulfillment, a zero first period
 * gives a null change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComparisonService {

    static final String OP_PLAN_FACT = "plan-fact";
    static final String OP_LFL = "lfl";

    private static final ComparisonMetric[] PLAN_METRICS = {
            ComparisonMetric.REVENUE, ComparisonMetric.QUANTITY, ComparisonMetric.ORDERS
    };

    private final PlanTargetRepository planTargetRepository;
    private final AggregationService aggregationService;
    private final AnalyticsResultCache resultCache;
    private final TransactionTemplate transactionTemplate;

    @Transactional(readOnly = true, timeout = 10)
    public PlanFactResponse planFact(PlanFactQuery query) {
        DateRange range = DateRange.of(query.getStartDate(), query.getEndDate());
        SalesFilter filter = SalesFilter.builder()
                .productId(query.getProductId())
                .customerId(query.getCustomerId())
                .agentCode(blankToNull(query.getAgentCode()))
                .region(blankToNull(query.getRegion()))
                .category(blankToNull(query.getCategory()))
                .build();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("startDate", range.getStart());
        params.put("endDate", range.getEnd());
        filter.appendTo(params);

        return resultCache.getOrCompute(OP_PLAN_FACT, params, query.isForceRefresh(), PlanFactResponse.class, () -> {
            List<PlanTargetEntity> plans = matchingPlans(range, filter);
            SalesTotals actual = aggregationService.totals(range, filter);

            BigDecimal plannedRevenue = BigDecimal.ZERO;
            BigDecimal plannedQuantity = BigDecimal.ZERO;
            long plannedOrders = 0;
            for (PlanTargetEntity plan : plans) {
                plannedRevenue = plannedRevenue.add(plan.getPlannedRevenue());
                plannedQuantity = plannedQuantity.add(plan.getPlannedQuantity());
                plannedOrders += plan.getPlannedOrders();
            }
            SalesTotals planned = SalesTotals.builder()
                    .revenue(plannedRevenue)
                    .quantity(plannedQuantity)
                    .orders(plannedOrders)
                    .build();

            List<PlanFactMetric> metrics = new ArrayList<>();
            for (ComparisonMetric metric : PLAN_METRICS) {
                metrics.add(planFactMetric(metric, metric.extract(planned), metric.extract(actual)));
            }

            boolean hasPlan = !plans.isEmpty();
            log.info("Plan-fact for {}: {} matching plans", range.label(), plans.size());

            return PlanFactResponse.builder()
                    .startDate(range.getStart())
                    .endDate(range.getEnd())
                    .productId(filter.getProductId())
                    .customerId(filter.getCustomerId())
                    .agentCode(filter.getAgentCode())
                    .region(filter.getRegion())
                    .category(filter.getCategory())
                    .hasPlan(hasPlan)
                    .matchedPlans(plans.size())
                    .metrics(metrics)
                    .overallCompletion(hasPlan ? metrics.get(0).getFulfillmentPercent() : Ratios.zero())
                    .build();
        });
    }

    @Transactional(readOnly = true, timeout = 10)
    public LflResponse likeForLike(LflQuery query) {
        DateRange period1 = DateRange.of(query.getPeriod1Start(), query.getPeriod1End());
        DateRange period2 = DateRange.of(query.getPeriod2Start(), query.getPeriod2End());
        if (period1.overlaps(period2)) {
            throw new InvalidQueryException("Periods overlap: " + period1.label() + " and " + period2.label());
        }
        SalesFilter filter = query.toFilter();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("period1Start", period1.getStart());
        params.put("period1End", period1.getEnd());
        params.put("period2Start", period2.getStart());
        params.put("period2End", period2.getEnd());
        params.put("metric", query.getMetric());
        filter.appendTo(params);

        return resultCache.getOrCompute(OP_LFL, params, query.isForceRefresh(), LflResponse.class, () -> {
            SalesTotals first = aggregationService.totals(period1, filter);
            SalesTotals second = aggregationService.totals(period2, filter);

            List<LflComparison> comparisons = new ArrayList<>();
            ComparisonMetric[] metrics = query.getMetric() != null
                    ? new ComparisonMetric[]{query.getMetric()}
                    : ComparisonMetric.values();
            for (ComparisonMetric metric : metrics) {
                BigDecimal value1 = metric.extract(first);
                BigDecimal value2 = metric.extract(second);
                comparisons.add(LflComparison.builder()
                        .metric(metric)
                        .period1Value(value1)
                        .period2Value(value2)
                        .changeAbsolute(value2.subtract(value1))
                        .changePercent(Ratios.changePercent(value1, value2))
                        .build());
            }

            return LflResponse.builder()
                    .period1Label(period1.label())
                    .period2Label(period2.label())
                    .comparisons(comparisons)
                    .build();
        });
    }

    /**
     * Stores a plan target. Cached results are dropped only once the insert
     * has committed, so a concurrent read cannot re-cache the old plan set.
     */
    public PlanTargetEntity createPlan(PlanTargetRequest request) {
        DateRange period = DateRange.of(request.getPeriodStart(), request.getPeriodEnd());

        PlanTargetEntity plan = PlanTargetEntity.builder()
                .periodStart(period.getStart())
                .periodEnd(period.getEnd())
                .productId(request.getProductId())
                .customerId(request.getCustomerId())
                .agentCode(blankToNull(request.getAgentCode()))
                .region(blankToNull(request.getRegion()))
                .category(blankToNull(request.getCategory()))
                .plannedRevenue(orZero(request.getPlannedRevenue()))
                .plannedQuantity(orZero(request.getPlannedQuantity()))
                .plannedOrders(request.getPlannedOrders() != null ? request.getPlannedOrders() : 0)
                .build();

        PlanTargetEntity saved = transactionTemplate.execute(status -> planTargetRepository.save(plan));
        log.info("Plan target created: {} for {}", saved.getId(), period.label());

        resultCache.invalidateAll("plan target created");
        return saved;
    }

    @Transactional(readOnly = true)
    public List<PlanTargetEntity> listPlans(DateRange range) {
        return planTargetRepository.findByPeriodStartBetweenOrderByPeriodStartAsc(range.getStart(), range.getEnd());
    }

    /**
     * Plans starting inside the range whose every dimension equals the filter's.
     */
    List<PlanTargetEntity> matchingPlans(DateRange range, SalesFilter filter) {
        List<PlanTargetEntity> matches = new ArrayList<>();
        for (PlanTargetEntity plan : listPlans(range)) {
            if (Objects.equals(plan.getProductId(), filter.getProductId())
                    && Objects.equals(plan.getCustomerId(), filter.getCustomerId())
                    && Objects.equals(plan.getAgentCode(), filter.getAgentCode())
                    && Objects.equals(plan.getRegion(), filter.getRegion())
                    && Objects.equals(plan.getCategory(), filter.getCategory())) {
                matches.add(plan);
            }
        }
        return matches;
    }

    private static PlanFactMetric planFactMetric(ComparisonMetric metric, BigDecimal planned, BigDecimal actual) {
        BigDecimal variance = actual.subtract(planned);
        return PlanFactMetric.builder()
                .metric(metric)
                .planned(planned)
                .actual(actual)
                .variance(variance)
                .variancePercent(Ratios.percentOf(variance, planned))
                .fulfillmentPercent(Ratios.percentOf(actual, planned))
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
