package com.salesinsight.api;

import com.salesinsight.domain.model.AbcXyzMatrixResponse;
import com.salesinsight.domain.model.AbcXyzQuery;
import com.salesinsight.domain.model.AnalyticsQuery;
import com.salesinsight.domain.model.CacheStats;
import com.salesinsight.domain.model.ComparisonMetric;
import com.salesinsight.domain.model.DashboardMetrics;
import com.salesinsight.domain.model.DateRange;
import com.salesinsight.domain.model.DemandMeasure;
import com.salesinsight.domain.model.LflQuery;
import com.salesinsight.domain.model.LflResponse;
import com.salesinsight.domain.model.PlanFactQuery;
import com.salesinsight.domain.model.PlanFactResponse;
import com.salesinsight.domain.model.PlanTargetRequest;
import com.salesinsight.domain.model.TopEntitiesResponse;
import com.salesinsight.domain.model.TrendGranularity;
import com.salesinsight.domain.model.TrendResponse;
import com.salesinsight.domain.service.AggregationService;
import com.salesinsight.domain.service.AnalyticsResultCache;
import com.salesinsight.domain.service.ClassificationService;
import com.salesinsight.domain.service.ComparisonService;
import com.salesinsight.infrastructure.persistence.entity.PlanTargetEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for sales analytics.
 *
 * Endpoints:
 * - GET /api/v1/analytics/dashboard - Revenue, sales count, average check
 * - GET /api/v1/analytics/top-customers - Top-N customers by revenue
 * - GET /api/v1/analytics/top-products - Top-N products by revenue
 * - GET /api/v1/analytics/trend - Revenue by day, week or month
 * - GET /api/v1/analytics/abc-xyz - ABC/XYZ product matrix
 * - GET /api/v1/analytics/plan-fact - Plan vs actual
 * - GET /api/v1/analytics/lfl - Like-for-like period comparison
 * - POST/GET /api/v1/analytics/plans - Plan targets
 * - GET /api/v1/analytics/cache/stats, POST /api/v1/analytics/cache/refresh
 *
 * Dates are ISO (yyyy-MM-dd). Every query result carries "cached" and
 * "computedAt"; forceRefresh=true bypasses the cache.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AggregationService aggregationService;
    private final ClassificationService classificationService;
    private final ComparisonService comparisonService;
    private final AnalyticsResultCache resultCache;

    /**
     * Dashboard metrics.
     *
     * GET /api/v1/analytics/dashboard?startDate=2024-01-01&endDate=2024-01-31&region=xxx
     *
     * Query Parameters:
     * - startDate, endDate (optional): inclusive range, default last 30 days
     * - customerId, productId, storeId, region, category, agentCode (optional): slice
     */
    @GetMapping("/dashboard")
    public ResponseEntity<DashboardMetrics> dashboard(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) UUID storeId,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String agentCode,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("Dashboard: startDate={}, endDate={}, region={}, category={}", startDate, endDate, region, category);

        AnalyticsQuery query = AnalyticsQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .customerId(customerId)
                .productId(productId)
                .storeId(storeId)
                .region(region)
                .category(category)
                .agentCode(agentCode)
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(aggregationService.dashboard(query));
    }

    /**
     * Top customers by revenue.
     *
     * GET /api/v1/analytics/top-customers?limit=10
     *
     * limit defaults to 10 and is capped at 100; 0 returns an empty list.
     */
    @GetMapping("/top-customers")
    public ResponseEntity<TopEntitiesResponse> topCustomers(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) UUID storeId,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String agentCode,
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("Top customers: startDate={}, endDate={}, limit={}", startDate, endDate, limit);

        AnalyticsQuery query = AnalyticsQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .productId(productId)
                .storeId(storeId)
                .region(region)
                .category(category)
                .agentCode(agentCode)
                .limit(limit)
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(aggregationService.topCustomers(query));
    }

    @GetMapping("/top-products")
    public ResponseEntity<TopEntitiesResponse> topProducts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) UUID storeId,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String agentCode,
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("Top products: startDate={}, endDate={}, limit={}", startDate, endDate, limit);

        AnalyticsQuery query = AnalyticsQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .customerId(customerId)
                .storeId(storeId)
                .region(region)
                .category(category)
                .agentCode(agentCode)
                .limit(limit)
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(aggregationService.topProducts(query));
    }

    /**
     * Revenue trend.
     *
     * GET /api/v1/analytics/trend?period=week&dense=true
     *
     * Buckets are keyed yyyy-MM-dd (day), YYYY-Www (ISO week) or yyyy-MM (month).
     * dense=true adds zero buckets for periods without sales.
     */
    @GetMapping("/trend")
    public ResponseEntity<TrendResponse> trend(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String period,
            @RequestParam(defaultValue = "false") boolean dense,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) UUID storeId,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String agentCode,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("Trend: startDate={}, endDate={}, period={}, dense={}", startDate, endDate, period, dense);

        AnalyticsQuery query = AnalyticsQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .granularity(TrendGranularity.parse(period, TrendGranularity.DAY))
                .dense(dense)
                .customerId(customerId)
                .productId(productId)
                .storeId(storeId)
                .region(region)
                .category(category)
                .agentCode(agentCode)
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(aggregationService.trend(query));
    }

    /**
     * ABC/XYZ matrix.
     *
     * GET /api/v1/analytics/abc-xyz?days=90&period=month&measure=quantity
     */
    @GetMapping("/abc-xyz")
    public ResponseEntity<AbcXyzMatrixResponse> abcXyz(
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String measure,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("ABC/XYZ: days={}, endDate={}, period={}, measure={}", days, endDate, period, measure);

        AbcXyzQuery query = AbcXyzQuery.builder()
                .days(days)
                .endDate(endDate)
                .granularity(TrendGranularity.parse(period, TrendGranularity.MONTH))
                .demandMeasure(DemandMeasure.parse(measure))
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(classificationService.abcXyz(query));
    }

    /**
     * Plan vs actual.
     *
     * GET /api/v1/analytics/plan-fact?startDate=2024-01-01&endDate=2024-01-31&agentCode=A1
     *
     * Only plans whose dimensions equal the given filter are compared.
     */
    @GetMapping("/plan-fact")
    public ResponseEntity<PlanFactResponse> planFact(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) String agentCode,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("Plan-fact: startDate={}, endDate={}, agentCode={}, region={}", startDate, endDate, agentCode, region);

        PlanFactQuery query = PlanFactQuery.builder()
                .startDate(startDate)
                .endDate(endDate)
                .productId(productId)
                .customerId(customerId)
                .agentCode(blankToNull(agentCode))
                .region(blankToNull(region))
                .category(blankToNull(category))
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(comparisonService.planFact(query));
    }

    /**
     * Like-for-like comparison.
     *
     * GET /api/v1/analytics/lfl?period1Start=...&period1End=...&period2Start=...&period2End=...&metric=revenue
     *
     * The periods must not overlap. Without metric every metric is compared.
     */
    @GetMapping("/lfl")
    public ResponseEntity<LflResponse> likeForLike(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate period1Start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate period1End,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate period2Start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate period2End,
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) UUID productId,
            @RequestParam(required = false) String agentCode,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        log.info("LFL: {}..{} vs {}..{}, metric={}", period1Start, period1End, period2Start, period2End, metric);

        LflQuery query = LflQuery.builder()
                .period1Start(period1Start)
                .period1End(period1End)
                .period2Start(period2Start)
                .period2End(period2End)
                .metric(ComparisonMetric.parse(metric))
                .customerId(customerId)
                .productId(productId)
                .agentCode(blankToNull(agentCode))
                .region(blankToNull(region))
                .category(blankToNull(category))
                .forceRefresh(forceRefresh)
                .build();

        return ResponseEntity.ok(comparisonService.likeForLike(query));
    }

    @PostMapping("/plans")
    public ResponseEntity<PlanTargetEntity> createPlan(@Valid @RequestBody PlanTargetRequest request) {
        log.info("Create plan: {}..{}", request.getPeriodStart(), request.getPeriodEnd());
        return ResponseEntity.status(HttpStatus.CREATED).body(comparisonService.createPlan(request));
    }

    @GetMapping("/plans")
    public ResponseEntity<List<PlanTargetEntity>> listPlans(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(comparisonService.listPlans(DateRange.of(startDate, endDate)));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(resultCache.stats());
    }

    /**
     * Drop every cached analytics result.
     */
    @PostMapping("/cache/refresh")
    public ResponseEntity<Map<String, Long>> refreshCache() {
        log.info("Cache refresh requested");
        long removed = resultCache.invalidateAll("explicit refresh");
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
