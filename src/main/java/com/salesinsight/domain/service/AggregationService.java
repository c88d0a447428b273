package com.salesinsight.domain.service;

import com.salesinsight.domain.exception.InvalidQueryException;
import com.salesinsight.domain.model.AnalyticsQuery;
import com.salesinsight.domain.model.DashboardMetrics;
import com.salesinsight.domain.model.DateRange;
import com.salesinsight.domain.model.Ratios;
import com.salesinsight.domain.model.SalesCalendar;
import com.salesinsight.domain.model.SalesFilter;
import com.salesinsight.domain.model.SalesTotals;
import com.salesinsight.domain.model.TopEntitiesResponse;
import com.salesinsight.domain.model.TopEntityRow;
import com.salesinsight.domain.model.TrendBucket;
import com.salesinsight.domain.model.TrendGranularity;
import com.salesinsight.domain.model.TrendResponse;
import com.salesinsight.infrastructure.persistence.repository.SalesFactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard metrics, top-N rankings and trend buckets over sales facts.
 *
 * All operations are read-only, bounded by an inclusive date range (default:
 * trailing app.analytics.default-range-days ending today) and go through the
 * analytics result cache. Empty data yields zero metrics and empty lists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    static final String OP_DASHBOARD = "dashboard";
    static final String OP_TOP_CUSTOMERS = "top-customers";
    static final String OP_TOP_PRODUCTS = "top-products";
    static final String OP_TREND = "trend";

    private final SalesFactRepository salesFactRepository;
    private final AnalyticsResultCache resultCache;

    @Value("${app.analytics.default-range-days:30}")
    private int defaultRangeDays = 30;

    @Value("${app.analytics.default-limit:10}")
    private int defaultLimit = 10;

    @Value("${app.analytics.max-limit:100}")
    private int maxLimit = 100;

    @Transactional(readOnly = true, timeout = 10)
    public DashboardMetrics dashboard(AnalyticsQuery query) {
        DateRange range = resolveRange(query);
        SalesFilter filter = query.toFilter();

        return resultCache.getOrCompute(OP_DASHBOARD, parameters(range, filter), query.isForceRefresh(),
                DashboardMetrics.class, () -> {
                    SalesTotals totals = totals(range, filter);
                    return DashboardMetrics.builder()
                            .startDate(range.getStart())
                            .endDate(range.getEnd())
                            .totalRevenue(totals.getRevenue())
                            .totalSales(totals.getOrders())
                            .averageCheck(totals.averageCheck())
                            .totalQuantity(totals.getQuantity())
                            .uniqueCustomers(totals.getUniqueCustomers())
                            .build();
                });
    }

    @Transactional(readOnly = true, timeout = 10)
    public TopEntitiesResponse topCustomers(AnalyticsQuery query) {
        return topEntities(OP_TOP_CUSTOMERS, "customer", query);
    }

    @Transactional(readOnly = true, timeout = 10)
    public TopEntitiesResponse topProducts(AnalyticsQuery query) {
        return topEntities(OP_TOP_PRODUCTS, "product", query);
    }

    @Transactional(readOnly = true, timeout = 10)
    public TrendResponse trend(AnalyticsQuery query) {
        DateRange range = resolveRange(query);
        SalesFilter filter = query.toFilter();
        TrendGranularity granularity = query.getGranularity();

        Map<String, Object> params = parameters(range, filter);
        params.put("granularity", granularity);
        params.put("dense", query.isDense());

        return resultCache.getOrCompute(OP_TREND, params, query.isForceRefresh(), TrendResponse.class, () -> {
            List<TrendBucket> buckets = loadBuckets(range, filter, granularity);
            if (query.isDense()) {
                buckets = zeroFill(buckets, range, granularity);
            }
            log.info("Trend computed: {} {} buckets for {}", buckets.size(), granularity, range.label());
            return TrendResponse.builder()
                    .granularity(granularity)
                    .startDate(range.getStart())
                    .endDate(range.getEnd())
                    .dense(query.isDense())
                    .buckets(buckets)
                    .build();
        });
    }

    /**
     * Uncached totals of one slice. Shared with the plan-fact and LFL comparator.
     */
    @Transactional(readOnly = true, timeout = 10)
    public SalesTotals totals(DateRange range, SalesFilter filter) {
        List<Object[]> rows = salesFactRepository.summarize(
                range.getStart(), range.getEnd(),
                filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                filter.getAgentCode(), filter.getRegion(), filter.getCategory());

        if (rows.isEmpty() || rows.get(0) == null) {
            return SalesTotals.empty();
        }
        Object[] row = rows.get(0);
        return SalesTotals.builder()
                .revenue(QueryRows.decimal(row[0]))
                .orders(QueryRows.count(row[1]))
                .quantity(QueryRows.decimal(row[2]))
                .uniqueCustomers(QueryRows.count(row[3]))
                .build();
    }

    public DateRange resolveRange(AnalyticsQuery query) {
        return DateRange.orDefault(query.getStartDate(), query.getEndDate(), defaultRangeDays);
    }

    /**
     * Requested limit, defaulted and capped. 0 is a valid (empty) ranking.
     */
    int resolveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested < 0) {
            throw new InvalidQueryException("limit must not be negative: " + requested);
        }
        return Math.min(requested, maxLimit);
    }

    private TopEntitiesResponse topEntities(String operation, String entityType, AnalyticsQuery query) {
        DateRange range = resolveRange(query);
        SalesFilter filter = query.toFilter();
        int limit = resolveLimit(query.getLimit());

        Map<String, Object> params = parameters(range, filter);
        params.put("limit", limit);

        return resultCache.getOrCompute(operation, params, query.isForceRefresh(), TopEntitiesResponse.class, () -> {
            List<TopEntityRow> items = limit == 0 ? new ArrayList<>() : rank(entityType, range, filter, limit);
            log.info("Top {} computed: {} of {} requested for {}", entityType, items.size(), limit, range.label());
            return TopEntitiesResponse.builder()
                    .entityType(entityType)
                    .startDate(range.getStart())
                    .endDate(range.getEnd())
                    .limit(limit)
                    .items(items)
                    .build();
        });
    }

    private List<TopEntityRow> rank(String entityType, DateRange range, SalesFilter filter, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<Object[]> rows = "customer".equals(entityType)
                ? salesFactRepository.rankCustomers(range.getStart(), range.getEnd(),
                        filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                        filter.getAgentCode(), filter.getRegion(), filter.getCategory(), page)
                : salesFactRepository.rankProducts(range.getStart(), range.getEnd(),
                        filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                        filter.getAgentCode(), filter.getRegion(), filter.getCategory(), page);

        List<TopEntityRow> items = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            long orders = QueryRows.count(row[3]);
            items.add(TopEntityRow.builder()
                    .rank(items.size() + 1)
                    .entityId(QueryRows.uuid(row[0]))
                    .name((String) row[1])
                    .totalAmount(QueryRows.decimal(row[2]))
                    .orders(orders)
                    .quantity(QueryRows.decimal(row[4]))
                    .averageCheck(Ratios.average(QueryRows.decimal(row[2]), orders))
                    .build());
        }
        return items;
    }

    private List<TrendBucket> loadBuckets(DateRange range, SalesFilter filter, TrendGranularity granularity) {
        List<TrendBucket> buckets = new ArrayList<>();
        switch (granularity) {
            case DAY:
                for (Object[] row : salesFactRepository.trendByDay(range.getStart(), range.getEnd(),
                        filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                        filter.getAgentCode(), filter.getRegion(), filter.getCategory())) {
                    buckets.add(bucket(SalesCalendar.periodKey(QueryRows.date(row[0]), TrendGranularity.DAY),
                            row[1], row[2]));
                }
                break;
            case WEEK:
                for (Object[] row : salesFactRepository.trendByWeek(range.getStart(), range.getEnd(),
                        filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                        filter.getAgentCode(), filter.getRegion(), filter.getCategory())) {
                    buckets.add(bucket(SalesCalendar.weekKey(QueryRows.integer(row[0]), QueryRows.integer(row[1])),
                            row[2], row[3]));
                }
                break;
            case MONTH:
                for (Object[] row : salesFactRepository.trendByMonth(range.getStart(), range.getEnd(),
                        filter.getCustomerId(), filter.getProductId(), filter.getStoreId(),
                        filter.getAgentCode(), filter.getRegion(), filter.getCategory())) {
                    buckets.add(bucket(SalesCalendar.monthKey(QueryRows.integer(row[0]), QueryRows.integer(row[1])),
                            row[2], row[3]));
                }
                break;
            default:
                throw new InvalidQueryException("Unsupported period: " + granularity);
        }
        return buckets;
    }

    private static TrendBucket bucket(String period, Object amount, Object orders) {
        long count = QueryRows.count(orders);
        return TrendBucket.builder()
                .period(period)
                .amount(QueryRows.decimal(amount))
                .orders(count)
                .averageCheck(Ratios.average(QueryRows.decimal(amount), count))
                .build();
    }

    private static List<TrendBucket> zeroFill(List<TrendBucket> sparse, DateRange range, TrendGranularity granularity) {
        Map<String, TrendBucket> byPeriod = new LinkedHashMap<>();
        for (TrendBucket bucket : sparse) {
            byPeriod.put(bucket.getPeriod(), bucket);
        }
        List<TrendBucket> dense = new ArrayList<>();
        for (String period : SalesCalendar.periodKeys(range.getStart(), range.getEnd(), granularity)) {
            TrendBucket existing = byPeriod.get(period);
            dense.add(existing != null ? existing : TrendBucket.empty(period));
        }
        return dense;
    }

    private static Map<String, Object> parameters(DateRange range, SalesFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("startDate", range.getStart());
        params.put("endDate", range.getEnd());
        filter.appendTo(params);
        return params;
    }
}
