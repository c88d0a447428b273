package com.salesinsight.api;

import com.salesinsight.domain.model.AnalyticsQuery;
import com.salesinsight.domain.model.DashboardMetrics;
import com.salesinsight.domain.model.LflQuery;
import com.salesinsight.domain.model.LflResponse;
import com.salesinsight.domain.model.ComparisonMetric;
import com.salesinsight.domain.service.AggregationService;
import com.salesinsight.domain.service.AnalyticsResultCache;
import com.salesinsight.domain.service.ClassificationService;
import com.salesinsight.domain.service.ComparisonService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Parameter binding and validation of the analytics endpoints.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {

    @Mock
    private AggregationService aggregationService;

    @Mock
    private ClassificationService classificationService;

    @Mock
    private ComparisonService comparisonService;

    @Mock
    private AnalyticsResultCache resultCache;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AnalyticsController controller = new AnalyticsController(
                aggregationService, classificationService, comparisonService, resultCache);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testDashboard_BindsQuery() throws Exception {
        // Given
        when(aggregationService.dashboard(any(AnalyticsQuery.class))).thenReturn(DashboardMetrics.builder()
                .totalRevenue(new BigDecimal("2500.00"))
                .totalSales(3)
                .averageCheck(new BigDecimal("833.33"))
                .build());

        // When
        mockMvc.perform(get("/api/v1/analytics/dashboard")
                        .param("startDate", "2024-01-01")
                        .param("endDate", "2024-01-31")
                        .param("region", "North")
                        .param("forceRefresh", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSales").value(3))
                .andExpect(jsonPath("$.averageCheck").value(833.33));

        // Then
        ArgumentCaptor<AnalyticsQuery> query = ArgumentCaptor.forClass(AnalyticsQuery.class);
        verify(aggregationService).dashboard(query.capture());
        assertEquals(LocalDate.of(2024, 1, 1), query.getValue().getStartDate());
        assertEquals("North", query.getValue().getRegion());
        assertTrue(query.getValue().isForceRefresh());
    }

    @Test
    void testTrend_UnknownPeriod() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/trend").param("period", "yearly"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(aggregationService);
    }

    @Test
    void testDashboard_MalformedDate() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/dashboard").param("startDate", "01/02/2024"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testPlanFact_DatesRequired() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/plan-fact").param("startDate", "2024-03-01"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(comparisonService);
    }

    @Test
    void testLikeForLike_MetricParsed() throws Exception {
        // Given
        when(comparisonService.likeForLike(any(LflQuery.class))).thenReturn(new LflResponse());

        // When
        mockMvc.perform(get("/api/v1/analytics/lfl")
                        .param("period1Start", "2023-03-01")
                        .param("period1End", "2023-03-31")
                        .param("period2Start", "2024-03-01")
                        .param("period2End", "2024-03-31")
                        .param("metric", "revenue"))
                .andExpect(status().isOk());

        // Then
        verify(comparisonService).likeForLike(argThat(q -> q.getMetric() == ComparisonMetric.REVENUE));
    }

    @Test
    void testCreatePlan_NegativeAmountRejected() throws Exception {
        String body = "{\"periodStart\":\"2024-03-01\",\"periodEnd\":\"2024-03-31\",\"plannedRevenue\":-5}";

        mockMvc.perform(post("/api/v1/analytics/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(comparisonService);
    }

    @Test
    void testRefreshCache() throws Exception {
        when(resultCache.invalidateAll(anyString())).thenReturn(6L);

        mockMvc.perform(post("/api/v1/analytics/cache/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(6));
    }
}
