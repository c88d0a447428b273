package com.salesinsight.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.salesinsight.domain.model.DashboardMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryCacheService.
 *
 * Redis is mocked; the ObjectMapper is real so envelope (de)serialization
 * is exercised end to end.
 */
@ExtendWith(MockitoExtension.class)
class QueryCacheServiceTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    private ObjectMapper objectMapper;
    private QueryCacheService cacheService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        cacheService = new QueryCacheService(redisTemplate, objectMapper);
    }

    @Test
    void testGenerateCacheKey_IndependentOfParameterOrder() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("startDate", LocalDate.of(2024, 1, 1));
        first.put("region", "North");
        first.put("limit", 10);

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("limit", 10);
        second.put("region", "North");
        second.put("startDate", LocalDate.of(2024, 1, 1));

        // When
        String key1 = cacheService.generateCacheKey("top-customers", first);
        String key2 = cacheService.generateCacheKey("top-customers", second);

        // Then
        assertEquals(key1, key2);
        assertTrue(key1.startsWith("analytics:top-customers:"));
        assertEquals("analytics:top-customers:".length() + 64, key1.length());
    }

    @Test
    void testGenerateCacheKey_DifferentValuesOrOperation_DifferentKeys() {
        // Given
        Map<String, Object> north = new LinkedHashMap<>();
        north.put("region", "North");
        Map<String, Object> unfiltered = new LinkedHashMap<>();
        unfiltered.put("region", null);

        // When/Then
        assertNotEquals(cacheService.generateCacheKey("dashboard", north),
                cacheService.generateCacheKey("dashboard", unfiltered));
        assertNotEquals(cacheService.generateCacheKey("dashboard", north),
                cacheService.generateCacheKey("trend", north));
    }

    @Test
    void testOperationOf() {
        assertEquals("abc-xyz", QueryCacheService.operationOf("analytics:abc-xyz:0123abcd"));
        assertEquals("dashboard", QueryCacheService.operationOf("analytics:dashboard:ff"));
    }

    @Test
    void testSetThenGet_RoundTripsEnvelope() throws Exception {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        DashboardMetrics metrics = DashboardMetrics.builder()
                .totalRevenue(new BigDecimal("1500.00"))
                .totalSales(3)
                .build();
        CacheEnvelope<DashboardMetrics> envelope =
                new CacheEnvelope<>("dashboard", metrics, Instant.parse("2024-03-01T10:00:00Z"), 2L);

        // When
        cacheService.set("analytics:dashboard:k", envelope, 3600);

        // Then
        verify(valueOperations).set(eq("analytics:dashboard:k"), anyString(), eq(3600L), eq(TimeUnit.SECONDS));
        verify(setOperations).add("analytics:index", "analytics:dashboard:k");

        // And reading the stored JSON back
        String json = objectMapper.writeValueAsString(envelope);
        when(valueOperations.get("analytics:dashboard:k")).thenReturn(json);

        Optional<CacheEnvelope<DashboardMetrics>> read = cacheService.get("analytics:dashboard:k", DashboardMetrics.class);
        assertTrue(read.isPresent());
        assertEquals(2L, read.get().getGeneration());
        assertEquals(new BigDecimal("1500.00"), read.get().getPayload().getTotalRevenue());
    }

    @Test
    void testGet_UnreadableEntry_TreatedAsMiss() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("analytics:dashboard:k")).thenReturn("{not json");

        // When
        Optional<CacheEnvelope<DashboardMetrics>> read = cacheService.get("analytics:dashboard:k", DashboardMetrics.class);

        // Then
        assertFalse(read.isPresent());
    }

    @Test
    void testInvalidateAll_BumpsGenerationAndDeletesIndexedKeys() {
        // Given
        Set<String> keys = Set.of("analytics:dashboard:a", "analytics:trend:b");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(valueOperations.increment("analytics:generation")).thenReturn(4L);
        when(setOperations.members("analytics:index")).thenReturn(keys);
        when(redisTemplate.delete(keys)).thenReturn(2L);

        // When
        long removed = cacheService.invalidateAll();

        // Then
        assertEquals(2, removed);
        verify(valueOperations).increment("analytics:generation");
        verify(setOperations).remove(eq("analytics:index"), any(Object[].class));
    }

    @Test
    void testCurrentGeneration_DefaultsToZero() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("analytics:generation")).thenReturn(null);

        // When/Then
        assertEquals(0, cacheService.currentGeneration());
    }

    @Test
    void testLiveKeys_PrunesExpiredEntries() {
        // Given
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("analytics:index"))
                .thenReturn(Set.of("analytics:dashboard:live", "analytics:dashboard:gone"));
        when(redisTemplate.hasKey("analytics:dashboard:live")).thenReturn(true);
        when(redisTemplate.hasKey("analytics:dashboard:gone")).thenReturn(false);

        // When
        Set<String> live = cacheService.liveKeys();

        // Then
        assertEquals(Set.of("analytics:dashboard:live"), live);
        verify(setOperations).remove("analytics:index", "analytics:dashboard:gone");
    }
}
