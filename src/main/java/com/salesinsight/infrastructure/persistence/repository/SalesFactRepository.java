package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.SalesFactEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the analytics engine plus the cascade delete of an import.
 *
 * Every analytics query is bounded by saleDate and accepts the same optional
 * slice. Region is the store's region, category the product's category; a
 * fact without a store or product never matches a region or category filter.
 */
@Repository
public interface SalesFactRepository extends JpaRepository<SalesFactEntity, UUID> {

    String SLICE_JOINS =
            "LEFT JOIN ProductEntity p ON p.id = f.productId " +
            "LEFT JOIN StoreEntity s ON s.id = f.storeId ";

    String SLICE_FILTER =
            "f.saleDate BETWEEN :startDate AND :endDate AND " +
            "(:customerId IS NULL OR f.customerId = :customerId) AND " +
            "(:productId IS NULL OR f.productId = :productId) AND " +
            "(:storeId IS NULL OR f.storeId = :storeId) AND " +
            "(:agentCode IS NULL OR f.agentCode = :agentCode) AND " +
            "(:region IS NULL OR s.region = :region) AND " +
            "(:category IS NULL OR p.category = :category) ";

    long countByImportJobId(UUID importJobId);

    @Modifying
    @Query("DELETE FROM SalesFactEntity f WHERE f.importJobId = :importJobId")
    int deleteAllByImportJobId(@Param("importJobId") UUID importJobId);

    @Modifying
    @Query("DELETE FROM SalesFactEntity f")
    int deleteAllFacts();

    /**
     * One row: revenue, fact count, quantity, distinct customers.
     */
    @Query("SELECT COALESCE(SUM(f.totalAmount), 0), COUNT(f), COALESCE(SUM(f.quantity), 0), " +
           "COUNT(DISTINCT f.customerId) " +
           "FROM SalesFactEntity f " + SLICE_JOINS +
           "WHERE " + SLICE_FILTER)
    List<Object[]> summarize(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category
    );

    /**
     * Ranking rows: customer id, name, revenue, fact count, quantity.
     * The id tie-break keeps equal revenues in a stable order.
     */
    @Query("SELECT f.customerId, c.name, SUM(f.totalAmount), COUNT(f), SUM(f.quantity) " +
           "FROM SalesFactEntity f JOIN CustomerEntity c ON c.id = f.customerId " + SLICE_JOINS +
           "WHERE " + SLICE_FILTER +
           "GROUP BY f.customerId, c.name " +
           "ORDER BY SUM(f.totalAmount) DESC, f.customerId ASC")
    List<Object[]> rankCustomers(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category,
            Pageable pageable
    );

    /**
     * Ranking rows: product id, name, revenue, fact count, quantity.
     */
    @Query("SELECT f.productId, p.name, SUM(f.totalAmount), COUNT(f), SUM(f.quantity) " +
           "FROM SalesFactEntity f " + SLICE_JOINS +
           "WHERE f.productId IS NOT NULL AND " + SLICE_FILTER +
           "GROUP BY f.productId, p.name " +
           "ORDER BY SUM(f.totalAmount) DESC, f.productId ASC")
    List<Object[]> rankProducts(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category,
            Pageable pageable
    );

    /**
     * Daily buckets: date, revenue, fact count.
     */
    @Query("SELECT f.saleDate, SUM(f.totalAmount), COUNT(f) " +
           "FROM SalesFactEntity f " + SLICE_JOINS +
           "WHERE " + SLICE_FILTER +
           "GROUP BY f.saleDate " +
           "ORDER BY f.saleDate ASC")
    List<Object[]> trendByDay(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category
    );

    /**
     * ISO week buckets: week-based year, week, revenue, fact count.
     */
    @Query("SELECT f.weekYear, f.week, SUM(f.totalAmount), COUNT(f) " +
           "FROM SalesFactEntity f " + SLICE_JOINS +
           "WHERE " + SLICE_FILTER +
           "GROUP BY f.weekYear, f.week " +
           "ORDER BY f.weekYear ASC, f.week ASC")
    List<Object[]> trendByWeek(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category
    );

    /**
     * Month buckets: year, month, revenue, fact count.
     */
    @Query("SELECT f.year, f.month, SUM(f.totalAmount), COUNT(f) " +
           "FROM SalesFactEntity f " + SLICE_JOINS +
           "WHERE " + SLICE_FILTER +
           "GROUP BY f.year, f.month " +
           "ORDER BY f.year ASC, f.month ASC")
    List<Object[]> trendByMonth(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("customerId") UUID customerId,
            @Param("productId") UUID productId,
            @Param("storeId") UUID storeId,
            @Param("agentCode") String agentCode,
            @Param("region") String region,
            @Param("category") String category
    );

    /**
     * Per product per day: product id, name, category, date, revenue, quantity.
     * Input of the ABC/XYZ classification, bucketed into periods by the caller.
     */
    @Query("SELECT f.productId, p.name, p.category, f.saleDate, SUM(f.totalAmount), SUM(f.quantity) " +
           "FROM SalesFactEntity f JOIN ProductEntity p ON p.id = f.productId " +
           "WHERE f.saleDate BETWEEN :startDate AND :endDate " +
           "GROUP BY f.productId, p.name, p.category, f.saleDate")
    List<Object[]> productDailyDemand(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );
}
