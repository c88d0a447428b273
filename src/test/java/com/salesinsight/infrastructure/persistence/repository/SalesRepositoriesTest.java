package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.CustomerEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity.JobStatus;
import com.salesinsight.infrastructure.persistence.entity.ProductEntity;
import com.salesinsight.infrastructure.persistence.entity.SalesFactEntity;
import com.salesinsight.infrastructure.persistence.entity.StoreEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository queries and schema.sql constraints against a real PostgreSQL.
 *
 * The schema comes from schema.sql (spring.sql.init) and Hibernate validates
 * the entities against it, the same way the application starts. Skipped when
 * no Docker daemon is available.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class SalesRepositoriesTest {

    private static final LocalDate MAR_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate MAR_31 = LocalDate.of(2024, 3, 31);

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ImportJobRepository jobRepository;

    @Autowired
    private SalesFactRepository salesFactRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private StoreRepository storeRepository;

    @Test
    void testClaim_SecondCallerLoses() {
        // Given
        ImportJobEntity job = jobRepository.saveAndFlush(job(JobStatus.PENDING));
        Instant now = Instant.now();

        // When
        int first = jobRepository.claim(job.getJobId(), JobStatus.PENDING, JobStatus.PROCESSING, now);
        int second = jobRepository.claim(job.getJobId(), JobStatus.PENDING, JobStatus.PROCESSING, now);
        entityManager.clear();

        // Then
        assertEquals(1, first);
        assertEquals(0, second);
        ImportJobEntity claimed = jobRepository.findById(job.getJobId()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, claimed.getStatus());
        assertNotNull(claimed.getStartedAt());
    }

    @Test
    void testClaim_ResetJobNotPickedUpAgain() {
        // Given: operator reset keeps startedAt
        ImportJobEntity job = job(JobStatus.PENDING);
        job.setStartedAt(Instant.now().minusSeconds(600));
        jobRepository.saveAndFlush(job);

        // When
        int claimed = jobRepository.claim(job.getJobId(), JobStatus.PENDING, JobStatus.PROCESSING, Instant.now());

        // Then
        assertEquals(0, claimed);
        assertTrue(jobRepository.findTop10ByStatusAndStartedAtIsNullOrderByCreatedAtAsc(JobStatus.PENDING).isEmpty());
    }

    @Test
    void testFindByIdForUpdate_ReturnsLockedJob() {
        // Given
        ImportJobEntity job = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        entityManager.clear();

        // When/Then
        assertEquals(JobStatus.COMPLETED, jobRepository.findByIdForUpdate(job.getJobId()).orElseThrow().getStatus());
        assertTrue(jobRepository.findByIdForUpdate(UUID.randomUUID()).isEmpty());
        assertEquals(1, jobRepository.findAllForUpdate().size());
    }

    @Test
    void testIncrementAggregates_KeepsLatestActivityDate() {
        // Given
        CustomerEntity customer = customerRepository.saveAndFlush(CustomerEntity.builder()
                .name("Ivanov")
                .normalizedName("ivanov")
                .build());

        // When: second sale is older than the first
        customerRepository.incrementAggregates(customer.getId(), new BigDecimal("100.50"), MAR_31);
        customerRepository.incrementAggregates(customer.getId(), new BigDecimal("20.25"), MAR_1);
        entityManager.clear();

        // Then
        CustomerEntity updated = customerRepository.findByNormalizedName("ivanov").orElseThrow();
        assertEquals(0, new BigDecimal("120.75").compareTo(updated.getTotalAmount()));
        assertEquals(2, updated.getActivityCount());
        assertEquals(MAR_31, updated.getLastActivityDate());
    }

    @Test
    void testResetAggregates_ZeroesEveryRow() {
        // Given
        ProductEntity product = productRepository.saveAndFlush(product("Widget", "Tools"));
        productRepository.incrementAggregates(product.getId(), new BigDecimal("50.00"), MAR_1);

        // When
        int reset = productRepository.resetAggregates();
        entityManager.clear();

        // Then
        assertEquals(1, reset);
        ProductEntity cleared = productRepository.findById(product.getId()).orElseThrow();
        assertEquals(0, BigDecimal.ZERO.compareTo(cleared.getTotalAmount()));
        assertEquals(0, cleared.getActivityCount());
        assertNull(cleared.getLastActivityDate());
    }

    @Test
    void testSummarize_SlicesByStoreRegionAndProductCategory() {
        // Given
        ImportJobEntity job = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        CustomerEntity alpha = customerRepository.saveAndFlush(customer("Alpha"));
        CustomerEntity beta = customerRepository.saveAndFlush(customer("Beta"));
        ProductEntity tool = productRepository.saveAndFlush(product("Hammer", "Tools"));
        ProductEntity food = productRepository.saveAndFlush(product("Bread", "Food"));
        StoreEntity north = storeRepository.saveAndFlush(store("North-1", "North"));
        StoreEntity south = storeRepository.saveAndFlush(store("South-1", "South"));

        salesFactRepository.save(fact(job, MAR_1, alpha, tool, north, "300.00", "3"));
        salesFactRepository.save(fact(job, MAR_1.plusDays(1), beta, food, north, "50.00", "10"));
        salesFactRepository.save(fact(job, MAR_31, alpha, food, south, "20.00", "4"));
        // outside the range
        salesFactRepository.save(fact(job, MAR_31.plusDays(1), beta, tool, north, "999.00", "1"));
        salesFactRepository.flush();

        // When
        Object[] all = salesFactRepository.summarize(MAR_1, MAR_31, null, null, null, null, null, null).get(0);
        Object[] northOnly = salesFactRepository.summarize(MAR_1, MAR_31, null, null, null, null, "North", null).get(0);
        Object[] northFood = salesFactRepository.summarize(MAR_1, MAR_31, null, null, null, null, "North", "Food").get(0);
        Object[] nothing = salesFactRepository.summarize(MAR_1, MAR_31, null, null, null, "A-9", null, null).get(0);

        // Then
        assertEquals(0, new BigDecimal("370.00").compareTo((BigDecimal) all[0]));
        assertEquals(3L, ((Number) all[1]).longValue());
        assertEquals(0, new BigDecimal("17").compareTo((BigDecimal) all[2]));
        assertEquals(2L, ((Number) all[3]).longValue());

        assertEquals(0, new BigDecimal("350.00").compareTo((BigDecimal) northOnly[0]));
        assertEquals(2L, ((Number) northOnly[1]).longValue());

        assertEquals(0, new BigDecimal("50.00").compareTo((BigDecimal) northFood[0]));
        assertEquals(1L, ((Number) northFood[3]).longValue());

        assertEquals(0, BigDecimal.ZERO.compareTo(new BigDecimal(nothing[0].toString())));
        assertEquals(0L, ((Number) nothing[1]).longValue());
    }

    @Test
    void testRankProducts_OrderedByRevenue() {
        // Given
        ImportJobEntity job = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        CustomerEntity alpha = customerRepository.saveAndFlush(customer("Alpha"));
        ProductEntity tool = productRepository.saveAndFlush(product("Hammer", "Tools"));
        ProductEntity food = productRepository.saveAndFlush(product("Bread", "Food"));
        salesFactRepository.save(fact(job, MAR_1, alpha, food, null, "40.00", "8"));
        salesFactRepository.save(fact(job, MAR_1, alpha, tool, null, "100.00", "1"));
        salesFactRepository.save(fact(job, MAR_31, alpha, food, null, "30.00", "6"));
        salesFactRepository.flush();

        // When
        List<Object[]> rows = salesFactRepository.rankProducts(
                MAR_1, MAR_31, null, null, null, null, null, null, PageRequest.of(0, 10));

        // Then
        assertEquals(2, rows.size());
        assertEquals(tool.getId(), rows.get(0)[0]);
        assertEquals("Hammer", rows.get(0)[1]);
        assertEquals(food.getId(), rows.get(1)[0]);
        assertEquals(0, new BigDecimal("70.00").compareTo((BigDecimal) rows.get(1)[2]));
        assertEquals(2L, ((Number) rows.get(1)[3]).longValue());
    }

    @Test
    void testTrendByMonth_GroupsCalendarColumns() {
        // Given
        ImportJobEntity job = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        CustomerEntity alpha = customerRepository.saveAndFlush(customer("Alpha"));
        salesFactRepository.save(fact(job, LocalDate.of(2024, 2, 28), alpha, null, null, "10.00", "1"));
        salesFactRepository.save(fact(job, MAR_1, alpha, null, null, "15.00", "1"));
        salesFactRepository.save(fact(job, MAR_31, alpha, null, null, "5.00", "1"));
        salesFactRepository.flush();

        // When
        List<Object[]> rows = salesFactRepository.trendByMonth(
                LocalDate.of(2024, 2, 1), MAR_31, null, null, null, null, null, null);

        // Then
        assertEquals(2, rows.size());
        assertEquals(2, ((Number) rows.get(0)[1]).intValue());
        assertEquals(3, ((Number) rows.get(1)[1]).intValue());
        assertEquals(0, new BigDecimal("20.00").compareTo((BigDecimal) rows.get(1)[2]));
    }

    @Test
    void testDeleteAllByImportJobId_OnlyThatJob() {
        // Given
        ImportJobEntity first = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        ImportJobEntity second = jobRepository.saveAndFlush(job(JobStatus.COMPLETED));
        CustomerEntity alpha = customerRepository.saveAndFlush(customer("Alpha"));
        salesFactRepository.save(fact(first, MAR_1, alpha, null, null, "10.00", "1"));
        salesFactRepository.save(fact(first, MAR_31, alpha, null, null, "10.00", "1"));
        salesFactRepository.save(fact(second, MAR_1, alpha, null, null, "10.00", "1"));
        salesFactRepository.flush();

        // When
        int deleted = salesFactRepository.deleteAllByImportJobId(first.getJobId());

        // Then
        assertEquals(2, deleted);
        assertEquals(0, salesFactRepository.countByImportJobId(first.getJobId()));
        assertEquals(1, salesFactRepository.countByImportJobId(second.getJobId()));
    }

    @Test
    void testDeleteJob_CascadesToFactsAndErrors() {
        // Given
        ImportJobEntity job = job(JobStatus.COMPLETED);
        job.getErrorLog().add("Row 2: amount must be positive: 0.00");
        jobRepository.saveAndFlush(job);
        CustomerEntity alpha = customerRepository.saveAndFlush(customer("Alpha"));
        salesFactRepository.saveAndFlush(fact(job, MAR_1, alpha, null, null, "10.00", "1"));
        entityManager.clear();

        // When: row removed directly, bypassing the element collection handling
        entityManager.getEntityManager()
                .createNativeQuery("DELETE FROM import_jobs WHERE job_id = :jobId")
                .setParameter("jobId", job.getJobId())
                .executeUpdate();

        // Then
        assertEquals(0, salesFactRepository.countByImportJobId(job.getJobId()));
        Number errors = (Number) entityManager.getEntityManager()
                .createNativeQuery("SELECT COUNT(*) FROM import_job_errors WHERE job_id = :jobId")
                .setParameter("jobId", job.getJobId())
                .getSingleResult();
        assertEquals(0L, errors.longValue());
    }

    @Test
    void testCountsCheck_RejectsMoreProcessedThanTotal() {
        // Given
        ImportJobEntity job = job(JobStatus.PROCESSING);
        job.setTotalRows(10);
        job.setImportedRows(8);
        job.setFailedRows(3);

        // When/Then
        assertThrows(DataIntegrityViolationException.class, () -> jobRepository.saveAndFlush(job));
    }

    @Test
    void testNormalizedName_Unique() {
        // Given
        customerRepository.saveAndFlush(customer("Alpha"));

        // When/Then
        assertThrows(DataIntegrityViolationException.class,
                () -> customerRepository.saveAndFlush(customer("Alpha")));
    }

    // Helper methods

    private ImportJobEntity job(JobStatus status) {
        return ImportJobEntity.builder()
                .filename("sales.csv")
                .fileSize(1024)
                .status(status)
                .build();
    }

    private CustomerEntity customer(String name) {
        return CustomerEntity.builder()
                .name(name)
                .normalizedName(name.toLowerCase())
                .build();
    }

    private ProductEntity product(String name, String category) {
        return ProductEntity.builder()
                .name(name)
                .normalizedName(name.toLowerCase())
                .category(category)
                .build();
    }

    private StoreEntity store(String code, String region) {
        return StoreEntity.builder()
                .name("Store " + code)
                .normalizedName(code.toLowerCase())
                .code(code)
                .region(region)
                .build();
    }

    private SalesFactEntity fact(ImportJobEntity job, LocalDate date, CustomerEntity customer,
                                 ProductEntity product, StoreEntity store, String amount, String quantity) {
        return SalesFactEntity.builder()
                .saleDate(date)
                .customerId(customer != null ? customer.getId() : null)
                .productId(product != null ? product.getId() : null)
                .storeId(store != null ? store.getId() : null)
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(amount))
                .totalAmount(new BigDecimal(amount))
                .importJobId(job.getJobId())
                .build();
    }
}
