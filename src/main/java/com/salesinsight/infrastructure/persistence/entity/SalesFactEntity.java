package com.salesinsight.infrastructure.persistence.entity;

import com.salesinsight.domain.model.SalesCalendar;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One sales line.
 *
 * Rows are written once by the fact writer and never updated: there are no
 * setters and the money columns are not updatable. Calendar columns are
 * derived from saleDate on insert.
 *
 * Indexing Strategy:
 * - saleDate for range scans (every analytics query is range bound)
 * - importJobId for cascade deletion
 * - customer/product for top-N grouping
 */
@Entity
@Table(name = "sales_facts", indexes = {
    @Index(name = "idx_sales_facts_date", columnList = "saleDate"),
    @Index(name = "idx_sales_facts_import_job", columnList = "importJobId"),
    @Index(name = "idx_sales_facts_customer_date", columnList = "customerId,saleDate"),
    @Index(name = "idx_sales_facts_product_date", columnList = "productId,saleDate")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SalesFactEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, updatable = false)
    private LocalDate saleDate;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID customerId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID productId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID storeId;

    @Column(length = 100, updatable = false)
    private String agentCode;

    @Column(nullable = false, precision = 15, scale = 3, updatable = false)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 15, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 15, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "sale_year", nullable = false, updatable = false)
    private int year;

    @Column(name = "sale_month", nullable = false, updatable = false)
    private int month;

    @Column(name = "sale_week", nullable = false, updatable = false)
    private int week;

    @Column(name = "week_year", nullable = false, updatable = false)
    private int weekYear;

    @Column(name = "day_of_week", nullable = false, updatable = false)
    private int dayOfWeek;

    @Column(columnDefinition = "UUID", nullable = false, updatable = false)
    private UUID importJobId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        applyCalendar();
    }

    /**
     * Recomputes the calendar columns from saleDate. Safe to call repeatedly.
     */
    public void applyCalendar() {
        this.year = SalesCalendar.year(saleDate);
        this.month = SalesCalendar.month(saleDate);
        this.week = SalesCalendar.isoWeek(saleDate);
        this.weekYear = SalesCalendar.isoWeekYear(saleDate);
        this.dayOfWeek = SalesCalendar.dayOfWeek(saleDate);
    }
}
