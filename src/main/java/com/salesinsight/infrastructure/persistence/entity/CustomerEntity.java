package com.salesinsight.infrastructure.persistence.entity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Customer master data. Aggregate columns keep the names external reports
 * already read (total_purchases, purchases_count, last_purchase_date).
 */
@Entity
@Table(name = "customers", indexes = {
    @Index(name = "idx_customers_region", columnList = "region")
})
@AttributeOverrides({
    @AttributeOverride(name = "totalAmount", column = @Column(name = "total_purchases", nullable = false, precision = 15, scale = 2)),
    @AttributeOverride(name = "activityCount", column = @Column(name = "purchases_count", nullable = false)),
    @AttributeOverride(name = "lastActivityDate", column = @Column(name = "last_purchase_date"))
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CustomerEntity extends MasterDataEntity {

    @Column(length = 100)
    private String region;

    @Column(length = 255)
    private String email;

    @Column(length = 50)
    private String phone;
}
