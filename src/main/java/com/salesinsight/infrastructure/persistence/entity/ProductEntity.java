package com.salesinsight.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_products_category", columnList = "category")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ProductEntity extends MasterDataEntity {

    public static final String DEFAULT_CATEGORY = "Uncategorized";

    @Column(length = 255)
    private String category;

    @Column(length = 100)
    private String sku;

    @Column(precision = 15, scale = 2)
    private BigDecimal listPrice;
}
