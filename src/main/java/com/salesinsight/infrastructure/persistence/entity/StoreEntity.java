package com.salesinsight.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Point of sale. Keyed by the normalized store code when the file carries
 * one, by the normalized store name otherwise.
 */
@Entity
@Table(name = "stores", indexes = {
    @Index(name = "idx_stores_region", columnList = "region")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class StoreEntity extends MasterDataEntity {

    @Column(length = 100)
    private String code;

    @Column(length = 100)
    private String region;

    @Column(length = 100)
    private String channel;
}
