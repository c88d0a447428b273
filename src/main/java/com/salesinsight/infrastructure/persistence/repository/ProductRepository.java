package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.ProductEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface ProductRepository extends MasterDataRepository<ProductEntity> {
}
