package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.StoreEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface StoreRepository extends MasterDataRepository<StoreEntity> {
}
