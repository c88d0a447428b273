package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.CustomerEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface CustomerRepository extends MasterDataRepository<CustomerEntity> {
}
