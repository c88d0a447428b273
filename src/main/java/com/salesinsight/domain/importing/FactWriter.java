package com.salesinsight.domain.importing;

import com.salesinsight.infrastructure.persistence.entity.SalesFactEntity;
import com.salesinsight.infrastructure.persistence.repository.SalesFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Persists one sales fact per accepted row, tagged with its import job.
 */
@Component
@RequiredArgsConstructor
public class FactWriter {

    private final SalesFactRepository salesFactRepository;

    public SalesFactEntity write(SalesRowCandidate row, ResolvedEntities entities, UUID importJobId) {
        SalesFactEntity fact = SalesFactEntity.builder()
                .saleDate(row.getSaleDate())
                .customerId(entities.getCustomerId())
                .productId(entities.getProductId())
                .storeId(entities.getStoreId())
                .agentCode(row.getAgentCode())
                .quantity(row.getQuantity())
                .unitPrice(row.getUnitPrice())
                .totalAmount(row.getAmount())
                .importJobId(importJobId)
                .build();
        fact.applyCalendar();
        return salesFactRepository.save(fact);
    }
}
