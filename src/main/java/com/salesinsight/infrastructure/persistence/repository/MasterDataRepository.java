package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.MasterDataEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup and aggregate maintenance shared by customers, products and stores.
 */
@NoRepositoryBean
public interface MasterDataRepository<T extends MasterDataEntity> extends JpaRepository<T, UUID> {

    Optional<T> findByNormalizedName(String normalizedName);

    /**
     * Adds one fact's contribution to the running aggregates in a single
     * UPDATE, so two imports touching the same row cannot lose an increment.
     */
    @Modifying
    @Query("UPDATE #{#entityName} e SET " +
           "e.totalAmount = e.totalAmount + :amount, " +
           "e.activityCount = e.activityCount + 1, " +
           "e.lastActivityDate = CASE WHEN e.lastActivityDate IS NULL OR e.lastActivityDate < :activityDate " +
           "THEN :activityDate ELSE e.lastActivityDate END " +
           "WHERE e.id = :id")
    int incrementAggregates(
            @Param("id") UUID id,
            @Param("amount") BigDecimal amount,
            @Param("activityDate") LocalDate activityDate
    );

    /**
     * Back to "no activity" for every row, after all facts are gone.
     */
    @Modifying
    @Query("UPDATE #{#entityName} e SET e.totalAmount = 0, e.activityCount = 0, e.lastActivityDate = NULL")
    int resetAggregates();
}
