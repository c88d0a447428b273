package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.PlanTargetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface PlanTargetRepository extends JpaRepository<PlanTargetEntity, UUID> {

    List<PlanTargetEntity> findByPeriodStartBetweenOrderByPeriodStartAsc(LocalDate from, LocalDate to);
}
