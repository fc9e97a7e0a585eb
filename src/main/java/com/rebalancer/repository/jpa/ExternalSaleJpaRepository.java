package com.rebalancer.repository.jpa;

import com.rebalancer.entity.ExternalSaleEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for the external_sales table. */
@Repository
public interface ExternalSaleJpaRepository extends JpaRepository<ExternalSaleEntity, String> {

    List<ExternalSaleEntity> findByPortfolioNameAndUsedForReinvestmentFalseOrderByDetectedAtAsc(String portfolioName);

    List<ExternalSaleEntity> findByPortfolioNameOrderByDetectedAtDesc(String portfolioName);

    @Modifying
    @Query("UPDATE ExternalSaleEntity e SET e.usedForReinvestment = true, e.reinvestedAt = :at "
            + "WHERE e.id IN :ids AND e.usedForReinvestment = false")
    int markUsed(@Param("ids") Collection<String> ids, @Param("at") LocalDateTime at);
}
