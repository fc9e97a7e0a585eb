package com.rebalancer.repository.jpa;

import com.rebalancer.entity.TradeRecordEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_records table.
 * Supports the lookback window used by trade-history reconciliation.
 */
@Repository
public interface TradeRecordJpaRepository extends JpaRepository<TradeRecordEntity, String> {

    @Query("SELECT t FROM TradeRecordEntity t WHERE t.submittedAt >= :since ORDER BY t.submittedAt ASC")
    List<TradeRecordEntity> findSubmittedSince(@Param("since") LocalDateTime since);

    List<TradeRecordEntity> findByPortfolioNameOrderBySubmittedAtDesc(String portfolioName);

    boolean existsByPortfolioName(String portfolioName);
}
