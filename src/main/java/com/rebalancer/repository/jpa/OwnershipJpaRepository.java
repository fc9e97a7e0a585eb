package com.rebalancer.repository.jpa;

import com.rebalancer.entity.OwnershipEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the ownership table. */
@Repository
public interface OwnershipJpaRepository extends JpaRepository<OwnershipEntity, String> {

    List<OwnershipEntity> findByPortfolioNameOrderBySymbolAsc(String portfolioName);

    List<OwnershipEntity> findBySymbol(String symbol);
}
