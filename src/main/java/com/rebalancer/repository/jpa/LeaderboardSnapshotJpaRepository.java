package com.rebalancer.repository.jpa;

import com.rebalancer.entity.LeaderboardSnapshotEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LeaderboardSnapshotJpaRepository extends JpaRepository<LeaderboardSnapshotEntity, Long> {

    Optional<LeaderboardSnapshotEntity> findFirstByPortfolioNameOrderByCapturedAtDescIdDesc(String portfolioName);
}
