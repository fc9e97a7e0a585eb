package com.rebalancer.repository.jpa;

import com.rebalancer.entity.ExecutionRunEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExecutionRunJpaRepository extends JpaRepository<ExecutionRunEntity, String> {

    List<ExecutionRunEntity> findByRunIdOrderByStartedAtAsc(String runId);

    List<ExecutionRunEntity> findTop20ByPortfolioNameOrderByStartedAtDesc(String portfolioName);
}
