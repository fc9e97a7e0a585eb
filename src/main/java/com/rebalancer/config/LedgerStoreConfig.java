package com.rebalancer.config;

import com.rebalancer.domain.enums.PersistenceMode;
import com.rebalancer.ledger.InMemoryLedgerStore;
import com.rebalancer.ledger.JpaLedgerStore;
import com.rebalancer.ledger.LedgerStore;
import com.rebalancer.mapper.ExecutionRunMapper;
import com.rebalancer.mapper.ExternalSaleMapper;
import com.rebalancer.mapper.LeaderboardSnapshotMapper;
import com.rebalancer.mapper.OwnershipMapper;
import com.rebalancer.mapper.TradeRecordMapper;
import com.rebalancer.repository.jpa.ExecutionRunJpaRepository;
import com.rebalancer.repository.jpa.ExternalSaleJpaRepository;
import com.rebalancer.repository.jpa.LeaderboardSnapshotJpaRepository;
import com.rebalancer.repository.jpa.OwnershipJpaRepository;
import com.rebalancer.repository.jpa.TradeRecordJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the {@link LedgerStore} implementation from {@code rebalancer.persistence.mode}.
 */
@Configuration
public class LedgerStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerStoreConfig.class);

    @Bean
    public LedgerStore ledgerStore(
            RebalancerProperties rebalancerProperties,
            OwnershipJpaRepository ownershipJpaRepository,
            TradeRecordJpaRepository tradeRecordJpaRepository,
            ExternalSaleJpaRepository externalSaleJpaRepository,
            LeaderboardSnapshotJpaRepository leaderboardSnapshotJpaRepository,
            ExecutionRunJpaRepository executionRunJpaRepository,
            OwnershipMapper ownershipMapper,
            TradeRecordMapper tradeRecordMapper,
            ExternalSaleMapper externalSaleMapper,
            LeaderboardSnapshotMapper leaderboardSnapshotMapper,
            ExecutionRunMapper executionRunMapper,
            TransactionTemplate transactionTemplate) {
        PersistenceMode mode = rebalancerProperties.getPersistence().getMode();
        log.info("Ledger persistence mode: {}", mode);
        if (mode == PersistenceMode.NONE) {
            return new InMemoryLedgerStore();
        }
        return new JpaLedgerStore(
                ownershipJpaRepository,
                tradeRecordJpaRepository,
                externalSaleJpaRepository,
                leaderboardSnapshotJpaRepository,
                executionRunJpaRepository,
                ownershipMapper,
                tradeRecordMapper,
                externalSaleMapper,
                leaderboardSnapshotMapper,
                executionRunMapper,
                transactionTemplate);
    }
}
