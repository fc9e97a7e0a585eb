package com.rebalancer.ledger;

import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.SourceUnavailableException;
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
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link LedgerStore} backed by Spring Data JPA repositories.
 *
 * <p>Domain objects are converted with MapStruct mappers at this boundary only; nothing
 * outside this class sees an entity. Units of work run in a {@link TransactionTemplate}
 * so a failure anywhere inside rolls back every write of that unit.
 */
public class JpaLedgerStore implements LedgerStore {

    private final OwnershipJpaRepository ownershipJpaRepository;
    private final TradeRecordJpaRepository tradeRecordJpaRepository;
    private final ExternalSaleJpaRepository externalSaleJpaRepository;
    private final LeaderboardSnapshotJpaRepository leaderboardSnapshotJpaRepository;
    private final ExecutionRunJpaRepository executionRunJpaRepository;
    private final OwnershipMapper ownershipMapper;
    private final TradeRecordMapper tradeRecordMapper;
    private final ExternalSaleMapper externalSaleMapper;
    private final LeaderboardSnapshotMapper leaderboardSnapshotMapper;
    private final ExecutionRunMapper executionRunMapper;
    private final TransactionTemplate transactionTemplate;

    public JpaLedgerStore(
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
        this.ownershipJpaRepository = ownershipJpaRepository;
        this.tradeRecordJpaRepository = tradeRecordJpaRepository;
        this.externalSaleJpaRepository = externalSaleJpaRepository;
        this.leaderboardSnapshotJpaRepository = leaderboardSnapshotJpaRepository;
        this.executionRunJpaRepository = executionRunJpaRepository;
        this.ownershipMapper = ownershipMapper;
        this.tradeRecordMapper = tradeRecordMapper;
        this.externalSaleMapper = externalSaleMapper;
        this.leaderboardSnapshotMapper = leaderboardSnapshotMapper;
        this.executionRunMapper = executionRunMapper;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return access("transaction", () -> transactionTemplate.execute(status -> work.get()));
    }

    @Override
    public Optional<OwnershipRecord> findOwnership(String portfolioName, String symbol) {
        return access("findOwnership", () -> ownershipJpaRepository
                .findById(ownershipMapper.ownershipId(portfolioName, symbol))
                .map(ownershipMapper::toDomain));
    }

    @Override
    public List<OwnershipRecord> findOwnershipByPortfolio(String portfolioName) {
        return access(
                "findOwnershipByPortfolio",
                () -> ownershipMapper.toDomainList(
                        ownershipJpaRepository.findByPortfolioNameOrderBySymbolAsc(portfolioName)));
    }

    @Override
    public List<OwnershipRecord> findAllOwnership() {
        return access("findAllOwnership", () -> ownershipMapper.toDomainList(ownershipJpaRepository.findAll()));
    }

    @Override
    public void saveOwnership(OwnershipRecord record) {
        access("saveOwnership", () -> ownershipJpaRepository.save(ownershipMapper.toEntity(record)));
    }

    @Override
    public void deleteOwnership(String portfolioName, String symbol) {
        access("deleteOwnership", () -> {
            ownershipJpaRepository.deleteById(ownershipMapper.ownershipId(portfolioName, symbol));
            return null;
        });
    }

    @Override
    public void saveTrade(TradeRecord trade) {
        access("saveTrade", () -> tradeRecordJpaRepository.save(tradeRecordMapper.toEntity(trade)));
    }

    @Override
    public List<TradeRecord> findTradesSince(LocalDateTime since) {
        return access(
                "findTradesSince",
                () -> tradeRecordMapper.toDomainList(tradeRecordJpaRepository.findSubmittedSince(since)));
    }

    @Override
    public List<TradeRecord> findTradesByPortfolio(String portfolioName) {
        return access(
                "findTradesByPortfolio",
                () -> tradeRecordMapper.toDomainList(
                        tradeRecordJpaRepository.findByPortfolioNameOrderBySubmittedAtDesc(portfolioName)));
    }

    @Override
    public boolean hasTrades(String portfolioName) {
        return access("hasTrades", () -> tradeRecordJpaRepository.existsByPortfolioName(portfolioName));
    }

    @Override
    public void saveExternalSale(ExternalSaleRecord sale) {
        access("saveExternalSale", () -> externalSaleJpaRepository.save(externalSaleMapper.toEntity(sale)));
    }

    @Override
    public List<ExternalSaleRecord> findUnconsumedExternalSales(String portfolioName) {
        return access(
                "findUnconsumedExternalSales",
                () -> externalSaleMapper.toDomainList(externalSaleJpaRepository
                        .findByPortfolioNameAndUsedForReinvestmentFalseOrderByDetectedAtAsc(portfolioName)));
    }

    @Override
    public List<ExternalSaleRecord> findExternalSalesByPortfolio(String portfolioName) {
        return access(
                "findExternalSalesByPortfolio",
                () -> externalSaleMapper.toDomainList(
                        externalSaleJpaRepository.findByPortfolioNameOrderByDetectedAtDesc(portfolioName)));
    }

    @Override
    public int markExternalSalesUsed(Collection<String> saleIds, LocalDateTime reinvestedAt) {
        if (saleIds.isEmpty()) {
            return 0;
        }
        return access("markExternalSalesUsed", () -> externalSaleJpaRepository.markUsed(saleIds, reinvestedAt));
    }

    @Override
    public Optional<LeaderboardSnapshot> findLatestSnapshot(String portfolioName) {
        return access("findLatestSnapshot", () -> leaderboardSnapshotJpaRepository
                .findFirstByPortfolioNameOrderByCapturedAtDescIdDesc(portfolioName)
                .map(leaderboardSnapshotMapper::toDomain));
    }

    @Override
    public void saveSnapshot(LeaderboardSnapshot snapshot) {
        access(
                "saveSnapshot",
                () -> leaderboardSnapshotJpaRepository.save(leaderboardSnapshotMapper.toEntity(snapshot)));
    }

    @Override
    public void saveExecutionRun(ExecutionRun run) {
        access("saveExecutionRun", () -> executionRunJpaRepository.save(executionRunMapper.toEntity(run)));
    }

    @Override
    public List<ExecutionRun> findExecutionRunsByPortfolio(String portfolioName) {
        return access(
                "findExecutionRunsByPortfolio",
                () -> executionRunMapper.toDomainList(
                        executionRunJpaRepository.findTop20ByPortfolioNameOrderByStartedAtDesc(portfolioName)));
    }

    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new SourceUnavailableException("Ledger store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
