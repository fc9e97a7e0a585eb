package com.rebalancer.ledger;

import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.TradeRecord;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage for everything the engine must remember between runs: ownership, trade
 * records, external sales, leaderboard snapshots and execution history.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@link JpaLedgerStore} -- Spring Data JPA, H2 by default</li>
 *   <li>{@link InMemoryLedgerStore} -- process memory, single portfolio only</li>
 * </ul>
 *
 * <p>The active implementation is selected by {@code rebalancer.persistence.mode}.
 * Any failure to reach the backing store surfaces as
 * {@link com.rebalancer.exception.SourceUnavailableException}.
 */
public interface LedgerStore {

    /**
     * Runs {@code work} as one all-or-nothing unit. If it throws, none of the writes it made
     * are visible afterwards.
     */
    <T> T inTransaction(Supplier<T> work);

    // ---- Ownership ----

    Optional<OwnershipRecord> findOwnership(String portfolioName, String symbol);

    List<OwnershipRecord> findOwnershipByPortfolio(String portfolioName);

    List<OwnershipRecord> findAllOwnership();

    void saveOwnership(OwnershipRecord record);

    void deleteOwnership(String portfolioName, String symbol);

    // ---- Trade records ----

    void saveTrade(TradeRecord trade);

    List<TradeRecord> findTradesSince(LocalDateTime since);

    List<TradeRecord> findTradesByPortfolio(String portfolioName);

    boolean hasTrades(String portfolioName);

    // ---- External sales ----

    void saveExternalSale(ExternalSaleRecord sale);

    List<ExternalSaleRecord> findUnconsumedExternalSales(String portfolioName);

    List<ExternalSaleRecord> findExternalSalesByPortfolio(String portfolioName);

    /**
     * Marks the given external sales as used for reinvestment.
     *
     * @return how many records changed state (already-used ids are ignored)
     */
    int markExternalSalesUsed(Collection<String> saleIds, LocalDateTime reinvestedAt);

    // ---- Leaderboard snapshots ----

    Optional<LeaderboardSnapshot> findLatestSnapshot(String portfolioName);

    void saveSnapshot(LeaderboardSnapshot snapshot);

    // ---- Execution history ----

    void saveExecutionRun(ExecutionRun run);

    List<ExecutionRun> findExecutionRunsByPortfolio(String portfolioName);
}
