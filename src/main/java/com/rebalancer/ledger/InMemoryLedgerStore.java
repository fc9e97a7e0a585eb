package com.rebalancer.ledger;

import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.TradeRecord;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LedgerStore} kept entirely in process memory. Used when
 * {@code rebalancer.persistence.mode=NONE} and by tests.
 *
 * <p>All access is serialized on the store's monitor. A unit of work copies every map
 * before it starts and restores the copies if the work throws, which gives the same
 * all-or-nothing behaviour as a database transaction. Records are copied on the way in
 * and out so callers never share mutable state with the store.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerStore.class);

    private Map<String, OwnershipRecord> ownership = new LinkedHashMap<>();
    private Map<String, TradeRecord> trades = new LinkedHashMap<>();
    private Map<String, ExternalSaleRecord> externalSales = new LinkedHashMap<>();
    private Map<String, List<LeaderboardSnapshot>> snapshots = new LinkedHashMap<>();
    private Map<String, ExecutionRun> executionRuns = new LinkedHashMap<>();

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        Map<String, OwnershipRecord> ownershipBefore = new LinkedHashMap<>(ownership);
        Map<String, TradeRecord> tradesBefore = new LinkedHashMap<>(trades);
        Map<String, ExternalSaleRecord> salesBefore = new LinkedHashMap<>(externalSales);
        Map<String, List<LeaderboardSnapshot>> snapshotsBefore = new LinkedHashMap<>(snapshots);
        Map<String, ExecutionRun> runsBefore = new LinkedHashMap<>(executionRuns);
        try {
            return work.get();
        } catch (RuntimeException e) {
            ownership = ownershipBefore;
            trades = tradesBefore;
            externalSales = salesBefore;
            snapshots = snapshotsBefore;
            executionRuns = runsBefore;
            log.debug("In-memory ledger transaction rolled back: {}", e.getMessage());
            throw e;
        }
    }

    // ---- Ownership ----

    @Override
    public synchronized Optional<OwnershipRecord> findOwnership(String portfolioName, String symbol) {
        return Optional.ofNullable(ownership.get(key(portfolioName, symbol))).map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized List<OwnershipRecord> findOwnershipByPortfolio(String portfolioName) {
        return ownership.values().stream()
                .filter(r -> r.getPortfolioName().equals(portfolioName))
                .sorted(Comparator.comparing(OwnershipRecord::getSymbol))
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized List<OwnershipRecord> findAllOwnership() {
        return ownership.values().stream().map(r -> r.toBuilder().build()).toList();
    }

    @Override
    public synchronized void saveOwnership(OwnershipRecord record) {
        ownership.put(key(record.getPortfolioName(), record.getSymbol()), record.toBuilder().build());
    }

    @Override
    public synchronized void deleteOwnership(String portfolioName, String symbol) {
        ownership.remove(key(portfolioName, symbol));
    }

    // ---- Trade records ----

    @Override
    public synchronized void saveTrade(TradeRecord trade) {
        trades.put(trade.getId(), trade.toBuilder().build());
    }

    @Override
    public synchronized List<TradeRecord> findTradesSince(LocalDateTime since) {
        return trades.values().stream()
                .filter(t -> !t.getSubmittedAt().isBefore(since))
                .sorted(Comparator.comparing(TradeRecord::getSubmittedAt))
                .map(t -> t.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized List<TradeRecord> findTradesByPortfolio(String portfolioName) {
        return trades.values().stream()
                .filter(t -> t.getPortfolioName().equals(portfolioName))
                .sorted(Comparator.comparing(TradeRecord::getSubmittedAt).reversed())
                .map(t -> t.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized boolean hasTrades(String portfolioName) {
        return trades.values().stream().anyMatch(t -> t.getPortfolioName().equals(portfolioName));
    }

    // ---- External sales ----

    @Override
    public synchronized void saveExternalSale(ExternalSaleRecord sale) {
        externalSales.put(sale.getId(), sale.toBuilder().build());
    }

    @Override
    public synchronized List<ExternalSaleRecord> findUnconsumedExternalSales(String portfolioName) {
        return externalSales.values().stream()
                .filter(s -> s.getPortfolioName().equals(portfolioName) && !s.isUsedForReinvestment())
                .sorted(Comparator.comparing(ExternalSaleRecord::getDetectedAt))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized List<ExternalSaleRecord> findExternalSalesByPortfolio(String portfolioName) {
        return externalSales.values().stream()
                .filter(s -> s.getPortfolioName().equals(portfolioName))
                .sorted(Comparator.comparing(ExternalSaleRecord::getDetectedAt).reversed())
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized int markExternalSalesUsed(Collection<String> saleIds, LocalDateTime reinvestedAt) {
        int changed = 0;
        for (String id : saleIds) {
            ExternalSaleRecord sale = externalSales.get(id);
            if (sale != null && !sale.isUsedForReinvestment()) {
                externalSales.put(
                        id,
                        sale.toBuilder()
                                .usedForReinvestment(true)
                                .reinvestedAt(reinvestedAt)
                                .build());
                changed++;
            }
        }
        return changed;
    }

    // ---- Leaderboard snapshots ----

    @Override
    public synchronized Optional<LeaderboardSnapshot> findLatestSnapshot(String portfolioName) {
        List<LeaderboardSnapshot> history = snapshots.getOrDefault(portfolioName, List.of());
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public synchronized void saveSnapshot(LeaderboardSnapshot snapshot) {
        LeaderboardSnapshot copy = LeaderboardSnapshot.builder()
                .portfolioName(snapshot.getPortfolioName())
                .indexId(snapshot.getIndexId())
                .symbols(List.copyOf(snapshot.getSymbols()))
                .capturedAt(snapshot.getCapturedAt())
                .build();
        List<LeaderboardSnapshot> history =
                new ArrayList<>(snapshots.getOrDefault(snapshot.getPortfolioName(), List.of()));
        history.add(copy);
        snapshots.put(snapshot.getPortfolioName(), history);
    }

    // ---- Execution history ----

    @Override
    public synchronized void saveExecutionRun(ExecutionRun run) {
        executionRuns.put(run.getId(), run.toBuilder().build());
    }

    @Override
    public synchronized List<ExecutionRun> findExecutionRunsByPortfolio(String portfolioName) {
        return executionRuns.values().stream()
                .filter(r -> r.getPortfolioName().equals(portfolioName))
                .sorted(Comparator.comparing(ExecutionRun::getStartedAt).reversed())
                .map(r -> r.toBuilder().build())
                .toList();
    }

    private static String key(String portfolioName, String symbol) {
        return portfolioName + "_" + symbol;
    }
}
