package com.rebalancer.ledger;

import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authoritative record of what each portfolio bought through the engine.
 *
 * <p>Cost basis follows the average-cost method: a buy adds {@code quantity * price} to the
 * total cost, a sale of fraction {@code f} of the holding removes {@code f} of the total
 * cost. A record whose quantity drops to {@link #EPSILON} or below is deleted.
 *
 * <p>The ledger only ever shrinks in response to broker truth (external sales); it never
 * grows because the broker holds more than it knows about.
 */
@Service
public class OwnershipLedger {

    private static final Logger log = LoggerFactory.getLogger(OwnershipLedger.class);

    /** Smallest quantity still considered a holding. */
    public static final BigDecimal EPSILON = new BigDecimal("0.000001");

    public static final int QUANTITY_SCALE = 6;
    public static final int MONEY_SCALE = 2;

    private final LedgerStore ledgerStore;

    public OwnershipLedger(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    public Optional<OwnershipRecord> get(String portfolioName, String symbol) {
        return ledgerStore.findOwnership(portfolioName, symbol);
    }

    public List<OwnershipRecord> getPortfolioLedger(String portfolioName) {
        return ledgerStore.findOwnershipByPortfolio(portfolioName);
    }

    /** Cross-portfolio snapshot of every ownership record. */
    public List<OwnershipRecord> getAll() {
        return ledgerStore.findAllOwnership();
    }

    public Set<String> ownedSymbols(String portfolioName) {
        Set<String> symbols = new LinkedHashSet<>();
        for (OwnershipRecord record : ledgerStore.findOwnershipByPortfolio(portfolioName)) {
            symbols.add(record.getSymbol());
        }
        return symbols;
    }

    public boolean hasTraded(String portfolioName) {
        return ledgerStore.hasTrades(portfolioName);
    }

    public List<ExternalSaleRecord> findUnconsumedExternalSales(String portfolioName) {
        return ledgerStore.findUnconsumedExternalSales(portfolioName);
    }

    /**
     * Applies a buy or sell to the ledger.
     *
     * @return the record after the mutation, or empty if the holding was removed
     */
    public Optional<OwnershipRecord> apply(
            String portfolioName, String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        LocalDateTime now = LocalDateTime.now();
        Optional<OwnershipRecord> existing = ledgerStore.findOwnership(portfolioName, symbol);

        if (side == OrderSide.BUY) {
            BigDecimal cost = quantity.multiply(price);
            OwnershipRecord record = existing.map(r -> r.toBuilder()
                            .quantity(scaleQuantity(r.getQuantity().add(quantity)))
                            .totalCost(scaleMoney(r.getTotalCost().add(cost)))
                            .lastPurchaseAt(now)
                            .lastUpdated(now)
                            .build())
                    .orElseGet(() -> OwnershipRecord.builder()
                            .portfolioName(portfolioName)
                            .symbol(symbol)
                            .quantity(scaleQuantity(quantity))
                            .totalCost(scaleMoney(cost))
                            .firstPurchaseAt(now)
                            .lastPurchaseAt(now)
                            .lastUpdated(now)
                            .build());
            ledgerStore.saveOwnership(record);
            log.debug(
                    "[{}] ledger BUY {} {} @ {} -> qty={}",
                    portfolioName,
                    quantity,
                    symbol,
                    price,
                    record.getQuantity());
            return Optional.of(record);
        }

        if (existing.isEmpty()) {
            log.warn("[{}] SELL of {} {} ignored by ledger: no ownership record", portfolioName, quantity, symbol);
            return Optional.empty();
        }

        OwnershipRecord record = existing.get();
        BigDecimal fraction = quantity.divide(record.getQuantity(), 10, RoundingMode.HALF_UP).min(BigDecimal.ONE);
        BigDecimal remaining = record.getQuantity().subtract(quantity);
        if (remaining.compareTo(EPSILON) <= 0) {
            ledgerStore.deleteOwnership(portfolioName, symbol);
            log.debug("[{}] ledger SELL {} {} removed holding", portfolioName, quantity, symbol);
            return Optional.empty();
        }

        BigDecimal costSold = record.getTotalCost().multiply(fraction);
        OwnershipRecord updated = record.toBuilder()
                .quantity(scaleQuantity(remaining))
                .totalCost(scaleMoney(record.getTotalCost().subtract(costSold)))
                .lastUpdated(now)
                .build();
        ledgerStore.saveOwnership(updated);
        log.debug("[{}] ledger SELL {} {} -> qty={}", portfolioName, quantity, symbol, updated.getQuantity());
        return Optional.of(updated);
    }

    public void remove(String portfolioName, String symbol) {
        ledgerStore.deleteOwnership(portfolioName, symbol);
    }

    /**
     * Shrinks a holding to {@code targetQuantity}, scaling the cost basis by the same ratio.
     * A target at or below {@link #EPSILON} removes the record. A target at or above the
     * current quantity leaves the record alone.
     */
    public void shrinkTo(String portfolioName, String symbol, BigDecimal targetQuantity) {
        Optional<OwnershipRecord> existing = ledgerStore.findOwnership(portfolioName, symbol);
        if (existing.isEmpty()) {
            return;
        }
        OwnershipRecord record = existing.get();
        if (targetQuantity.compareTo(record.getQuantity()) >= 0) {
            return;
        }
        if (targetQuantity.compareTo(EPSILON) <= 0) {
            ledgerStore.deleteOwnership(portfolioName, symbol);
            return;
        }
        BigDecimal ratio = targetQuantity.divide(record.getQuantity(), 10, RoundingMode.HALF_UP);
        ledgerStore.saveOwnership(record.toBuilder()
                .quantity(scaleQuantity(targetQuantity))
                .totalCost(scaleMoney(record.getTotalCost().multiply(ratio)))
                .lastUpdated(LocalDateTime.now())
                .build());
    }

    /**
     * Records an accepted order: stores the trade record, applies the ledger mutation and
     * marks the given external sales as reinvested, all in one unit of work.
     */
    public TradeRecord recordTrade(TradeRecord trade, Collection<String> externalSaleIdsToConsume) {
        return ledgerStore.inTransaction(() -> {
            ledgerStore.saveTrade(trade);
            apply(trade.getPortfolioName(), trade.getSymbol(), trade.getSide(), trade.getQuantity(), trade.getPrice());
            if (!externalSaleIdsToConsume.isEmpty()) {
                int marked = ledgerStore.markExternalSalesUsed(externalSaleIdsToConsume, trade.getSubmittedAt());
                log.info("[{}] {} external sale(s) marked as reinvested", trade.getPortfolioName(), marked);
            }
            return trade;
        });
    }

    /**
     * Records a detected external sale and shrinks the holding to what the broker still
     * backs, in one unit of work.
     */
    public ExternalSaleRecord recordExternalSale(ExternalSaleRecord sale, BigDecimal remainingQuantity) {
        return ledgerStore.inTransaction(() -> {
            ledgerStore.saveExternalSale(sale);
            shrinkTo(sale.getPortfolioName(), sale.getSymbol(), remainingQuantity);
            return sale;
        });
    }

    public static BigDecimal scaleQuantity(BigDecimal quantity) {
        return quantity.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal scaleMoney(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
