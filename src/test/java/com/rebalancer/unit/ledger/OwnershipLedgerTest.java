package com.rebalancer.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.ReconciliationStatus;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.SourceUnavailableException;
import com.rebalancer.ledger.InMemoryLedgerStore;
import com.rebalancer.ledger.OwnershipLedger;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OwnershipLedgerTest {

    private static final String PORTFOLIO = "SP400";

    private InMemoryLedgerStore ledgerStore;
    private OwnershipLedger ownershipLedger;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        ownershipLedger = new OwnershipLedger(ledgerStore);
    }

    @Test
    @DisplayName("BUY on an empty ledger creates a record with scaled quantity and cost")
    void buyCreatesRecord() {
        Optional<OwnershipRecord> record =
                ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("10"), new BigDecimal("100"));

        assertThat(record).isPresent();
        assertThat(record.get().getQuantity()).isEqualByComparingTo("10.000000");
        assertThat(record.get().getQuantity().scale()).isEqualTo(6);
        assertThat(record.get().getTotalCost()).isEqualByComparingTo("1000.00");
        assertThat(record.get().getFirstPurchaseAt()).isNotNull();
        assertThat(ownershipLedger.ownedSymbols(PORTFOLIO)).containsExactly("TSLA");
    }

    @Test
    @DisplayName("Second BUY adds quantity and cost, average cost follows")
    void secondBuyAveragesCost() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("10"), new BigDecimal("100"));
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("10"), new BigDecimal("120"));

        OwnershipRecord record = ownershipLedger.get(PORTFOLIO, "TSLA").orElseThrow();
        assertThat(record.getQuantity()).isEqualByComparingTo("20");
        assertThat(record.getTotalCost()).isEqualByComparingTo("2200.00");
        assertThat(record.getAverageCost()).isEqualByComparingTo("110.00");
    }

    @Test
    @DisplayName("Partial SELL removes the sold fraction of the cost basis")
    void partialSellKeepsAverageCost() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("20"), new BigDecimal("110"));

        Optional<OwnershipRecord> record =
                ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.SELL, new BigDecimal("5"), new BigDecimal("150"));

        assertThat(record).isPresent();
        assertThat(record.get().getQuantity()).isEqualByComparingTo("15");
        assertThat(record.get().getTotalCost()).isEqualByComparingTo("1650.00");
        assertThat(record.get().getAverageCost()).isEqualByComparingTo("110.00");
    }

    @Test
    @DisplayName("Selling the whole holding deletes the record")
    void fullSellRemovesRecord() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("4"), new BigDecimal("100"));

        Optional<OwnershipRecord> record =
                ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.SELL, new BigDecimal("4"), new BigDecimal("150"));

        assertThat(record).isEmpty();
        assertThat(ownershipLedger.get(PORTFOLIO, "TSLA")).isEmpty();
    }

    @Test
    @DisplayName("A remainder at or below epsilon counts as sold out")
    void dustRemainderRemovesRecord() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("4.000001"), new BigDecimal("100"));

        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.SELL, new BigDecimal("4"), new BigDecimal("100"));

        assertThat(ownershipLedger.get(PORTFOLIO, "TSLA")).isEmpty();
    }

    @Test
    @DisplayName("SELL without a record leaves the ledger untouched")
    void sellWithoutRecordIsIgnored() {
        Optional<OwnershipRecord> record =
                ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.SELL, new BigDecimal("1"), new BigDecimal("100"));

        assertThat(record).isEmpty();
        assertThat(ownershipLedger.getAll()).isEmpty();
    }

    @Test
    @DisplayName("Portfolios keep separate records for the same symbol")
    void portfoliosAreIndependent() {
        ownershipLedger.apply("P1", "TSLA", OrderSide.BUY, new BigDecimal("6"), new BigDecimal("100"));
        ownershipLedger.apply("P2", "TSLA", OrderSide.BUY, new BigDecimal("4"), new BigDecimal("100"));

        ownershipLedger.apply("P1", "TSLA", OrderSide.SELL, new BigDecimal("6"), new BigDecimal("100"));

        assertThat(ownershipLedger.get("P1", "TSLA")).isEmpty();
        assertThat(ownershipLedger.get("P2", "TSLA").orElseThrow().getQuantity())
                .isEqualByComparingTo("4");
    }

    @Test
    @DisplayName("shrinkTo scales the cost basis and never grows a holding")
    void shrinkToScalesCost() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("6"), new BigDecimal("100"));

        ownershipLedger.shrinkTo(PORTFOLIO, "TSLA", new BigDecimal("4"));
        OwnershipRecord shrunk = ownershipLedger.get(PORTFOLIO, "TSLA").orElseThrow();
        assertThat(shrunk.getQuantity()).isEqualByComparingTo("4");
        assertThat(shrunk.getTotalCost()).isEqualByComparingTo("400.00");

        ownershipLedger.shrinkTo(PORTFOLIO, "TSLA", new BigDecimal("9"));
        assertThat(ownershipLedger.get(PORTFOLIO, "TSLA").orElseThrow().getQuantity())
                .isEqualByComparingTo("4");

        ownershipLedger.shrinkTo(PORTFOLIO, "TSLA", BigDecimal.ZERO);
        assertThat(ownershipLedger.get(PORTFOLIO, "TSLA")).isEmpty();
    }

    @Test
    @DisplayName("recordTrade stores the trade, applies it and consumes external sales")
    void recordTradeAppliesAndConsumes() {
        ledgerStore.saveExternalSale(externalSale("ext-1"));

        ownershipLedger.recordTrade(buyTrade("t-1"), List.of("ext-1"));

        assertThat(ledgerStore.findTradesByPortfolio(PORTFOLIO)).hasSize(1);
        assertThat(ownershipLedger.get(PORTFOLIO, "NVDA").orElseThrow().getQuantity())
                .isEqualByComparingTo("3");
        assertThat(ownershipLedger.findUnconsumedExternalSales(PORTFOLIO)).isEmpty();
        assertThat(ownershipLedger.hasTraded(PORTFOLIO)).isTrue();
    }

    @Test
    @DisplayName("recordTrade is all-or-nothing when the store fails mid-way")
    void recordTradeRollsBack() {
        InMemoryLedgerStore failingStore = new InMemoryLedgerStore() {
            @Override
            public synchronized int markExternalSalesUsed(Collection<String> saleIds, LocalDateTime reinvestedAt) {
                throw new SourceUnavailableException("store down");
            }
        };
        failingStore.saveExternalSale(externalSale("ext-1"));
        OwnershipLedger ledger = new OwnershipLedger(failingStore);

        assertThatThrownBy(() -> ledger.recordTrade(buyTrade("t-1"), List.of("ext-1")))
                .isInstanceOf(SourceUnavailableException.class);

        assertThat(failingStore.findTradesByPortfolio(PORTFOLIO)).isEmpty();
        assertThat(ledger.get(PORTFOLIO, "NVDA")).isEmpty();
        assertThat(ledger.findUnconsumedExternalSales(PORTFOLIO)).hasSize(1);
    }

    @Test
    @DisplayName("recordExternalSale saves the sale and shrinks the holding to the broker share")
    void recordExternalSaleShrinks() {
        ownershipLedger.apply(PORTFOLIO, "TSLA", OrderSide.BUY, new BigDecimal("6"), new BigDecimal("100"));
        ExternalSaleRecord sale = externalSale("ext-2").toBuilder()
                .symbol("TSLA")
                .quantity(new BigDecimal("2"))
                .build();

        ownershipLedger.recordExternalSale(sale, new BigDecimal("4"));

        assertThat(ownershipLedger.get(PORTFOLIO, "TSLA").orElseThrow().getQuantity())
                .isEqualByComparingTo("4");
        assertThat(ownershipLedger.findUnconsumedExternalSales(PORTFOLIO))
                .extracting(ExternalSaleRecord::getId)
                .containsExactly("ext-2");
    }

    private static TradeRecord buyTrade(String id) {
        return TradeRecord.builder()
                .id(id)
                .portfolioName(PORTFOLIO)
                .symbol("NVDA")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal("3"))
                .price(new BigDecimal("100"))
                .total(new BigDecimal("300.00"))
                .submittedAt(LocalDateTime.now())
                .brokerTradeId("PAPER-1")
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .build();
    }

    private static ExternalSaleRecord externalSale(String id) {
        return ExternalSaleRecord.builder()
                .id(id)
                .portfolioName(PORTFOLIO)
                .symbol("AMD")
                .quantity(new BigDecimal("2"))
                .estimatedProceeds(new BigDecimal("300.00"))
                .detectedAt(LocalDateTime.now())
                .build();
    }
}
