package com.rebalancer.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.ledger.InMemoryLedgerStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryLedgerStoreTest {

    private InMemoryLedgerStore ledgerStore;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
    }

    @Test
    @DisplayName("A failed unit of work leaves no trace")
    void transactionRollsBack() {
        ledgerStore.saveOwnership(ownership("TSLA", "5"));

        assertThatThrownBy(() -> ledgerStore.inTransaction(() -> {
                    ledgerStore.saveOwnership(ownership("NVDA", "3"));
                    ledgerStore.deleteOwnership("SP400", "TSLA");
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(ledgerStore.findAllOwnership())
                .extracting(OwnershipRecord::getSymbol)
                .containsExactly("TSLA");
    }

    @Test
    @DisplayName("Records handed out are copies")
    void returnsCopies() {
        ledgerStore.saveOwnership(ownership("TSLA", "5"));

        OwnershipRecord copy = ledgerStore.findOwnership("SP400", "TSLA").orElseThrow();
        copy.setQuantity(new BigDecimal("99"));

        assertThat(ledgerStore.findOwnership("SP400", "TSLA").orElseThrow().getQuantity())
                .isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("markExternalSalesUsed only counts sales that change state")
    void markUsedIgnoresConsumed() {
        ledgerStore.saveExternalSale(sale("a", LocalDateTime.of(2026, 3, 2, 9, 0)));
        ledgerStore.saveExternalSale(sale("b", LocalDateTime.of(2026, 3, 1, 9, 0)));

        assertThat(ledgerStore.findUnconsumedExternalSales("SP400"))
                .extracting(ExternalSaleRecord::getId)
                .containsExactly("b", "a");

        LocalDateTime now = LocalDateTime.of(2026, 3, 2, 10, 0);
        assertThat(ledgerStore.markExternalSalesUsed(List.of("a"), now)).isEqualTo(1);
        assertThat(ledgerStore.markExternalSalesUsed(List.of("a", "b", "missing"), now)).isEqualTo(1);

        assertThat(ledgerStore.findUnconsumedExternalSales("SP400")).isEmpty();
        assertThat(ledgerStore.findExternalSalesByPortfolio("SP400"))
                .allSatisfy(s -> assertThat(s.getReinvestedAt()).isEqualTo(now));
    }

    @Test
    @DisplayName("findLatestSnapshot returns the most recently saved list")
    void latestSnapshot() {
        assertThat(ledgerStore.findLatestSnapshot("SP400")).isEmpty();

        ledgerStore.saveSnapshot(snapshot(List.of("A", "B")));
        ledgerStore.saveSnapshot(snapshot(List.of("C", "D")));

        assertThat(ledgerStore.findLatestSnapshot("SP400").orElseThrow().getSymbols()).containsExactly("C", "D");
        assertThat(ledgerStore.findLatestSnapshot("OTHER")).isEmpty();
    }

    private static OwnershipRecord ownership(String symbol, String quantity) {
        return OwnershipRecord.builder()
                .portfolioName("SP400")
                .symbol(symbol)
                .quantity(new BigDecimal(quantity))
                .totalCost(new BigDecimal("100.00"))
                .build();
    }

    private static ExternalSaleRecord sale(String id, LocalDateTime detectedAt) {
        return ExternalSaleRecord.builder()
                .id(id)
                .portfolioName("SP400")
                .symbol("TSLA")
                .quantity(BigDecimal.ONE)
                .estimatedProceeds(new BigDecimal("100.00"))
                .detectedAt(detectedAt)
                .build();
    }

    private static LeaderboardSnapshot snapshot(List<String> symbols) {
        return LeaderboardSnapshot.builder()
                .portfolioName("SP400")
                .indexId("13")
                .symbols(symbols)
                .capturedAt(LocalDateTime.now())
                .build();
    }
}
