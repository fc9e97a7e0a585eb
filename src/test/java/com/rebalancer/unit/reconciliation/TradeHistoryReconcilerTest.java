package com.rebalancer.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.ReconciliationStatus;
import com.rebalancer.domain.model.BrokerTrade;
import com.rebalancer.domain.model.ReconciliationMismatch;
import com.rebalancer.domain.model.TradeReconciliationResult;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.SourceUnavailableException;
import com.rebalancer.ledger.InMemoryLedgerStore;
import com.rebalancer.reconciliation.TradeHistoryReconciler;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeHistoryReconcilerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Mock
    private BrokerGateway brokerGateway;

    private InMemoryLedgerStore ledgerStore;
    private TradeHistoryReconciler reconciler;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        reconciler = new TradeHistoryReconciler(
                brokerGateway,
                new TimedCallExecutor("Broker", Runnable::run, Duration.ofSeconds(1)),
                ledgerStore,
                new RebalancerProperties());
    }

    @Test
    @DisplayName("Matches by broker trade id and back-fills the actual fill")
    void matchesByIdAndCorrectsPrice() {
        ledgerStore.saveTrade(record("t-1", "PAPER-1", NOW.minusHours(2)));
        when(brokerGateway.getTradeHistory(any()))
                .thenReturn(List.of(brokerTrade("PAPER-1", "10", "101.50", NOW.minusHours(2))));

        TradeReconciliationResult result = reconciler.reconcile(NOW, false);

        assertThat(result.getMatched()).isEqualTo(1);
        assertThat(result.getUpdated()).isEqualTo(1);
        assertThat(result.getMismatches()).isEmpty();
        TradeRecord stored = ledgerStore.findTradesByPortfolio("SP400").get(0);
        assertThat(stored.getReconciliationStatus()).isEqualTo(ReconciliationStatus.MATCHED);
        assertThat(stored.getActualPrice()).isEqualByComparingTo("101.50");
        assertThat(stored.getPrice()).isEqualByComparingTo("100");
        assertThat(stored.getReconciledAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Falls back to symbol, side and time within the tolerance")
    void matchesByTimeWindow() {
        ledgerStore.saveTrade(record("t-1", null, NOW.minusMinutes(90)));
        when(brokerGateway.getTradeHistory(any()))
                .thenReturn(List.of(brokerTrade("B-77", "10", "100", NOW.minusMinutes(60))));

        TradeReconciliationResult result = reconciler.reconcile(NOW, false);

        assertThat(result.getMatched()).isEqualTo(1);
        assertThat(result.getUpdated()).isZero();
        TradeRecord stored = ledgerStore.findTradesByPortfolio("SP400").get(0);
        assertThat(stored.getBrokerTradeId()).isEqualTo("B-77");
        assertThat(stored.getReconciliationStatus()).isEqualTo(ReconciliationStatus.MATCHED);
    }

    @Test
    @DisplayName("A broker trade outside the tolerance is reported as missing")
    void reportsMissingRecord() {
        ledgerStore.saveTrade(record("t-1", null, NOW.minusHours(5)));
        when(brokerGateway.getTradeHistory(any()))
                .thenReturn(List.of(brokerTrade(null, "10", "100", NOW.minusHours(2))));

        TradeReconciliationResult result = reconciler.reconcile(NOW, false);

        assertThat(result.getMissing()).isEqualTo(1);
        assertThat(result.getMismatches())
                .extracting(ReconciliationMismatch::getType)
                .contains(MismatchType.MISSING_TRADE_RECORD);
    }

    @Test
    @DisplayName("Pending records older than the grace period become unfilled")
    void marksStaleRecordsUnfilled() {
        ledgerStore.saveTrade(record("old", null, NOW.minusHours(30)));
        ledgerStore.saveTrade(record("fresh", null, NOW.minusHours(3)));
        when(brokerGateway.getTradeHistory(any())).thenReturn(List.of());

        TradeReconciliationResult result = reconciler.reconcile(NOW, false);

        assertThat(result.getUnfilled()).isEqualTo(1);
        assertThat(ledgerStore.findTradesByPortfolio("SP400"))
                .filteredOn(t -> t.getId().equals("old"))
                .singleElement()
                .satisfies(t -> assertThat(t.getReconciliationStatus()).isEqualTo(ReconciliationStatus.UNFILLED));
        assertThat(ledgerStore.findTradesByPortfolio("SP400"))
                .filteredOn(t -> t.getId().equals("fresh"))
                .singleElement()
                .satisfies(t -> assertThat(t.getReconciliationStatus()).isEqualTo(ReconciliationStatus.PENDING));
    }

    @Test
    @DisplayName("Broker failure yields a result with the error set")
    void brokerFailureIsReported() {
        when(brokerGateway.getTradeHistory(any())).thenThrow(new SourceUnavailableException("timeout"));

        TradeReconciliationResult result = reconciler.reconcile(NOW, false);

        assertThat(result.getError()).contains("timeout");
        assertThat(result.getMismatches()).isEmpty();
    }

    @Test
    @DisplayName("Dry run reports without writing")
    void dryRunDoesNotSave() {
        ledgerStore.saveTrade(record("t-1", "PAPER-1", NOW.minusHours(30)));
        when(brokerGateway.getTradeHistory(any()))
                .thenReturn(List.of(brokerTrade("PAPER-1", "10", "105", NOW.minusHours(30))));

        TradeReconciliationResult result = reconciler.reconcile(NOW, true);

        assertThat(result.getUpdated()).isEqualTo(1);
        TradeRecord stored = ledgerStore.findTradesByPortfolio("SP400").get(0);
        assertThat(stored.getReconciliationStatus()).isEqualTo(ReconciliationStatus.PENDING);
        assertThat(stored.getActualPrice()).isNull();
    }

    private static TradeRecord record(String id, String brokerTradeId, LocalDateTime submittedAt) {
        return TradeRecord.builder()
                .id(id)
                .portfolioName("SP400")
                .symbol("TSLA")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal("10"))
                .price(new BigDecimal("100"))
                .total(new BigDecimal("1000.00"))
                .submittedAt(submittedAt)
                .brokerTradeId(brokerTradeId)
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .build();
    }

    private static BrokerTrade brokerTrade(String id, String quantity, String price, LocalDateTime executedAt) {
        return BrokerTrade.builder()
                .brokerTradeId(id)
                .symbol("TSLA")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal(quantity))
                .price(new BigDecimal(price))
                .executedAt(executedAt)
                .build();
    }
}
