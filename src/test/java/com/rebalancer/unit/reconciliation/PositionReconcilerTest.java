package com.rebalancer.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rebalancer.allocation.MultiPortfolioAllocator;
import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.ReconciliationReport;
import com.rebalancer.domain.model.TradeReconciliationResult;
import com.rebalancer.event.ReconciliationEvent;
import com.rebalancer.exception.SourceUnavailableException;
import com.rebalancer.ledger.InMemoryLedgerStore;
import com.rebalancer.ledger.OwnershipLedger;
import com.rebalancer.reconciliation.PositionReconciler;
import com.rebalancer.reconciliation.TradeHistoryReconciler;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class PositionReconcilerTest {

    @Mock
    private TradeHistoryReconciler tradeHistoryReconciler;

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private OwnershipLedger ownershipLedger;
    private PositionReconciler positionReconciler;

    @BeforeEach
    void setUp() {
        ownershipLedger = new OwnershipLedger(new InMemoryLedgerStore());
        positionReconciler = new PositionReconciler(
                ownershipLedger,
                new MultiPortfolioAllocator(),
                tradeHistoryReconciler,
                brokerGateway,
                new TimedCallExecutor("Broker", Runnable::run, Duration.ofSeconds(1)),
                applicationEventPublisher);
        when(tradeHistoryReconciler.reconcile(any(), anyBoolean()))
                .thenReturn(TradeReconciliationResult.builder().build());
    }

    @Test
    @DisplayName("Broker below ledger records an external sale and shrinks the ledger")
    void detectsExternalSale() {
        buy("SP400", "TSLA", "6");
        when(brokerGateway.getCurrentPrice("TSLA")).thenReturn(new BigDecimal("150"));

        ReconciliationReport report =
                positionReconciler.reconcile("TEST", Map.of("TSLA", new BigDecimal("4")), false);

        assertThat(report.getDetectedSales()).hasSize(1);
        ExternalSaleRecord sale = report.getDetectedSales().get(0);
        assertThat(sale.getPortfolioName()).isEqualTo("SP400");
        assertThat(sale.getQuantity()).isEqualByComparingTo("2");
        assertThat(sale.getEstimatedProceeds()).isEqualByComparingTo("300.00");
        assertThat(sale.isUsedForReinvestment()).isFalse();

        OwnershipRecord record = ownershipLedger.get("SP400", "TSLA").orElseThrow();
        assertThat(record.getQuantity()).isEqualByComparingTo("4");
        assertThat(record.getTotalCost()).isEqualByComparingTo("400.00");
        assertThat(ownershipLedger.findUnconsumedExternalSales("SP400")).hasSize(1);
        assertThat(report.countMismatches(MismatchType.EXTERNAL_SALE)).isEqualTo(1);
    }

    @Test
    @DisplayName("A symbol gone from the broker is fully recorded as sold")
    void detectsCompleteExternalSale() {
        buy("SP400", "TSLA", "6");
        when(brokerGateway.getCurrentPrice("TSLA")).thenReturn(new BigDecimal("100"));

        ReconciliationReport report = positionReconciler.reconcile("TEST", Map.of(), false);

        assertThat(report.getDetectedSales()).singleElement()
                .satisfies(s -> assertThat(s.getEstimatedProceeds()).isEqualByComparingTo("600.00"));
        assertThat(ownershipLedger.get("SP400", "TSLA")).isEmpty();
    }

    @Test
    @DisplayName("Shortfall is shared 60:40 between two portfolios")
    void apportionsShortfallAcrossPortfolios() {
        buy("P1", "TSLA", "6");
        buy("P2", "TSLA", "4");
        when(brokerGateway.getCurrentPrice("TSLA")).thenReturn(new BigDecimal("100"));

        ReconciliationReport report =
                positionReconciler.reconcile("TEST", Map.of("TSLA", new BigDecimal("5")), false);

        assertThat(report.salesFor("P1")).singleElement()
                .satisfies(s -> assertThat(s.getQuantity()).isEqualByComparingTo("3"));
        assertThat(report.salesFor("P2")).singleElement()
                .satisfies(s -> assertThat(s.getQuantity()).isEqualByComparingTo("2"));
        assertThat(ownershipLedger.get("P1", "TSLA").orElseThrow().getQuantity()).isEqualByComparingTo("3");
        assertThat(ownershipLedger.get("P2", "TSLA").orElseThrow().getQuantity()).isEqualByComparingTo("2");
        assertThat(report.viewsFor("P1").get("TSLA").getSellableQuantity()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("Broker holdings beyond the ledger are reported but never adopted")
    void reportsUntrackedHoldings() {
        buy("SP400", "TSLA", "4");

        ReconciliationReport report = positionReconciler.reconcile(
                "TEST", Map.of("TSLA", new BigDecimal("10"), "AAPL", new BigDecimal("3")), false);

        assertThat(report.getDetectedSales()).isEmpty();
        assertThat(report.countMismatches(MismatchType.UNTRACKED_HOLDING)).isEqualTo(2);
        assertThat(ownershipLedger.get("SP400", "TSLA").orElseThrow().getQuantity()).isEqualByComparingTo("4");
        assertThat(ownershipLedger.get("SP400", "AAPL")).isEmpty();
        verify(brokerGateway, never()).getCurrentPrice(any());
    }

    @Test
    @DisplayName("Dry run reports the sale but leaves the ledger untouched")
    void dryRunWritesNothing() {
        buy("SP400", "TSLA", "6");
        when(brokerGateway.getCurrentPrice("TSLA")).thenReturn(new BigDecimal("150"));

        ReconciliationReport report =
                positionReconciler.reconcile("TEST", Map.of("TSLA", new BigDecimal("4")), true);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getDetectedSales()).hasSize(1);
        assertThat(ownershipLedger.get("SP400", "TSLA").orElseThrow().getQuantity()).isEqualByComparingTo("6");
        assertThat(ownershipLedger.findUnconsumedExternalSales("SP400")).isEmpty();
    }

    @Test
    @DisplayName("Missing price falls back to the average cost")
    void valuesAtAverageCostWithoutPrice() {
        buy("SP400", "TSLA", "6");
        when(brokerGateway.getCurrentPrice("TSLA")).thenThrow(new SourceUnavailableException("no quote"));

        ReconciliationReport report =
                positionReconciler.reconcile("TEST", Map.of("TSLA", new BigDecimal("4")), false);

        assertThat(report.getDetectedSales()).singleElement()
                .satisfies(s -> assertThat(s.getEstimatedProceeds()).isEqualByComparingTo("200.00"));
        assertThat(report.countMismatches(MismatchType.PRICE_UNAVAILABLE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Publishes a reconciliation event carrying the report")
    void publishesEvent() {
        ReconciliationReport report = positionReconciler.reconcile("TEST", Map.of(), false);

        ArgumentCaptor<ReconciliationEvent> captor = ArgumentCaptor.forClass(ReconciliationEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getReport()).isSameAs(report);
        assertThat(report.hasMismatches()).isFalse();
    }

    private void buy(String portfolio, String symbol, String quantity) {
        ownershipLedger.apply(portfolio, symbol, OrderSide.BUY, new BigDecimal(quantity), new BigDecimal("100"));
    }
}
