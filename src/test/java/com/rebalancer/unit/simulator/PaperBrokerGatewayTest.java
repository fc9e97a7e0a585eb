package com.rebalancer.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.model.BrokerTrade;
import com.rebalancer.domain.model.OrderResult;
import com.rebalancer.exception.SourceUnavailableException;
import com.rebalancer.simulator.PaperBrokerGateway;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PaperBrokerGatewayTest {

    private PaperBrokerGateway broker;

    @BeforeEach
    void setUp() {
        RebalancerProperties properties = new RebalancerProperties();
        properties.getBroker().getPaperPrices().put("tsla", new BigDecimal("150"));
        broker = new PaperBrokerGateway(properties);
    }

    @Test
    @DisplayName("Buys fractional shares rounded down to six decimals")
    void buyFillsFractionalShares() {
        broker.setPrice("AAPL", new BigDecimal("3"));

        OrderResult result = broker.buy("AAPL", new BigDecimal("10.00"));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getBrokerOrderId()).isEqualTo("PAPER-1");
        assertThat(broker.getPositions().get("AAPL")).isEqualByComparingTo("3.333333");
    }

    @Test
    @DisplayName("Configured prices are keyed by upper-case symbol, others use the default")
    void prices() {
        assertThat(broker.getCurrentPrice("TSLA")).isEqualByComparingTo("150");
        assertThat(broker.getCurrentPrice("MSFT")).isEqualByComparingTo("100.00");

        broker.markPriceUnavailable("MSFT");
        assertThatThrownBy(() -> broker.getCurrentPrice("MSFT")).isInstanceOf(SourceUnavailableException.class);

        broker.setPrice("MSFT", new BigDecimal("410"));
        assertThat(broker.getCurrentPrice("MSFT")).isEqualByComparingTo("410");
    }

    @Test
    @DisplayName("Sells more than held are rejected, a full sell clears the position")
    void sellChecksHoldings() {
        broker.setPosition("TSLA", new BigDecimal("4"));

        assertThat(broker.sell("TSLA", new BigDecimal("5")).isAccepted()).isFalse();
        assertThat(broker.sell("TSLA", new BigDecimal("4")).isAccepted()).isTrue();
        assertThat(broker.getPositions()).doesNotContainKey("TSLA");
    }

    @Test
    @DisplayName("Rejection hooks refuse orders until cleared")
    void rejectionHooks() {
        broker.rejectOrdersFor("AAPL", "halted");

        OrderResult rejected = broker.buy("AAPL", new BigDecimal("100"));
        assertThat(rejected.isAccepted()).isFalse();
        assertThat(rejected.getReason()).isEqualTo("halted");

        broker.clearRejections();
        assertThat(broker.buy("AAPL", new BigDecimal("100")).isAccepted()).isTrue();
        assertThat(broker.buy("AAPL", BigDecimal.ZERO).isAccepted()).isFalse();
    }

    @Test
    @DisplayName("Fills are listed in the trade history, position edits are not")
    void tradeHistory() {
        LocalDateTime before = LocalDateTime.now().minusSeconds(1);
        broker.buy("TSLA", new BigDecimal("300"));
        broker.setPosition("AAPL", new BigDecimal("7"));

        List<BrokerTrade> history = broker.getTradeHistory(before);

        assertThat(history).singleElement().satisfies(trade -> {
            assertThat(trade.getSymbol()).isEqualTo("TSLA");
            assertThat(trade.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(trade.getQuantity()).isEqualByComparingTo("2");
            assertThat(trade.getTotal()).isEqualByComparingTo("300.00");
        });
        assertThat(broker.getTradeHistory(LocalDateTime.now().plusMinutes(1))).isEmpty();
    }
}
