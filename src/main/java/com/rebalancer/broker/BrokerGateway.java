package com.rebalancer.broker;

import com.rebalancer.domain.model.BrokerTrade;
import com.rebalancer.domain.model.OrderResult;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Capability interface for everything the engine needs from a brokerage account. All
 * components go through this interface, never through a broker-specific class.
 *
 * <p>The shipped implementation is {@code PaperBrokerGateway}, an in-memory account for
 * paper trading. Calls made by the engine are wrapped by
 * {@link com.rebalancer.concurrent.TimedCallExecutor}, which enforces the configured timeout.
 */
public interface BrokerGateway {

    // ---- Account ----

    /**
     * Current holdings of the whole account.
     *
     * @return quantity per symbol; symbols with zero quantity are omitted
     * @throws com.rebalancer.exception.SourceUnavailableException if the broker cannot be reached
     */
    Map<String, BigDecimal> getPositions();

    /**
     * Trades executed in the account since the given time, oldest first.
     *
     * @throws com.rebalancer.exception.SourceUnavailableException if the broker cannot be reached
     */
    List<BrokerTrade> getTradeHistory(LocalDateTime since);

    // ---- Orders ----

    /**
     * Submits a market buy for a cash amount (fractional shares allowed).
     *
     * @return accepted with the broker order id, or rejected with the broker's reason
     */
    OrderResult buy(String symbol, BigDecimal amount);

    /**
     * Submits a market sell for a share quantity.
     *
     * @return accepted with the broker order id, or rejected with the broker's reason
     */
    OrderResult sell(String symbol, BigDecimal quantity);

    // ---- Market data ----

    /**
     * Latest trade price of a symbol.
     *
     * @throws com.rebalancer.exception.SourceUnavailableException if no price is available
     */
    BigDecimal getCurrentPrice(String symbol);
}
