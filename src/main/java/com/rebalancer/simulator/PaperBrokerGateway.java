package com.rebalancer.simulator;

import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.model.BrokerTrade;
import com.rebalancer.domain.model.OrderResult;
import com.rebalancer.exception.SourceUnavailableException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link BrokerGateway} backed by an in-memory account.
 *
 * <p>Orders fill immediately at the current price. Buys are sized in cash and converted to
 * fractional shares (6 decimals, rounded down); sells are rejected when the account holds
 * fewer shares than requested. Prices come from {@code rebalancer.broker.paper-prices},
 * falling back to {@code rebalancer.broker.paper-default-price}.
 *
 * <p>Positions can be edited directly through {@link #setPosition} to simulate trades made
 * outside the engine.
 */
@Service
public class PaperBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerGateway.class);

    private static final BigDecimal EPSILON = new BigDecimal("0.000001");

    /** Holdings indexed by symbol. */
    private final Map<String, BigDecimal> positions = new ConcurrentHashMap<>();

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private final Map<String, String> rejections = new ConcurrentHashMap<>();
    private final Set<String> unpricedSymbols = ConcurrentHashMap.newKeySet();
    private final List<BrokerTrade> tradeHistory = new CopyOnWriteArrayList<>();
    private final AtomicLong orderSequence = new AtomicLong();
    private final BigDecimal defaultPrice;

    public PaperBrokerGateway(RebalancerProperties rebalancerProperties) {
        RebalancerProperties.Broker broker = rebalancerProperties.getBroker();
        this.defaultPrice = broker.getPaperDefaultPrice();
        broker.getPaperPrices().forEach((symbol, price) -> prices.put(symbol.toUpperCase(), price));
    }

    @Override
    public Map<String, BigDecimal> getPositions() {
        Map<String, BigDecimal> snapshot = new HashMap<>();
        positions.forEach((symbol, quantity) -> {
            if (quantity.compareTo(EPSILON) > 0) {
                snapshot.put(symbol, quantity);
            }
        });
        return snapshot;
    }

    @Override
    public List<BrokerTrade> getTradeHistory(LocalDateTime since) {
        return tradeHistory.stream()
                .filter(t -> !t.getExecutedAt().isBefore(since))
                .toList();
    }

    @Override
    public OrderResult buy(String symbol, BigDecimal amount) {
        String rejection = rejections.get(symbol);
        if (rejection != null) {
            log.info("Paper buy {} {} rejected: {}", symbol, amount, rejection);
            return OrderResult.rejected(rejection);
        }
        if (amount.signum() <= 0) {
            return OrderResult.rejected("Amount must be positive");
        }

        BigDecimal price = getCurrentPrice(symbol);
        BigDecimal quantity = amount.divide(price, 6, RoundingMode.DOWN);
        positions.merge(symbol, quantity, BigDecimal::add);
        return fill(symbol, OrderSide.BUY, quantity, price);
    }

    @Override
    public OrderResult sell(String symbol, BigDecimal quantity) {
        String rejection = rejections.get(symbol);
        if (rejection != null) {
            log.info("Paper sell {} {} rejected: {}", symbol, quantity, rejection);
            return OrderResult.rejected(rejection);
        }

        BigDecimal held = positions.getOrDefault(symbol, BigDecimal.ZERO);
        if (held.add(EPSILON).compareTo(quantity) < 0) {
            return OrderResult.rejected("Insufficient quantity: held " + held + ", requested " + quantity);
        }

        BigDecimal price = getCurrentPrice(symbol);
        BigDecimal remaining = held.subtract(quantity);
        if (remaining.compareTo(EPSILON) <= 0) {
            positions.remove(symbol);
        } else {
            positions.put(symbol, remaining);
        }
        return fill(symbol, OrderSide.SELL, quantity, price);
    }

    @Override
    public BigDecimal getCurrentPrice(String symbol) {
        if (unpricedSymbols.contains(symbol)) {
            throw new SourceUnavailableException("No price available for " + symbol);
        }
        return prices.getOrDefault(symbol, defaultPrice);
    }

    private OrderResult fill(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        tradeHistory.add(BrokerTrade.builder()
                .brokerTradeId(orderId)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .price(price)
                .total(quantity.multiply(price).setScale(2, RoundingMode.HALF_UP))
                .executedAt(LocalDateTime.now())
                .build());
        log.debug("Paper {} {} {} @ {} -> {}", side, quantity, symbol, price, orderId);
        return OrderResult.accepted(orderId);
    }

    // ---- Account manipulation (paper trading and tests) ----

    public void setPrice(String symbol, BigDecimal price) {
        prices.put(symbol, price);
        unpricedSymbols.remove(symbol);
    }

    /** Makes {@link #getCurrentPrice} fail for the symbol until a price is set again. */
    public void markPriceUnavailable(String symbol) {
        unpricedSymbols.add(symbol);
    }

    /** Overwrites a holding without recording a trade, as if it changed outside the engine. */
    public void setPosition(String symbol, BigDecimal quantity) {
        if (quantity.compareTo(EPSILON) <= 0) {
            positions.remove(symbol);
        } else {
            positions.put(symbol, quantity);
        }
    }

    public void rejectOrdersFor(String symbol, String reason) {
        rejections.put(symbol, reason);
    }

    public void clearRejections() {
        rejections.clear();
    }
}
