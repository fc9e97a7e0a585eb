package com.rebalancer.execution;

import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.ReconciliationStatus;
import com.rebalancer.domain.enums.SkipReason;
import com.rebalancer.domain.model.ExecutedLeg;
import com.rebalancer.domain.model.ExecutionResult;
import com.rebalancer.domain.model.OrderResult;
import com.rebalancer.domain.model.RebalancePlan;
import com.rebalancer.domain.model.SkippedLeg;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.BaseException;
import com.rebalancer.exception.OrderRejectedException;
import com.rebalancer.ledger.OwnershipLedger;
import com.rebalancer.planning.RebalancePlanner;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes a {@link RebalancePlan}: every sell first, in plan order, then every buy.
 *
 * <p>Each accepted order is recorded immediately (trade record + ledger mutation in one unit
 * of work). A rejected, failed or timed-out order skips that leg only; legs already executed
 * stay executed and nothing is retried.
 *
 * <p>Buy amounts are recomputed after the sells from what was actually realised: accepted
 * sells at their submission price, plus the pooled external sale proceeds, plus the base
 * capital of a first run. The external sales of the plan are marked as reinvested together
 * with the first buy that goes through.
 */
@Service
public class TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(TradeExecutor.class);

    private final BrokerGateway brokerGateway;
    private final TimedCallExecutor brokerCallExecutor;
    private final OwnershipLedger ownershipLedger;

    public TradeExecutor(
            BrokerGateway brokerGateway, TimedCallExecutor brokerCallExecutor, OwnershipLedger ownershipLedger) {
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.ownershipLedger = ownershipLedger;
    }

    public ExecutionResult execute(RebalancePlan plan, boolean dryRun) {
        ExecutionResult result = ExecutionResult.builder().build();
        result.getSkipped().addAll(plan.getSkipped());

        if (dryRun) {
            plan.getSells().forEach(sell -> result.getSkipped().add(skip(
                    OrderSide.SELL, sell.getSymbol(), SkipReason.DRY_RUN, "Would sell " + sell.getQuantity())));
            plan.getBuys().forEach(buy -> result.getSkipped().add(skip(
                    OrderSide.BUY, buy.getSymbol(), SkipReason.DRY_RUN, "Would buy for " + buy.getAmount())));
            return result;
        }

        BigDecimal realized = BigDecimal.ZERO;
        for (RebalancePlan.SellLeg sell : plan.getSells()) {
            BigDecimal proceeds = executeSell(plan.getPortfolioName(), sell, result);
            realized = realized.add(proceeds);
        }

        if (plan.getBuys().isEmpty()) {
            return result;
        }

        BigDecimal capital = plan.getBaseCapital().add(realized).add(plan.getExternalProceeds());
        BigDecimal perBuy = RebalancePlanner.splitEqually(capital, plan.getBuys().size());
        log.info(
                "[{}] buy capital {} (realized sells {}, external {}, base {}) -> {} per buy",
                plan.getPortfolioName(),
                capital,
                realized,
                plan.getExternalProceeds(),
                plan.getBaseCapital(),
                perBuy);

        if (perBuy.signum() <= 0) {
            plan.getBuys().forEach(buy -> result.getSkipped().add(skip(
                    OrderSide.BUY, buy.getSymbol(), SkipReason.NO_CAPITAL, "No sell went through")));
            return result;
        }

        for (RebalancePlan.BuyLeg buy : plan.getBuys()) {
            Collection<String> toConsume =
                    result.isExternalSalesConsumed() ? List.of() : plan.getConsumedExternalSaleIds();
            if (executeBuy(plan.getPortfolioName(), buy.getSymbol(), perBuy, toConsume, result)
                    && !toConsume.isEmpty()) {
                result.setExternalSalesConsumed(true);
            }
        }
        return result;
    }

    /** @return realised proceeds, zero if the leg did not go through */
    private BigDecimal executeSell(String portfolioName, RebalancePlan.SellLeg sell, ExecutionResult result) {
        String symbol = sell.getSymbol();
        OrderResult orderResult;
        try {
            orderResult = brokerCallExecutor.call("sell", () -> brokerGateway.sell(symbol, sell.getQuantity()));
        } catch (BaseException e) {
            log.warn("[{}] SELL {} {} failed: {}", portfolioName, sell.getQuantity(), symbol, e.getMessage());
            result.getSkipped().add(skip(OrderSide.SELL, symbol, reasonFor(e), e.getMessage()));
            return BigDecimal.ZERO;
        }
        if (!orderResult.isAccepted()) {
            log.warn(
                    "[{}] SELL {} {} rejected: {}",
                    portfolioName,
                    sell.getQuantity(),
                    symbol,
                    orderResult.getReason());
            result.getSkipped().add(skip(OrderSide.SELL, symbol, SkipReason.ORDER_REJECTED, orderResult.getReason()));
            return BigDecimal.ZERO;
        }

        TradeRecord trade = tradeRecord(
                portfolioName, symbol, OrderSide.SELL, sell.getQuantity(), sell.getPrice(), orderResult);
        record(trade, List.of(), result, orderResult);
        log.info(
                "[{}] SELL {} {} @ {} submitted ({})",
                portfolioName,
                trade.getQuantity(),
                symbol,
                trade.getPrice(),
                orderResult.getBrokerOrderId());
        return trade.getTotal();
    }

    /** @return true if the buy was accepted and recorded */
    private boolean executeBuy(
            String portfolioName,
            String symbol,
            BigDecimal amount,
            Collection<String> externalSalesToConsume,
            ExecutionResult result) {
        BigDecimal price;
        OrderResult orderResult;
        try {
            price = brokerCallExecutor.call("getCurrentPrice", () -> brokerGateway.getCurrentPrice(symbol));
            // The ledger quantity is amount / price, so no order goes out without a usable price
            if (price == null || price.signum() <= 0) {
                log.warn("[{}] BUY {} for {} skipped: unusable price {}", portfolioName, symbol, amount, price);
                result.getSkipped().add(skip(
                        OrderSide.BUY, symbol, SkipReason.SOURCE_UNAVAILABLE, "No usable price: " + price));
                return false;
            }
            orderResult = brokerCallExecutor.call("buy", () -> brokerGateway.buy(symbol, amount));
        } catch (BaseException e) {
            log.warn("[{}] BUY {} for {} failed: {}", portfolioName, symbol, amount, e.getMessage());
            result.getSkipped().add(skip(OrderSide.BUY, symbol, reasonFor(e), e.getMessage()));
            return false;
        }
        if (!orderResult.isAccepted()) {
            log.warn("[{}] BUY {} for {} rejected: {}", portfolioName, symbol, amount, orderResult.getReason());
            result.getSkipped().add(skip(OrderSide.BUY, symbol, SkipReason.ORDER_REJECTED, orderResult.getReason()));
            return false;
        }

        BigDecimal quantity = amount.divide(price, OwnershipLedger.QUANTITY_SCALE, RoundingMode.DOWN);
        TradeRecord trade = tradeRecord(portfolioName, symbol, OrderSide.BUY, quantity, price, orderResult);
        log.info(
                "[{}] BUY {} {} @ {} for {} submitted ({})",
                portfolioName,
                quantity,
                symbol,
                price,
                amount,
                orderResult.getBrokerOrderId());
        return record(trade, externalSalesToConsume, result, orderResult);
    }

    private boolean record(
            TradeRecord trade, Collection<String> externalSalesToConsume, ExecutionResult result, OrderResult order) {
        try {
            ownershipLedger.recordTrade(trade, externalSalesToConsume);
            result.getExecuted().add(ExecutedLeg.builder()
                    .side(trade.getSide())
                    .symbol(trade.getSymbol())
                    .quantity(trade.getQuantity())
                    .price(trade.getPrice())
                    .total(trade.getTotal())
                    .brokerOrderId(order.getBrokerOrderId())
                    .tradeRecordId(trade.getId())
                    .build());
            return true;
        } catch (BaseException e) {
            // The order stands at the broker; the next reconciliation sees the drift
            log.error(
                    "[{}] {} {} accepted by broker ({}) but not recorded: {}",
                    trade.getPortfolioName(),
                    trade.getSide(),
                    trade.getSymbol(),
                    order.getBrokerOrderId(),
                    e.getMessage(),
                    e);
            result.getSkipped().add(skip(
                    trade.getSide(),
                    trade.getSymbol(),
                    SkipReason.SOURCE_UNAVAILABLE,
                    "Accepted by broker as " + order.getBrokerOrderId() + " but not recorded: " + e.getMessage()));
            return false;
        }
    }

    private static TradeRecord tradeRecord(
            String portfolioName,
            String symbol,
            OrderSide side,
            BigDecimal quantity,
            BigDecimal price,
            OrderResult orderResult) {
        return TradeRecord.builder()
                .id(UUID.randomUUID().toString())
                .portfolioName(portfolioName)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .price(price)
                .total(quantity.multiply(price).setScale(OwnershipLedger.MONEY_SCALE, RoundingMode.HALF_UP))
                .submittedAt(LocalDateTime.now())
                .brokerTradeId(orderResult.getBrokerOrderId())
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .build();
    }

    private static SkipReason reasonFor(BaseException e) {
        return e instanceof OrderRejectedException ? SkipReason.ORDER_REJECTED : SkipReason.SOURCE_UNAVAILABLE;
    }

    private static SkippedLeg skip(OrderSide side, String symbol, SkipReason reason, String detail) {
        return SkippedLeg.builder()
                .side(side)
                .symbol(symbol)
                .reason(reason)
                .detail(detail)
                .build();
    }
}
