package com.trade.agent.execution;

import com.trade.agent.core.Balance;
import com.trade.agent.core.Decimal;
import com.trade.agent.core.OrderResult;
import com.trade.agent.core.Position;
import com.trade.agent.core.PositionSide;
import com.trade.agent.core.Symbols;
import com.trade.agent.core.TradingConfig;
import com.trade.agent.exchange.ExchangeException;
import com.trade.agent.exchange.ExchangeTrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 决策执行器
 *
 * 职责：
 * 1. 获取账户状态（余额 + 持仓）
 * 2. 先执行全部平仓，再刷新账户状态，最后执行全部开仓
 * 3. 每个标的独立执行，单个失败只记录在该决策上
 */
public class DecisionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(DecisionExecutor.class);

    private final TradingConfig config;
    private final Clock clock;

    public DecisionExecutor(TradingConfig config) {
        this(config, Clock.systemUTC());
    }

    public DecisionExecutor(TradingConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * 执行一批决策，结果写回每个 Decision
     */
    public ExecutionReport execute(DecisionBatch batch, ExchangeTrader trader) {
        logger.info("开始执行交易决策: {} 个标的, 交易所={}", batch.size(), trader.getExchangeName());

        AccountState state;
        try {
            state = fetchAccountState(trader);
            logger.info("账户余额: ${}, 持仓数量: {}", state.balance.getTotalBalance(), state.positions.size());
        } catch (ExchangeException | RuntimeException e) {
            logger.error("获取账户状态失败，本批决策全部标记失败", e);
            for (Decision decision : batch.getDecisions().values()) {
                settle(decision, ExecutionResult.failure(decision.getAction(), decision.getSymbol(),
                        "account state unavailable: " + e.getMessage(), now()));
            }
            return ExecutionReport.of(batch, false);
        }

        List<Decision> closes = new ArrayList<>();
        List<Decision> opens = new ArrayList<>();
        for (Decision decision : batch.getDecisions().values()) {
            DecisionAction action = decision.getAction();
            if (decision.getExecutionStatus() != ExecutionStatus.PENDING) {
                logger.warn("{} 已执行过（{}），跳过", decision.getSymbol(), decision.getExecutionStatus());
            } else if (action == null) {
                settle(decision, ExecutionResult.failure(null, decision.getSymbol(), "decision has no action", now()));
            } else if (action == DecisionAction.HOLD) {
                logger.info("{}: HOLD，无需执行交易", decision.getSymbol());
                settle(decision, ExecutionResult.noop(action, decision.getSymbol(),
                        "hold, no trade executed", now()));
            } else if (action.isClose()) {
                closes.add(decision);
            } else {
                opens.add(decision);
            }
        }

        // 第一步：平仓
        for (Decision decision : closes) {
            settle(decision, executeIsolated(decision, trader, state));
        }

        // 第二步：平仓后刷新账户状态
        if (!closes.isEmpty()) {
            try {
                state = fetchAccountState(trader);
                logger.info("平仓后账户余额: ${}, 持仓数量: {}", state.balance.getTotalBalance(), state.positions.size());
            } catch (ExchangeException | RuntimeException e) {
                logger.error("平仓后刷新账户状态失败，沿用平仓前快照", e);
            }
        }

        // 第三步：开仓
        for (Decision decision : opens) {
            settle(decision, executeIsolated(decision, trader, state));
        }

        ExecutionReport report = ExecutionReport.of(batch, true);
        logger.info("交易决策执行完成: {}", report);
        return report;
    }

    private ExecutionResult executeIsolated(Decision decision, ExchangeTrader trader, AccountState state) {
        try {
            return decision.getAction().isClose()
                    ? executeClose(decision, trader, state.positions)
                    : executeOpen(decision, trader);
        } catch (ExchangeException e) {
            logger.error("执行 {} {} 失败: [{}] {}", decision.getSymbol(), decision.getAction(),
                    e.getErrorCode(), e.getMessage());
            return ExecutionResult.failure(decision.getAction(), decision.getSymbol(), e.getMessage(), now());
        } catch (RuntimeException e) {
            logger.error("执行 {} {} 异常", decision.getSymbol(), decision.getAction(), e);
            return ExecutionResult.failure(decision.getAction(), decision.getSymbol(), String.valueOf(e.getMessage()), now());
        }
    }

    private ExecutionResult executeClose(Decision decision, ExchangeTrader trader, List<Position> positions)
            throws ExchangeException {
        String symbol = decision.getSymbol();
        PositionSide side = decision.getAction().positionSide();
        Optional<Position> held = Symbols.findPosition(positions, symbol, side);
        if (held.isEmpty()) {
            String error = symbol + " has no " + side.lowerName() + " position to close";
            logger.warn(error);
            return ExecutionResult.failure(decision.getAction(), symbol, error, now());
        }

        Position position = held.get();
        OrderResult order = side == PositionSide.LONG
                ? trader.closeLong(symbol, BigDecimal.ZERO)
                : trader.closeShort(symbol, BigDecimal.ZERO);
        BigDecimal price = order.getExecutedPrice() != null ? order.getExecutedPrice() : position.getMarkPrice();
        logger.info("平{}仓成功: {} 数量:{} 开仓价:{} 成交价:{} 订单:{}", side.lowerName(), symbol, position.getSize(),
                position.getEntryPrice(), price, order.getOrderId());
        return ExecutionResult.success(decision.getAction(), symbol, position.getSize(),
                position.getLeverage().intValue(), price,
                "closed " + side.lowerName() + ": " + position.getSize().toPlainString() + " @ $" + price, now());
    }

    private ExecutionResult executeOpen(Decision decision, ExchangeTrader trader) throws ExchangeException {
        String symbol = decision.getSymbol();
        BigDecimal sizeUsd = decision.getPositionSizeUsd();
        if (!Decimal.isPositive(sizeUsd)) {
            return ExecutionResult.failure(decision.getAction(), symbol,
                    "position_size_usd must be positive, got " + sizeUsd, now());
        }
        BigDecimal price = trader.getMarketPrice(symbol);
        if (!Decimal.isPositive(price)) {
            return ExecutionResult.failure(decision.getAction(), symbol,
                    "no valid market price for " + symbol, now());
        }

        BigDecimal quantity = Decimal.divide(sizeUsd, price);
        int leverage = config.getDefaultLeverage(trader.getExchangeName());
        PositionSide side = decision.getAction().positionSide();
        OrderResult order = side == PositionSide.LONG
                ? trader.openLong(symbol, quantity, leverage, decision.getStopLossPrice(), decision.getTakeProfitPrice())
                : trader.openShort(symbol, quantity, leverage, decision.getStopLossPrice(), decision.getTakeProfitPrice());
        logger.info("开{}仓成功: {} 数量:{} 杠杆:{}x 价格:${} 订单:{}", side.lowerName(), symbol, quantity,
                leverage, price, order.getOrderId());
        return ExecutionResult.success(decision.getAction(), symbol, quantity, leverage, price,
                "opened " + side.lowerName() + ": " + quantity.toPlainString() + " @ $" + price, now());
    }

    private void settle(Decision decision, ExecutionResult result) {
        if (decision.getExecutionStatus() != ExecutionStatus.PENDING) {
            logger.warn("{} 已执行过（{}），忽略重复执行", decision.getSymbol(), decision.getExecutionStatus());
            return;
        }
        decision.complete(result);
    }

    private AccountState fetchAccountState(ExchangeTrader trader) throws ExchangeException {
        Balance balance = trader.getBalance();
        List<Position> positions = trader.getPositions();
        return new AccountState(balance, positions);
    }

    private Instant now() {
        return clock.instant();
    }

    private static final class AccountState {
        private final Balance balance;
        private final List<Position> positions;

        private AccountState(Balance balance, List<Position> positions) {
            this.balance = balance;
            this.positions = positions;
        }
    }
}
