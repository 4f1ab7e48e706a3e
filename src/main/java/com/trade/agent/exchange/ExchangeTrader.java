package com.trade.agent.exchange;

import com.trade.agent.core.Balance;
import com.trade.agent.core.ExchangeOrder;
import com.trade.agent.core.ExchangeTrade;
import com.trade.agent.core.OrderResult;
import com.trade.agent.core.Position;

import java.io.Closeable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 合约交易所抽象接口
 * 执行层和对账层禁止直接调用交易所API，必须通过此接口
 *
 * 所有方法均为阻塞调用，symbol 使用交易所原生格式，
 * 比较持仓时统一经过 Symbols.normalize
 */
public interface ExchangeTrader extends Closeable {

    /**
     * 交易所标识，如 binance_futures / okx
     */
    String getExchangeName();

    /**
     * 账户余额（USDT 计价）
     */
    Balance getBalance() throws ExchangeException;

    /**
     * 当前持仓，仅返回 size &gt; 0 的仓位
     */
    List<Position> getPositions() throws ExchangeException;

    /**
     * 开多：设置杠杆 → 市价买入 → 尽力挂止损/止盈
     * 止损止盈失败只记录日志，不影响开仓结果
     *
     * @param quantity 基础资产数量
     * @param stopLoss 可为 null
     * @param takeProfit 可为 null
     */
    OrderResult openLong(String symbol, BigDecimal quantity, int leverage,
                         BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException;

    OrderResult openShort(String symbol, BigDecimal quantity, int leverage,
                          BigDecimal stopLoss, BigDecimal takeProfit) throws ExchangeException;

    /**
     * 平多：先撤销该交易对全部挂单，再市价平仓
     *
     * @param quantity 0 表示平掉全部持仓；大于持仓时抛出 INVALID_QUANTITY 且不下单
     */
    OrderResult closeLong(String symbol, BigDecimal quantity) throws ExchangeException;

    OrderResult closeShort(String symbol, BigDecimal quantity) throws ExchangeException;

    /**
     * 失败返回 false，不抛异常
     */
    boolean setLeverage(String symbol, int leverage);

    /**
     * @param marginMode cross / isolated
     */
    boolean setMarginMode(String symbol, String marginMode);

    boolean cancelAllOrders(String symbol);

    /**
     * 最新成交价，无法获取时返回 0
     */
    BigDecimal getMarketPrice(String symbol);

    /**
     * 按交易所精度格式化数量，无精度信息时返回原始字符串
     */
    String formatQuantity(String symbol, BigDecimal quantity);

    /**
     * 指定时间之后的订单历史
     */
    List<ExchangeOrder> fetchOrders(String symbol, Instant since) throws ExchangeException;

    /**
     * 指定时间之后的成交明细
     */
    List<ExchangeTrade> fetchTrades(String symbol, Instant since) throws ExchangeException;

    /**
     * 释放HTTP资源
     */
    @Override
    default void close() {
    }
}
