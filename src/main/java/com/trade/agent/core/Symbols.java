package com.trade.agent.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 交易对符号工具
 * 各交易所对同一合约的写法不同（BTCUSDT、BTC/USDT:USDT、BTC-USDT-SWAP），
 * 比较前必须先去掉分隔符与结算币后缀。
 */
public final class Symbols {

    private static final String[] SETTLE_SUFFIXES = {":USDT", ":USDC"};
    private static final String SWAP_SUFFIX = "-SWAP";
    private static final String[] QUOTES = {"USDT", "USDC", "USD"};

    private Symbols() {}

    /**
     * 标准化符号：BTC/USDT:USDT -> BTCUSDT
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        String value = symbol.trim().toUpperCase(Locale.ROOT);
        for (String suffix : SETTLE_SUFFIXES) {
            if (value.endsWith(suffix)) {
                value = value.substring(0, value.length() - suffix.length());
                break;
            }
        }
        if (value.endsWith(SWAP_SUFFIX)) {
            value = value.substring(0, value.length() - SWAP_SUFFIX.length());
        }
        return value.replace("/", "").replace("-", "").replace("_", "");
    }

    public static boolean sameInstrument(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    /**
     * 拆分为 [base, quote]，无法识别报价币时抛出 IllegalArgumentException
     */
    public static String[] split(String symbol) {
        String normalized = normalize(symbol);
        for (String quote : QUOTES) {
            if (normalized.endsWith(quote) && normalized.length() > quote.length()) {
                return new String[]{normalized.substring(0, normalized.length() - quote.length()), quote};
            }
        }
        throw new IllegalArgumentException("Unrecognized quote currency in symbol: " + symbol);
    }

    /**
     * 查找指定方向的持仓
     */
    public static Optional<Position> findPosition(List<Position> positions, String symbol, PositionSide side) {
        String target = normalize(symbol);
        for (Position position : positions) {
            if (position.getSide() == side && normalize(position.getSymbol()).equals(target)) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }
}
