package com.trade.agent.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolsTest {

    @Test
    void unifiedAndNativeFormsAreTheSameInstrument() {
        assertTrue(Symbols.sameInstrument("BTCUSDT", "BTC/USDT:USDT"));
        assertTrue(Symbols.sameInstrument("BTCUSDC", "BTC/USDC:USDC"));
        assertTrue(Symbols.sameInstrument("ETH-USDT-SWAP", "ethusdt"));
        assertFalse(Symbols.sameInstrument("BTCUSDT", "BTCUSDC"));
    }

    @Test
    void normalizeStripsSeparatorsAndSettleSuffix() {
        assertEquals("BTCUSDT", Symbols.normalize(" btc/usdt:usdt "));
        assertEquals("SOLUSDT", Symbols.normalize("SOL_USDT"));
        assertEquals("", Symbols.normalize(null));
    }

    @Test
    void splitReturnsBaseAndQuote() {
        assertArrayEquals(new String[]{"BTC", "USDT"}, Symbols.split("BTCUSDT"));
        assertArrayEquals(new String[]{"ETH", "USDC"}, Symbols.split("ETH/USDC:USDC"));
        assertThrows(IllegalArgumentException.class, () -> Symbols.split("BTCEUR"));
    }

    @Test
    void findPositionMatchesSideAndNormalizedSymbol() {
        Position longBtc = position("BTC/USDT:USDT", PositionSide.LONG);
        Position shortBtc = position("BTCUSDT", PositionSide.SHORT);
        List<Position> positions = List.of(longBtc, shortBtc);

        assertSame(longBtc, Symbols.findPosition(positions, "BTCUSDT", PositionSide.LONG).orElseThrow());
        assertSame(shortBtc, Symbols.findPosition(positions, "BTC/USDT:USDT", PositionSide.SHORT).orElseThrow());
        assertTrue(Symbols.findPosition(positions, "ETHUSDT", PositionSide.LONG).isEmpty());
    }

    @Test
    void positionRejectsNonPositiveSizeOrLeverage() {
        assertThrows(IllegalArgumentException.class, () -> new Position("BTCUSDT", PositionSide.LONG,
                BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ONE,
                BigDecimal.ONE, Instant.now(), "okx"));
        assertThrows(IllegalArgumentException.class, () -> new Position("BTCUSDT", PositionSide.LONG,
                BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ONE, Instant.now(), "okx"));
    }

    private Position position(String symbol, PositionSide side) {
        return new Position(symbol, side, new BigDecimal("0.5"), new BigDecimal("60000"), new BigDecimal("61000"),
                new BigDecimal("500"), BigDecimal.TEN, new BigDecimal("3000"), Instant.now(), "binance_futures");
    }
}
