package com.trade.agent.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decimal 工具类单元测试
 */
class DecimalTest {

    @Test
    void testScale() {
        BigDecimal scaled = Decimal.scale(new BigDecimal("123.456789012345"));

        // 保留8位小数，四舍五入
        assertEquals(8, scaled.scale());
        assertEquals(0, new BigDecimal("123.45678901").compareTo(scaled));
    }

    @Test
    void testDivide() {
        BigDecimal quantity = Decimal.divide(new BigDecimal("100"), new BigDecimal("50000"));
        assertEquals(0, new BigDecimal("0.002").compareTo(quantity));
        assertEquals(8, quantity.scale());
    }

    @Test
    void testDivideByZero() {
        BigDecimal result = Decimal.divide(BigDecimal.TEN, BigDecimal.ZERO);
        assertEquals(0, BigDecimal.ZERO.compareTo(result));
    }

    @Test
    void testPercentOf() {
        assertEquals(0, new BigDecimal("12.50").compareTo(Decimal.percentOf(new BigDecimal("125"), new BigDecimal("1000"))));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.percentOf(BigDecimal.ONE, BigDecimal.ZERO)));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.percentOf(BigDecimal.ONE, null)));
    }

    @Test
    void testParse() {
        assertEquals(0, new BigDecimal("0.001").compareTo(Decimal.parse(" 0.001 ", BigDecimal.ZERO)));
        assertEquals(BigDecimal.ONE, Decimal.parse("", BigDecimal.ONE));
        assertEquals(BigDecimal.ONE, Decimal.parse(null, BigDecimal.ONE));
        assertEquals(BigDecimal.ONE, Decimal.parse("abc", BigDecimal.ONE));
    }

    @Test
    void testIsPositive() {
        assertTrue(Decimal.isPositive(new BigDecimal("0.00000001")));
        assertFalse(Decimal.isPositive(BigDecimal.ZERO));
        assertFalse(Decimal.isPositive(new BigDecimal("-1")));
        assertFalse(Decimal.isPositive(null));
    }

    @Test
    void testIsZero() {
        assertTrue(Decimal.isZero(new BigDecimal("0.0000")));
        assertFalse(Decimal.isZero(BigDecimal.ONE));
        assertFalse(Decimal.isZero(null));
    }
}
