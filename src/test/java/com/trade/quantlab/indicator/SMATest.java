package com.trade.quantlab.indicator;

import com.trade.quantlab.core.TestBars;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SMA 指标单元测试
 */
class SMATest {

    @Test
    void testSMACalculation() {
        SMA sma = new SMA(3);
        List<BigDecimal> result = sma.calculate(TestBars.prices(1, 2, 3, 4, 5));

        // 5 - 3 + 1 = 3 个值
        assertEquals(3, result.size());
        assertEquals(0, new BigDecimal("2").compareTo(result.get(0)));
        assertEquals(0, new BigDecimal("3").compareTo(result.get(1)));
        assertEquals(0, new BigDecimal("4").compareTo(result.get(2)));
    }

    @Test
    void testLatest() {
        SMA sma = new SMA(2);
        assertEquals(0, new BigDecimal("15").compareTo(sma.latest(TestBars.prices(5, 10, 20))));
    }

    @Test
    void testInsufficientData() {
        SMA sma = new SMA(5);
        assertThrows(IllegalArgumentException.class, () -> sma.calculate(TestBars.prices(1, 2, 3)));
    }

    @Test
    void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class, () -> new SMA(0));
    }

    @Test
    void testRequiredPrices() {
        assertEquals(10, new SMA(10).requiredPrices());
        assertEquals("SMA-10", new SMA(10).getName());
    }
}
