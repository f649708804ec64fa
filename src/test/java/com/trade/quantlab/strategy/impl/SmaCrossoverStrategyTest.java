package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.backtest.PortfolioFixtures;
import com.trade.quantlab.core.Signal;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 均线交叉策略测试
 */
class SmaCrossoverStrategyTest {

    @Test
    void testGoldenCrossBuys() {
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(2, 3);

        // 前一根 SMA2 = SMA3 = 10；当前 SMA2 = 11.5 > SMA3 = 11
        List<Signal> signals = StrategyTestSupport.feed(strategy, PortfolioFixtures.cash("10000"), 10, 10, 10, 13);

        assertEquals(1, signals.size());
        Signal signal = signals.get(0);
        assertTrue(signal.isBuy());
        assertEquals(0, new BigDecimal("0.3").compareTo(signal.getTargetWeight()));
        assertEquals(0.5 / 11, signal.getConfidence().doubleValue(), 1e-6);
    }

    @Test
    void testNeedsLongPeriodPlusOnePrices() {
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(2, 3);
        assertTrue(StrategyTestSupport.feed(strategy, PortfolioFixtures.cash("10000"), 10, 10, 13).isEmpty());
    }

    @Test
    void testDeathCrossSellsFullPosition() {
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(2, 3);
        Portfolio portfolio = PortfolioFixtures.withPosition("10000", "AAPL", "25", "10");

        List<Signal> signals = StrategyTestSupport.feed(strategy, portfolio, 10, 10, 10, 7);

        assertEquals(1, signals.size());
        assertTrue(signals.get(0).isSell());
        assertEquals(0, new BigDecimal("25").compareTo(signals.get(0).getQuantity()));
    }

    @Test
    void testNoBuyWhileHolding() {
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(2, 3);
        Portfolio portfolio = PortfolioFixtures.withPosition("10000", "AAPL", "25", "10");
        assertTrue(StrategyTestSupport.feed(strategy, portfolio, 10, 10, 10, 13).isEmpty());
    }

    @Test
    void testNoDeathCrossWithoutPosition() {
        SmaCrossoverStrategy strategy = new SmaCrossoverStrategy(2, 3);
        assertTrue(StrategyTestSupport.feed(strategy, PortfolioFixtures.cash("10000"), 10, 10, 10, 7).isEmpty());
    }

    @Test
    void testName() {
        assertEquals("均线交叉(10,30)", new SmaCrossoverStrategy().getName());
    }
}
