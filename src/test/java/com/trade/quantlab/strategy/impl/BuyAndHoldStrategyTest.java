package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.backtest.PortfolioFixtures;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.TestBars;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 买入持有策略测试
 */
class BuyAndHoldStrategyTest {

    @Test
    void testBuysOncePerSymbol() {
        BuyAndHoldStrategy strategy = new BuyAndHoldStrategy();
        Portfolio portfolio = PortfolioFixtures.cash("10000");
        strategy.initialize(List.of("AAPL", "MSFT"));

        List<Signal> first = strategy.onBar(TestBars.bar("AAPL", TestBars.T0, "100"), portfolio);
        assertEquals(1, first.size());
        assertTrue(first.get(0).isBuy());
        assertEquals(0, new BigDecimal("0.95").compareTo(first.get(0).getTargetWeight()));
        assertEquals(strategy.getName(), first.get(0).getStrategyId());

        assertTrue(strategy.onBar(TestBars.bar("AAPL", TestBars.T0.plusSeconds(60), "101"), portfolio).isEmpty());
        assertEquals(1, strategy.onBar(TestBars.bar("MSFT", TestBars.T0, "200"), portfolio).size());
    }

    @Test
    void testNoBuyWhenAlreadyHolding() {
        BuyAndHoldStrategy strategy = new BuyAndHoldStrategy();
        Portfolio portfolio = PortfolioFixtures.withPosition("10000", "AAPL", "10", "100");

        assertTrue(strategy.onBar(TestBars.bar("AAPL", TestBars.T0, "100"), portfolio).isEmpty());
    }

    @Test
    void testInitializeResetsState() {
        BuyAndHoldStrategy strategy = new BuyAndHoldStrategy();
        Portfolio portfolio = PortfolioFixtures.cash("10000");
        strategy.onBar(TestBars.bar("AAPL", TestBars.T0, "100"), portfolio);

        strategy.initialize(List.of("AAPL"));
        assertEquals(1, strategy.onBar(TestBars.bar("AAPL", TestBars.T0, "100"), portfolio).size());
    }
}
