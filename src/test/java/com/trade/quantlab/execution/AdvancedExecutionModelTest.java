package com.trade.quantlab.execution;

import com.trade.quantlab.backtest.BacktestConfig;
import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.backtest.PortfolioFixtures;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.TestBars;
import com.trade.quantlab.core.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 流动性约束成交模型测试
 */
class AdvancedExecutionModelTest {

    private AdvancedExecutionModel model;

    @BeforeEach
    void setUp() {
        BacktestConfig config = BacktestConfig.builder()
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .endDate(Instant.parse("2024-12-31T00:00:00Z"))
                .symbol("AAPL")
                .build();
        model = new AdvancedExecutionModel(config);
    }

    private MarketData bar(int minute, String close, String volume) {
        return TestBars.bar("AAPL", TestBars.T0.plusSeconds(60L * minute), close, close, close, close, volume);
    }

    @Test
    void testMaxQuantityWithoutHistory() {
        // 无历史时按当前Bar成交量的10%
        assertEquals(0, new BigDecimal("100000").compareTo(model.calculateMaxQuantity(bar(0, "100", "1000000"))));
    }

    @Test
    void testMaxQuantityUsesAverageVolume() {
        model.onMarketData(bar(0, "100", "1000"));
        model.onMarketData(bar(1, "100", "3000"));
        assertEquals(0, new BigDecimal("200").compareTo(model.calculateMaxQuantity(bar(1, "100", "3000"))));
    }

    @Test
    void testDuplicateBarRecordedOnce() {
        MarketData first = bar(0, "100", "1000");
        model.onMarketData(first);
        model.onMarketData(first);
        model.onMarketData(bar(1, "100", "4000"));
        // (1000 + 4000) / 2 × 10%
        assertEquals(0, new BigDecimal("250").compareTo(model.calculateMaxQuantity(bar(1, "100", "4000"))));
    }

    @Test
    void testFirstTwapSlice() {
        assertEquals(0, new BigDecimal("250").compareTo(AdvancedExecutionModel.firstTwapSlice(new BigDecimal("2500"))));
        assertEquals(0, new BigDecimal("100").compareTo(AdvancedExecutionModel.firstTwapSlice(new BigDecimal("300"))));
        // 不足100时整单作为一片
        assertEquals(0, new BigDecimal("50").compareTo(AdvancedExecutionModel.firstTwapSlice(new BigDecimal("50"))));
    }

    @Test
    void testHistoricalVolatility() {
        assertEquals(0.02, model.historicalVolatility("AAPL"), 1e-12);

        model.onMarketData(bar(0, "100", "1000"));
        model.onMarketData(bar(1, "100", "1000"));
        model.onMarketData(bar(2, "100", "1000"));
        assertEquals(0, model.historicalVolatility("AAPL"), 1e-12);
    }

    @Test
    void testLargeOrderIsSlicedAndCapped() {
        for (int i = 0; i < 3; i++) {
            model.onMarketData(bar(i, "100", "10000"));
        }
        MarketData current = bar(2, "100", "10000");

        Trade trade = model.executeSignal(Signal.buy("AAPL", "test").quantity(new BigDecimal("5000")).build(),
                current, PortfolioFixtures.cash("1000000"));

        // 上限1000，超过500按10片拆分，首片100
        assertNotNull(trade);
        assertEquals(0, new BigDecimal("100").compareTo(trade.getQuantity()));
        // 波动率0：滑点 = 0.001 × 100 × (1 + sqrt(0.01) × 0.5)
        assertEquals(100.105, trade.getPrice().doubleValue(), 1e-6);
        assertEquals(0.105, trade.getSlippage().doubleValue(), 1e-6);
        assertEquals(10.0105, trade.getCommission().doubleValue(), 1e-6);
    }

    @Test
    void testSellFillsBelowClose() {
        Portfolio portfolio = PortfolioFixtures.withPosition("10000", "AAPL", "10", "90");
        Trade trade = model.executeSignal(Signal.sell("AAPL", "test").build(), bar(0, "100", "1000000"), portfolio);

        assertNotNull(trade);
        assertEquals(0, new BigDecimal("10").compareTo(trade.getQuantity()));
        assertTrue(trade.getPrice().compareTo(new BigDecimal("100")) < 0);
        // 最低手续费1
        assertEquals(0, BigDecimal.ONE.compareTo(trade.getCommission()));
    }

    @Test
    void testSlippageIsIncludedInPrice() {
        assertEquals(0, BigDecimal.ZERO.compareTo(
                model.calculateSlippage(Signal.buy("AAPL", "test").build(), bar(0, "100", "1000"))));
    }
}
