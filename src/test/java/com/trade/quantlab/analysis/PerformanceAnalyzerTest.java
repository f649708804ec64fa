package com.trade.quantlab.analysis;

import com.trade.quantlab.backtest.BacktestConfig;
import com.trade.quantlab.backtest.EquityPoint;
import com.trade.quantlab.core.Side;
import com.trade.quantlab.core.TestBars;
import com.trade.quantlab.core.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 绩效分析测试
 */
class PerformanceAnalyzerTest {

    private PerformanceAnalyzer analyzer;
    private BacktestConfig config;

    @BeforeEach
    void setUp() {
        analyzer = new PerformanceAnalyzer();
        config = BacktestConfig.builder()
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .endDate(Instant.parse("2024-12-31T00:00:00Z"))
                .symbol("AAPL")
                .riskFreeRate(BigDecimal.ZERO)
                .build();
    }

    private static List<EquityPoint> curve(double... values) {
        List<EquityPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new EquityPoint(TestBars.T0.plusSeconds(60L * i), BigDecimal.valueOf(values[i]), BigDecimal.ZERO));
        }
        return points;
    }

    private static Trade trade(Side side, String quantity, String price, String commission) {
        return new Trade("t", TestBars.T0, "AAPL", side, new BigDecimal(quantity), new BigDecimal(price),
                new BigDecimal(commission), BigDecimal.ZERO, "test");
    }

    @Test
    void testEmptyInputs() {
        PerformanceMetrics noCurve = analyzer.calculateMetrics(List.of(), List.of(trade(Side.BUY, "1", "100", "0")), config);
        PerformanceMetrics noTrades = analyzer.calculateMetrics(curve(10000, 11000), List.of(), config);

        assertEquals(0, noCurve.getTotalTrades());
        assertEquals(0, noCurve.getTotalReturn());
        assertEquals(0, noTrades.getSharpeRatio());
        assertNull(noTrades.getBeta());
    }

    @Test
    void testReturns() {
        List<Double> returns = analyzer.calculateReturns(curve(100, 110, 99));

        assertEquals(2, returns.size());
        assertEquals(0.1, returns.get(0), 1e-12);
        assertEquals(-0.1, returns.get(1), 1e-12);
    }

    @Test
    void testPriceReturnsWithMissingPrices() {
        List<Double> returns = analyzer.calculatePriceReturns(Arrays.asList(null, new BigDecimal("100"),
                new BigDecimal("105"), BigDecimal.ZERO, new BigDecimal("10")));

        assertEquals(List.of(0.0, 0.05, -1.0, 0.0), returns);
    }

    @Test
    void testMaxDrawdown() {
        assertEquals(0.25, analyzer.maxDrawdown(curve(100, 120, 90, 110)), 1e-12);
        assertEquals(0, analyzer.maxDrawdown(curve(100, 110, 120)), 1e-12);
    }

    @Test
    void testWinRateAndProfitFactor() {
        List<Double> pnls = List.of(10.0, -5.0, 20.0);

        assertEquals(2.0 / 3, analyzer.winRate(pnls), 1e-12);
        assertEquals(6, analyzer.profitFactor(pnls), 1e-12);
        // 无亏损时有盈利为正无穷，否则为0
        assertEquals(Double.POSITIVE_INFINITY, analyzer.profitFactor(List.of(1.0, 2.0)));
        assertEquals(0, analyzer.profitFactor(List.of(0.0)));
        assertEquals(0, analyzer.winRate(List.of()));
    }

    @Test
    void testVolatilityAndSharpe() {
        // 收益恒定时波动率为0，夏普为0
        List<Double> constant = List.of(0.25, 0.25, 0.25);
        assertEquals(0, analyzer.volatility(constant), 1e-12);
        assertEquals(0, analyzer.sharpeRatio(constant, 0));

        List<Double> returns = List.of(0.01, -0.01);
        assertEquals(0.01 * Math.sqrt(252), analyzer.volatility(returns), 1e-12);
        assertEquals(0, analyzer.volatility(List.of(0.05)));
    }

    @Test
    void testSortino() {
        assertEquals(Double.POSITIVE_INFINITY, analyzer.sortinoRatio(List.of(0.01, 0.02), 0));

        // 下行偏差 = sqrt(0.0001 / 2 × 252)，均值 0.005
        double expected = 0.005 * Math.sqrt(252) / Math.sqrt(0.0001 / 2 * 252);
        assertEquals(expected, analyzer.sortinoRatio(List.of(0.02, -0.01), 0), 1e-9);
        assertEquals(0, analyzer.sortinoRatio(List.of(), 0));
    }

    @Test
    void testTradePnLs() {
        List<Double> pnls = analyzer.calculateTradePnLs(List.of(
                trade(Side.BUY, "10", "100", "1"),
                trade(Side.SELL, "10", "110", "1"),
                trade(Side.BUY, "10", "100", "0"),
                trade(Side.BUY, "10", "120", "0"),
                trade(Side.SELL, "20", "105", "0")
        ));

        // (110-100)×10 - 1；均价110卖在105
        assertEquals(List.of(99.0, -100.0), pnls);
    }

    @Test
    void testBenchmarkStatistics() {
        List<Double> benchmark = List.of(0.01, -0.02, 0.03, 0.0);
        List<Double> doubled = benchmark.stream().map(r -> r * 2).toList();

        assertEquals(2, analyzer.calculateBeta(doubled, benchmark), 1e-9);
        assertEquals(0, analyzer.calculateAlpha(doubled, benchmark, 0), 1e-12);
        assertEquals(0, analyzer.calculateInformationRatio(benchmark, benchmark));
        // 长度不一致
        assertEquals(0, analyzer.calculateBeta(List.of(0.01), benchmark));
    }

    @Test
    void testFullMetrics() {
        List<Trade> trades = List.of(
                trade(Side.BUY, "10", "100", "1"),
                trade(Side.SELL, "10", "110", "1"),
                trade(Side.BUY, "10", "110", "1"),
                trade(Side.SELL, "10", "105", "1")
        );

        PerformanceMetrics metrics = analyzer.calculateMetrics(curve(10000, 10500, 10200, 11000), trades, config);

        assertEquals(0.1, metrics.getTotalReturn(), 1e-12);
        // 区间略短于一年，年化略高于总收益
        assertTrue(metrics.getAnnualizedReturn() > 0.1);
        assertTrue(metrics.getAnnualizedReturn() < 0.101);
        assertEquals(4, metrics.getTotalTrades());
        assertEquals(0.5, metrics.getWinRate(), 1e-12);
        assertEquals(99.0, metrics.getLargestWin(), 1e-9);
        assertEquals(-51.0, metrics.getLargestLoss(), 1e-9);
        assertEquals(24.0, metrics.getAverageTradeReturn(), 1e-9);
        assertEquals(1, metrics.getConsecutiveWins());
        assertEquals(1, metrics.getConsecutiveLosses());
        assertEquals(300.0 / 10500, metrics.getMaxDrawdown(), 1e-12);
        assertEquals(metrics.getAnnualizedReturn() / metrics.getMaxDrawdown(), metrics.getCalmarRatio(), 1e-9);
        assertNull(metrics.getBeta());
        assertNull(metrics.getAlpha());
        assertNull(metrics.getInformationRatio());
    }

    @Test
    void testBenchmarkMetricsPresent() {
        List<EquityPoint> points = curve(10000, 10100, 10050, 10200);
        List<Double> benchmark = List.of(0.005, -0.002, 0.01);

        PerformanceMetrics metrics = analyzer.calculateMetrics(points, List.of(trade(Side.BUY, "1", "100", "0")),
                config, benchmark);

        assertNotNull(metrics.getBeta());
        assertNotNull(metrics.getAlpha());
        assertNotNull(metrics.getInformationRatio());
    }

    @Test
    void testZeroLengthPeriodHasNoAnnualizedReturn() {
        BacktestConfig instant = BacktestConfig.builder()
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .endDate(Instant.parse("2024-01-01T00:00:00Z"))
                .symbol("AAPL")
                .build();

        PerformanceMetrics metrics = analyzer.calculateMetrics(curve(10000, 10100),
                List.of(trade(Side.BUY, "1", "100", "0")), instant);

        assertEquals(0, metrics.getAnnualizedReturn());
        assertEquals(0.01, metrics.getTotalReturn(), 1e-12);
    }
}
