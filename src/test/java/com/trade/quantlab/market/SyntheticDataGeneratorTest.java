package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 合成行情生成测试
 */
class SyntheticDataGeneratorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testZeroVolatilityKeepsPriceConstant() {
        List<MarketData> data = SyntheticDataGenerator.generateOHLCData("AAPL", START, START.plusSeconds(9 * 60),
                1, 100, 0, 0, 1_000_000, new Random(1));

        // 起止时间都包含在内
        assertEquals(10, data.size());
        for (MarketData bar : data) {
            assertEquals(0, BigDecimal.valueOf(100).compareTo(bar.getClose()));
            assertEquals(0, bar.getHigh().compareTo(bar.getLow()));
        }
    }

    @Test
    void testOhlcConsistency() {
        List<MarketData> data = SyntheticDataGenerator.generateOHLCData("AAPL", START, START.plusSeconds(3600),
                1, 100, 0.5, 0.1, 1_000_000, new Random(7));

        MarketData previous = null;
        for (MarketData bar : data) {
            assertTrue(bar.getHigh().compareTo(bar.getOpen().max(bar.getClose())) >= 0);
            assertTrue(bar.getLow().compareTo(bar.getOpen().min(bar.getClose())) <= 0);
            assertTrue(bar.getVolume().signum() >= 0);
            assertNotNull(bar.getVwap());
            if (previous != null) {
                // 开盘价等于上一根收盘价
                assertEquals(0, previous.getClose().compareTo(bar.getOpen()));
                assertTrue(bar.getTimestamp().isAfter(previous.getTimestamp()));
            }
            previous = bar;
        }
    }

    @Test
    void testSeedIsReproducible() {
        List<MarketData> first = SyntheticDataGenerator.generateOHLCData("AAPL", START, START.plusSeconds(600),
                1, 100, 0.3, 0, 1_000_000, new Random(42));
        List<MarketData> second = SyntheticDataGenerator.generateOHLCData("AAPL", START, START.plusSeconds(600),
                1, 100, 0.3, 0, 1_000_000, new Random(42));

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(0, first.get(i).getClose().compareTo(second.get(i).getClose()));
        }
    }

    @Test
    void testCorrelatedData() {
        List<String> symbols = List.of("AAPL", "MSFT");
        double[][] correlation = {{1, 0.8}, {0.8, 1}};

        List<MarketData> data = SyntheticDataGenerator.generateCorrelatedData(symbols, START, START.plusSeconds(540),
                correlation, new double[]{100, 200}, new double[]{0.2, 0.3}, new double[]{0, 0}, 1, new Random(3));

        assertEquals(20, data.size());
        for (int i = 1; i < data.size(); i++) {
            assertFalse(data.get(i).getTimestamp().isBefore(data.get(i - 1).getTimestamp()));
        }
        assertEquals(10, data.stream().filter(bar -> bar.getSymbol().equals("MSFT")).count());
    }

    @Test
    void testCorrelatedDimensionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> SyntheticDataGenerator.generateCorrelatedData(
                List.of("AAPL", "MSFT"), START, START.plusSeconds(60),
                new double[][]{{1, 0}, {0, 1}}, new double[]{100}, new double[]{0.2, 0.2}, new double[]{0, 0}, 1));
    }

    @Test
    void testNonPositiveDefiniteMatrix() {
        // 完全相关的矩阵不能做Cholesky分解
        assertThrows(IllegalArgumentException.class,
                () -> SyntheticDataGenerator.choleskyDecomposition(new double[][]{{1, 1}, {1, 1}}));
    }

    @Test
    void testCholesky() {
        double[][] lower = SyntheticDataGenerator.choleskyDecomposition(new double[][]{{1, 0.5}, {0.5, 1}});

        assertEquals(1, lower[0][0], 1e-12);
        assertEquals(0, lower[0][1], 1e-12);
        assertEquals(0.5, lower[1][0], 1e-12);
        assertEquals(Math.sqrt(0.75), lower[1][1], 1e-12);
    }

    @Test
    void testNormalRandomMoments() {
        Random random = new Random(11);
        int n = 20_000;
        double sum = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double z = SyntheticDataGenerator.normalRandom(random);
            sum += z;
            sumSq += z * z;
        }
        double mean = sum / n;
        assertEquals(0, mean, 0.05);
        assertEquals(1, sumSq / n - mean * mean, 0.05);
    }

    @Test
    void testCrashScenarioPhasesAreContinuous() {
        Instant crashStart = START.plusSeconds(600);
        Instant crashEnd = START.plusSeconds(1200);
        Instant recoveryEnd = START.plusSeconds(1800);

        List<MarketData> data = SyntheticDataGenerator.generateCrashScenario("AAPL", START, crashStart, crashEnd,
                recoveryEnd, 0.3, 1, new Random(5));

        // 三段各11根，边界时间点重复出现
        assertEquals(33, data.size());
        assertEquals(0, data.get(10).getClose().compareTo(data.get(11).getOpen()));
        assertEquals(data.get(10).getTimestamp(), data.get(11).getTimestamp());
        assertEquals(0, data.get(21).getClose().compareTo(data.get(22).getOpen()));
    }

    @Test
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> SyntheticDataGenerator.generateOHLCData(
                "AAPL", START, START.plusSeconds(60), 0, 100, 0.2, 0, 1_000_000));
    }
}
