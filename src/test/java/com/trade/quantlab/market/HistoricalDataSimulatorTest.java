package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.TestBars;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 历史行情回放测试
 */
class HistoricalDataSimulatorTest {

    private static final Instant T1 = TestBars.T0.plusSeconds(60);
    private static final Instant T2 = TestBars.T0.plusSeconds(120);

    private HistoricalDataSimulator unsorted() {
        return new HistoricalDataSimulator(List.of(
                TestBars.bar("MSFT", T2, "30"),
                TestBars.bar("AAPL", T1, "11"),
                TestBars.bar("MSFT", T1, "21"),
                TestBars.bar("AAPL", TestBars.T0, "10")
        ));
    }

    @Test
    void testReplayIsSortedAndStable() {
        HistoricalDataSimulator simulator = unsorted();

        assertEquals(TestBars.T0, simulator.getNextBar().getTimestamp());
        // 同一时间的Bar保持输入顺序
        MarketData second = simulator.getNextBar();
        MarketData third = simulator.getNextBar();
        assertEquals("AAPL", second.getSymbol());
        assertEquals("MSFT", third.getSymbol());
        assertEquals(T2, simulator.getNextBar().getTimestamp());

        assertFalse(simulator.hasMoreData());
        assertNull(simulator.getNextBar());
    }

    @Test
    void testSymbolsInOrderOfAppearance() {
        assertEquals(List.of("AAPL", "MSFT"), unsorted().getSymbols());
    }

    @Test
    void testCurrentTimestamp() {
        HistoricalDataSimulator simulator = unsorted();
        // 未读取时为第一根
        assertEquals(TestBars.T0, simulator.getCurrentTimestamp());

        simulator.getNextBar();
        simulator.getNextBar();
        assertEquals(T1, simulator.getCurrentTimestamp());

        while (simulator.hasMoreData()) {
            simulator.getNextBar();
        }
        assertEquals(T2, simulator.getCurrentTimestamp());
    }

    @Test
    void testReset() {
        HistoricalDataSimulator simulator = unsorted();
        while (simulator.hasMoreData()) {
            simulator.getNextBar();
        }
        simulator.reset();
        assertTrue(simulator.hasMoreData());
        assertEquals(TestBars.T0, simulator.getNextBar().getTimestamp());
    }

    @Test
    void testEmpty() {
        HistoricalDataSimulator simulator = new HistoricalDataSimulator(List.of());
        assertFalse(simulator.hasMoreData());
        assertNull(simulator.getNextBar());
        assertNull(simulator.getCurrentTimestamp());
        assertTrue(simulator.getSymbols().isEmpty());
    }

    @Test
    void testDataInRange() {
        HistoricalDataSimulator simulator = unsorted();

        assertEquals(3, simulator.getDataInRange(T1, T2, null).size());
        List<MarketData> aapl = simulator.getDataInRange(TestBars.T0, T1, List.of("AAPL"));
        assertEquals(2, aapl.size());
        assertTrue(aapl.stream().allMatch(bar -> bar.getSymbol().equals("AAPL")));
        assertEquals(4, simulator.size());
    }
}
