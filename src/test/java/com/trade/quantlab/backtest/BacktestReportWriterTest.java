package com.trade.quantlab.backtest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.quantlab.core.TestBars;
import com.trade.quantlab.market.HistoricalDataSimulator;
import com.trade.quantlab.strategy.impl.BuyAndHoldStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON报告导出测试
 */
class BacktestReportWriterTest {

    @TempDir
    Path tempDir;

    private BacktestResult runBuyAndHold() throws BacktestException {
        BacktestConfig config = BacktestConfig.builder()
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .endDate(Instant.parse("2024-12-31T00:00:00Z"))
                .symbol("AAPL")
                .build();
        HistoricalDataSimulator simulator = new HistoricalDataSimulator(TestBars.series("AAPL", 100, 102, 101, 105));
        return new BacktestEngine(config, new BuyAndHoldStrategy(), simulator).run();
    }

    @Test
    void testWrite() throws Exception {
        BacktestResult result = runBuyAndHold();
        Path output = tempDir.resolve("reports/result.json");

        new BacktestReportWriter().write(result, output);

        assertTrue(Files.exists(output));
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("AAPL", root.path("config").path("symbols").get(0).asText());
        assertEquals("2024-01-01T00:00:00Z", root.path("config").path("startDate").asText());
        assertEquals(1, root.path("trades").size());
        assertEquals("BUY", root.path("trades").get(0).path("side").asText());
        assertEquals(4, root.path("equityCurve").size());
        assertEquals(1, root.path("portfolio").path("positions").size());
        assertEquals(1, root.path("metrics").path("totalTrades").asInt());
    }

    @Test
    void testToJson() throws BacktestException, IOException {
        String json = new BacktestReportWriter().toJson(runBuyAndHold());

        JsonNode root = new ObjectMapper().readTree(json);
        assertTrue(root.has("metrics"));
        assertTrue(root.path("equityCurve").get(0).has("drawdown"));
    }
}
