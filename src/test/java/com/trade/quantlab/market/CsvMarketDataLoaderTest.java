package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CSV行情加载测试
 */
class CsvMarketDataLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoad() throws IOException {
        Path file = tempDir.resolve("bars.csv");
        Files.writeString(file, String.join("\n",
                "timestamp,symbol,open,high,low,close,volume,vwap",
                "2024-01-01T00:00:00Z,AAPL,100,101,99,100.5,1000,100.2",
                "",
                "2024-01-01T00:01:00Z,AAPL,100.5,102,100,101,1200",
                "2024-01-01T00:02:00Z,AAPL,101",
                "2024-01-01T00:03:00Z,AAPL,abc,102,100,101,1200",
                "not-a-time,AAPL,100,101,99,100,1000"
        ), StandardCharsets.UTF_8);

        List<MarketData> bars = CsvMarketDataLoader.load(file);

        // 空行、字段不足与格式错误的行被跳过
        assertEquals(2, bars.size());
        MarketData first = bars.get(0);
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), first.getTimestamp());
        assertEquals("AAPL", first.getSymbol());
        assertEquals(0, new BigDecimal("100.5").compareTo(first.getClose()));
        assertEquals(0, new BigDecimal("100.2").compareTo(first.getVwap()));
        assertNull(bars.get(1).getVwap());
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "");
        assertTrue(CsvMarketDataLoader.load(file).isEmpty());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> CsvMarketDataLoader.load(tempDir.resolve("missing.csv")));
    }
}
