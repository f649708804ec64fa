package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV行情加载
 * 格式：timestamp,symbol,open,high,low,close,volume[,vwap]，首行为表头，时间为ISO-8601
 */
public final class CsvMarketDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(CsvMarketDataLoader.class);

    private CsvMarketDataLoader() {
    }

    public static List<MarketData> load(Path path) throws IOException {
        List<MarketData> bars = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line = reader.readLine(); // header
            if (line == null) {
                return bars;
            }
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < 7) {
                    logger.warn("CSV第{}行字段不足，已跳过: {}", lineNumber, line);
                    continue;
                }
                try {
                    BigDecimal vwap = parts.length > 7 && !parts[7].isBlank() ? new BigDecimal(parts[7].trim()) : null;
                    bars.add(new MarketData(
                            Instant.parse(parts[0].trim()),
                            parts[1].trim(),
                            new BigDecimal(parts[2].trim()),
                            new BigDecimal(parts[3].trim()),
                            new BigDecimal(parts[4].trim()),
                            new BigDecimal(parts[5].trim()),
                            new BigDecimal(parts[6].trim()),
                            vwap
                    ));
                } catch (DateTimeParseException | NumberFormatException e) {
                    logger.warn("CSV第{}行格式错误，已跳过: {} ({})", lineNumber, line, e.getMessage());
                }
            }
        }

        logger.info("加载CSV行情: {} 条 ({})", bars.size(), path);
        return bars;
    }
}
