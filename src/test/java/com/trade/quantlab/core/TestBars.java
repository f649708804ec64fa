package com.trade.quantlab.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用Bar构造
 */
public final class TestBars {

    public static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    private TestBars() {
    }

    /**
     * 开高低收相同的Bar，成交量100万
     */
    public static MarketData bar(String symbol, Instant time, String close) {
        BigDecimal price = new BigDecimal(close);
        return new MarketData(time, symbol, price, price, price, price, BigDecimal.valueOf(1_000_000));
    }

    public static MarketData bar(String symbol, Instant time, String open, String high, String low,
                                 String close, String volume) {
        return new MarketData(time, symbol, new BigDecimal(open), new BigDecimal(high), new BigDecimal(low),
                new BigDecimal(close), new BigDecimal(volume));
    }

    /**
     * 从 T0 起每分钟一根Bar
     */
    public static List<MarketData> series(String symbol, double... closes) {
        List<MarketData> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            bars.add(bar(symbol, T0.plusSeconds(60L * i), BigDecimal.valueOf(closes[i]).toPlainString()));
        }
        return bars;
    }

    public static List<BigDecimal> prices(double... values) {
        List<BigDecimal> prices = new ArrayList<>(values.length);
        for (double value : values) {
            prices.add(BigDecimal.valueOf(value));
        }
        return prices;
    }
}
