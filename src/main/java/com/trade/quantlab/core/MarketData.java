package com.trade.quantlab.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 行情Bar（OHLCV）
 * 生成后不可变
 */
public final class MarketData {
    private final Instant timestamp;        // Bar时间
    private final String symbol;            // 标的
    private final BigDecimal open;          // 开盘价
    private final BigDecimal high;          // 最高价
    private final BigDecimal low;           // 最低价
    private final BigDecimal close;         // 收盘价
    private final BigDecimal volume;        // 成交量
    private final BigDecimal vwap;          // 成交均价（可选）

    public MarketData(Instant timestamp, String symbol,
                      BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                      BigDecimal volume, BigDecimal vwap) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.open = Objects.requireNonNull(open, "open");
        this.high = Objects.requireNonNull(high, "high");
        this.low = Objects.requireNonNull(low, "low");
        this.close = Objects.requireNonNull(close, "close");
        this.volume = Objects.requireNonNull(volume, "volume");
        this.vwap = vwap;
    }

    public MarketData(Instant timestamp, String symbol,
                      BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                      BigDecimal volume) {
        this(timestamp, symbol, open, high, low, close, volume, null);
    }

    public Instant getTimestamp() { return timestamp; }
    public String getSymbol() { return symbol; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }
    public BigDecimal getVwap() { return vwap; }

    /**
     * 振幅占收盘价比例 (high - low) / close
     */
    public BigDecimal getRangeRatio() {
        return Decimal.divide(high.subtract(low), close);
    }

    /**
     * 涨跌幅（百分比）
     */
    public BigDecimal getChangePercent() {
        return Decimal.percentChange(open, close);
    }

    @Override
    public String toString() {
        return String.format("MarketData{symbol=%s, time=%s, OHLC=[%s,%s,%s,%s], vol=%s}",
                symbol, timestamp, open, high, low, close, volume);
    }
}
