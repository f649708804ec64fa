package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.indicator.SMA;
import com.trade.quantlab.strategy.AbstractStrategy;

import java.math.BigDecimal;
import java.util.List;

/**
 * 双均线交叉策略
 *
 * 逻辑：
 * - 前一根短均线 <= 长均线，当前短均线 > 长均线 -> 金叉，无持仓时买入30%
 * - 前一根短均线 >= 长均线，当前短均线 < 长均线 -> 死叉，卖出全部持仓
 * - 置信度 = |短均线 - 长均线| / 长均线
 */
public class SmaCrossoverStrategy extends AbstractStrategy {

    private static final BigDecimal ENTRY_WEIGHT = new BigDecimal("0.3");

    private final int shortPeriod;
    private final int longPeriod;
    private final SMA shortSMA;
    private final SMA longSMA;

    public SmaCrossoverStrategy() {
        this(10, 30);
    }

    public SmaCrossoverStrategy(int shortPeriod, int longPeriod) {
        super(String.format("均线交叉(%d,%d)", shortPeriod, longPeriod), Math.max(shortPeriod, longPeriod) + 1);
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.shortSMA = new SMA(shortPeriod);
        this.longSMA = new SMA(longPeriod);
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        List<BigDecimal> closes = recordClose(data);
        // 需要前后两个完整窗口
        if (closes.size() < Math.max(shortPeriod, longPeriod) + 1) {
            return List.of();
        }

        List<BigDecimal> shortValues = shortSMA.calculate(closes);
        List<BigDecimal> longValues = longSMA.calculate(closes);
        BigDecimal shortNow = shortValues.get(shortValues.size() - 1);
        BigDecimal shortPrev = shortValues.get(shortValues.size() - 2);
        BigDecimal longNow = longValues.get(longValues.size() - 1);
        BigDecimal longPrev = longValues.get(longValues.size() - 2);

        String symbol = data.getSymbol();
        boolean holding = hasPosition(portfolio, symbol);
        BigDecimal confidence = Decimal.divide(shortNow.subtract(longNow).abs(), longNow);

        if (shortPrev.compareTo(longPrev) <= 0 && shortNow.compareTo(longNow) > 0 && !holding) {
            return List.of(Signal.buy(symbol, getName())
                    .targetWeight(ENTRY_WEIGHT)
                    .confidence(confidence)
                    .reason(String.format("金叉: SMA%d(%.2f) > SMA%d(%.2f)", shortPeriod, shortNow, longPeriod, longNow))
                    .build());
        }

        if (shortPrev.compareTo(longPrev) >= 0 && shortNow.compareTo(longNow) < 0 && holding) {
            return List.of(Signal.sell(symbol, getName())
                    .quantity(positionQuantity(portfolio, symbol))
                    .confidence(confidence)
                    .reason(String.format("死叉: SMA%d(%.2f) < SMA%d(%.2f)", shortPeriod, shortNow, longPeriod, longNow))
                    .build());
        }

        return List.of();
    }
}
