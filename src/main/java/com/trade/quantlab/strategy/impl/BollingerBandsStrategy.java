package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.indicator.BOLL;
import com.trade.quantlab.strategy.AbstractStrategy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 布林带策略
 *
 * - 收盘价 <= 下轨且无持仓：买入，权重 = min(0.3, 偏离度×5)，偏离度 = (下轨 - 价格) / 中轨
 * - 收盘价 >= 上轨且有持仓：卖出全部
 * - 持仓中价格回到中轨1%以内：卖出一半止盈
 */
public class BollingerBandsStrategy extends AbstractStrategy {

    private static final BigDecimal MAX_WEIGHT = new BigDecimal("0.3");
    private static final BigDecimal WEIGHT_SCALE = BigDecimal.valueOf(5);
    private static final BigDecimal MIDDLE_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal PARTIAL_FRACTION = new BigDecimal("0.5");

    private final BOLL boll;

    public BollingerBandsStrategy() {
        this(20, 2);
    }

    public BollingerBandsStrategy(int period, double stdMultiplier) {
        super(String.format("布林带(%d,%.1f)", period, stdMultiplier), period + 5);
        this.boll = new BOLL(period, BigDecimal.valueOf(stdMultiplier));
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        List<BigDecimal> closes = recordClose(data);
        if (closes.size() < boll.getPeriod()) {
            return List.of();
        }

        BOLL.BOLLResult bands = boll.latest(closes);
        BigDecimal price = data.getClose();
        String symbol = data.getSymbol();
        boolean holding = hasPosition(portfolio, symbol);
        List<Signal> signals = new ArrayList<>();

        if (price.compareTo(bands.lower) <= 0 && !holding) {
            BigDecimal distance = Decimal.divide(bands.lower.subtract(price), bands.middle);
            signals.add(Signal.buy(symbol, getName())
                    .targetWeight(Decimal.min(MAX_WEIGHT, distance.multiply(WEIGHT_SCALE)))
                    .confidence(distance)
                    .reason(String.format("跌破下轨: %.2f <= %.2f", price, bands.lower))
                    .build());
        }

        if (price.compareTo(bands.upper) >= 0 && holding) {
            signals.add(Signal.sell(symbol, getName())
                    .quantity(positionQuantity(portfolio, symbol))
                    .confidence(Decimal.divide(price.subtract(bands.upper), bands.middle))
                    .reason(String.format("突破上轨: %.2f >= %.2f", price, bands.upper))
                    .build());
        }

        BigDecimal deviation = Decimal.divide(price.subtract(bands.middle).abs(), bands.middle);
        if (holding && deviation.compareTo(MIDDLE_TOLERANCE) < 0) {
            signals.add(Signal.sell(symbol, getName())
                    .quantity(Decimal.floorUnits(positionQuantity(portfolio, symbol).multiply(PARTIAL_FRACTION)))
                    .confidence(PARTIAL_FRACTION)
                    .reason("回归中轨，部分止盈")
                    .build());
        }

        return signals;
    }
}
