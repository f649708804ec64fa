package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.indicator.RSI;
import com.trade.quantlab.strategy.AbstractStrategy;

import java.math.BigDecimal;
import java.util.List;

/**
 * RSI均值回归策略
 * RSI低于超卖线且无持仓时买入20%，高于超买线时卖出全部持仓
 */
public class RsiMeanReversionStrategy extends AbstractStrategy {

    private static final BigDecimal ENTRY_WEIGHT = new BigDecimal("0.2");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RSI rsi;
    private final BigDecimal oversold;
    private final BigDecimal overbought;

    public RsiMeanReversionStrategy() {
        this(14, 30, 70);
    }

    public RsiMeanReversionStrategy(int period, double oversold, double overbought) {
        super(String.format("RSI均值回归(%d,%.0f,%.0f)", period, oversold, overbought), period + 10);
        if (oversold >= overbought) {
            throw new IllegalArgumentException("超卖阈值必须小于超买阈值");
        }
        this.rsi = new RSI(period);
        this.oversold = BigDecimal.valueOf(oversold);
        this.overbought = BigDecimal.valueOf(overbought);
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        List<BigDecimal> closes = recordClose(data);
        if (closes.size() < rsi.requiredPrices()) {
            return List.of();
        }

        BigDecimal value = rsi.latest(closes);
        String symbol = data.getSymbol();
        boolean holding = hasPosition(portfolio, symbol);

        if (value.compareTo(oversold) < 0 && !holding) {
            return List.of(Signal.buy(symbol, getName())
                    .targetWeight(ENTRY_WEIGHT)
                    .confidence(Decimal.divide(oversold.subtract(value), oversold))
                    .reason(String.format("RSI超卖: %.2f < %s", value, oversold))
                    .build());
        }

        if (value.compareTo(overbought) > 0 && holding) {
            return List.of(Signal.sell(symbol, getName())
                    .quantity(positionQuantity(portfolio, symbol))
                    .confidence(Decimal.divide(value.subtract(overbought), HUNDRED.subtract(overbought)))
                    .reason(String.format("RSI超买: %.2f > %s", value, overbought))
                    .build());
        }

        return List.of();
    }
}
