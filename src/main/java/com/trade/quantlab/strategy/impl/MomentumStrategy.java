package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.strategy.AbstractStrategy;

import java.math.BigDecimal;
import java.util.List;

/**
 * 动量策略
 *
 * 动量 = (当前价 - lookback根前价格) / lookback根前价格
 * - 动量超过阈值且无持仓：买入，权重 = min(0.4, 动量×2)
 * - 动量跌破 -阈值/2 且有持仓：卖出全部
 */
public class MomentumStrategy extends AbstractStrategy {

    private static final BigDecimal MAX_WEIGHT = new BigDecimal("0.4");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final int lookback;
    private final BigDecimal threshold;

    public MomentumStrategy() {
        this(20, 0.05);
    }

    public MomentumStrategy(int lookback, double threshold) {
        super(String.format("动量(%d,%.2f)", lookback, threshold), lookback + 5);
        if (lookback <= 0 || threshold <= 0) {
            throw new IllegalArgumentException("lookback 与 threshold 必须大于0");
        }
        this.lookback = lookback;
        this.threshold = BigDecimal.valueOf(threshold);
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        List<BigDecimal> closes = recordClose(data);
        if (closes.size() < lookback) {
            return List.of();
        }

        BigDecimal current = closes.get(closes.size() - 1);
        BigDecimal reference = closes.get(closes.size() - lookback);
        BigDecimal momentum = Decimal.divide(current.subtract(reference), reference);

        String symbol = data.getSymbol();
        boolean holding = hasPosition(portfolio, symbol);

        if (momentum.compareTo(threshold) > 0 && !holding) {
            return List.of(Signal.buy(symbol, getName())
                    .targetWeight(Decimal.min(MAX_WEIGHT, momentum.multiply(TWO)))
                    .confidence(Decimal.min(BigDecimal.ONE, Decimal.divide(momentum, threshold)))
                    .reason(String.format("正动量: %.2f%% / %d根", momentum.multiply(BigDecimal.valueOf(100)), lookback))
                    .build());
        }

        BigDecimal exitLevel = Decimal.divide(threshold, TWO).negate();
        if (momentum.compareTo(exitLevel) < 0 && holding) {
            return List.of(Signal.sell(symbol, getName())
                    .quantity(positionQuantity(portfolio, symbol))
                    .confidence(Decimal.min(BigDecimal.ONE, Decimal.divide(momentum.abs(), threshold)))
                    .reason(String.format("动量反转: %.2f%% / %d根", momentum.multiply(BigDecimal.valueOf(100)), lookback))
                    .build());
        }

        return List.of();
    }
}
