package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.strategy.Strategy;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 买入持有策略
 * 每个标的首次无持仓时以95%权重买入一次，之后不再交易
 */
public class BuyAndHoldStrategy implements Strategy {

    private static final BigDecimal TARGET_WEIGHT = new BigDecimal("0.95");

    private final Set<String> bought = new HashSet<>();

    @Override
    public String getName() {
        return "买入持有";
    }

    @Override
    public void initialize(List<String> symbols) {
        bought.clear();
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        if (bought.contains(data.getSymbol()) || portfolio.hasPosition(data.getSymbol())) {
            return List.of();
        }
        bought.add(data.getSymbol());
        return List.of(Signal.buy(data.getSymbol(), getName())
                .targetWeight(TARGET_WEIGHT)
                .reason("建仓后持有")
                .build());
    }
}
