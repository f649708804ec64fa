package com.trade.quantlab.strategy.impl;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.Trade;
import com.trade.quantlab.strategy.Strategy;
import com.trade.quantlab.strategy.ensemble.MajorityVotingPolicy;
import com.trade.quantlab.strategy.ensemble.VotingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 多因子组合策略
 * 每根Bar收集全部子策略的信号，交给表决规则合并
 */
public class MultiFactorStrategy implements Strategy {

    private static final Logger logger = LoggerFactory.getLogger(MultiFactorStrategy.class);

    private final List<Strategy> strategies;
    private final VotingPolicy votingPolicy;

    public MultiFactorStrategy() {
        this(List.of(
                new SmaCrossoverStrategy(10, 30),
                new RsiMeanReversionStrategy(14, 25, 75),
                new MomentumStrategy(20, 0.03)
        ), new MajorityVotingPolicy());
    }

    public MultiFactorStrategy(List<Strategy> strategies, VotingPolicy votingPolicy) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个子策略");
        }
        this.strategies = List.copyOf(strategies);
        this.votingPolicy = votingPolicy;
    }

    @Override
    public String getName() {
        return "多因子";
    }

    @Override
    public void initialize(List<String> symbols) {
        for (Strategy strategy : strategies) {
            strategy.initialize(symbols);
        }
        logger.info("多因子策略初始化，子策略: {}", strategies.stream().map(Strategy::getName).toList());
    }

    @Override
    public List<Signal> onBar(MarketData data, Portfolio portfolio) {
        List<Signal> collected = new ArrayList<>();
        for (Strategy strategy : strategies) {
            collected.addAll(strategy.onBar(data, portfolio));
        }
        if (collected.isEmpty()) {
            return List.of();
        }
        return votingPolicy.combine(collected, data.getSymbol(), getName());
    }

    @Override
    public void onTrade(Trade trade, Portfolio portfolio) {
        for (Strategy strategy : strategies) {
            strategy.onTrade(trade, portfolio);
        }
    }

    @Override
    public void finish(Portfolio portfolio) {
        for (Strategy strategy : strategies) {
            strategy.finish(portfolio);
        }
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }
}
