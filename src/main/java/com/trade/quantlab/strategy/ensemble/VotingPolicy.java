package com.trade.quantlab.strategy.ensemble;

import com.trade.quantlab.core.Signal;

import java.util.List;

/**
 * 多个子策略信号的合并规则
 */
public interface VotingPolicy {

    /**
     * @param signals    同一标的同一根Bar上各子策略给出的信号
     * @param symbol     标的
     * @param strategyId 合并后信号使用的策略标识
     * @return 合并后的信号，可能为空
     */
    List<Signal> combine(List<Signal> signals, String symbol, String strategyId);
}
