package com.trade.quantlab.strategy;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.Trade;

import java.util.List;

/**
 * 策略接口
 *
 * 职责：
 * 1. 维护自身的指标状态
 * 2. 逐Bar产出交易信号
 *
 * 策略只读取组合，不修改组合，所有交易意图都通过信号表达
 */
public interface Strategy {

    /**
     * 策略名称，同时作为信号和成交的策略ID
     */
    String getName();

    /**
     * 处理一根Bar
     * @param data 当前Bar
     * @param portfolio 当前组合（只读）
     * @return 交易信号，无信号返回空列表
     */
    List<Signal> onBar(MarketData data, Portfolio portfolio);

    /**
     * 回测开始前调用
     */
    default void initialize(List<String> symbols) {
        // 默认空实现
    }

    /**
     * 成交回调
     */
    default void onTrade(Trade trade, Portfolio portfolio) {
        // 默认空实现
    }

    /**
     * 回测结束后调用
     */
    default void finish(Portfolio portfolio) {
        // 默认空实现
    }
}
