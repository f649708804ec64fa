package com.trade.quantlab.execution;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.Trade;

import java.math.BigDecimal;

/**
 * 成交模型
 * 把交易信号转换为带滑点和手续费的模拟成交
 */
public interface ExecutionModel {

    /**
     * 执行信号
     * @return 模拟成交，HOLD信号或数量不足时返回null
     */
    Trade executeSignal(Signal signal, MarketData data, Portfolio portfolio);

    /**
     * 单位价格滑点
     */
    BigDecimal calculateSlippage(Signal signal, MarketData data);

    /**
     * 手续费
     */
    BigDecimal calculateCommission(BigDecimal quantity, BigDecimal price);

    /**
     * 每根区间内的Bar在策略运行前回调，用于维护成交模型自身的行情历史
     */
    default void onMarketData(MarketData data) {
        // 默认空实现
    }

    /**
     * 清空成交模型自身维护的状态，引擎重置时调用
     */
    default void reset() {
        // 默认空实现
    }
}
