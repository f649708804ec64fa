package com.trade.quantlab.indicator;

import java.math.BigDecimal;
import java.util.List;

/**
 * 技术指标接口
 */
public interface Indicator {

    /**
     * 计算指标序列
     * @param prices 价格序列（按时间正序）
     * @return 指标值序列，第一个值对应第一个完整窗口
     */
    List<BigDecimal> calculate(List<BigDecimal> prices);

    /**
     * 最新指标值
     */
    default BigDecimal latest(List<BigDecimal> prices) {
        List<BigDecimal> values = calculate(prices);
        return values.get(values.size() - 1);
    }

    /**
     * 计算所需的最少价格数量
     */
    int requiredPrices();

    String getName();
}
