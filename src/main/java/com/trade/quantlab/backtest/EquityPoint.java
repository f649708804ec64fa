package com.trade.quantlab.backtest;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 资金曲线上的一个点
 *
 * @param timestamp Bar时间
 * @param value     组合总市值
 * @param drawdown  相对历史峰值的回撤（0 ~ 1）
 */
public record EquityPoint(
        Instant timestamp,
        BigDecimal value,
        BigDecimal drawdown
) {
}
