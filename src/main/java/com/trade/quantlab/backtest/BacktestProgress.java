package com.trade.quantlab.backtest;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 回测进度
 */
public record BacktestProgress(
        Instant currentTimestamp,
        BigDecimal portfolioValue,
        BigDecimal totalPnL,
        long barsProcessed,
        EngineState state
) {
}
