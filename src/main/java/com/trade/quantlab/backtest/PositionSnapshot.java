package com.trade.quantlab.backtest;

import java.time.Instant;
import java.util.List;

/**
 * 某根Bar处理完后的持仓快照，持仓为独立副本
 */
public record PositionSnapshot(
        Instant timestamp,
        List<Position> positions
) {
}
