package com.trade.quantlab.core;

/**
 * 信号动作
 */
public enum SignalAction {
    BUY,     // 买入
    SELL,    // 卖出
    HOLD;    // 观望，不产生成交

    /**
     * 转换为成交方向，HOLD 无对应方向
     */
    public Side toSide() {
        switch (this) {
            case BUY:
                return Side.BUY;
            case SELL:
                return Side.SELL;
            default:
                throw new IllegalStateException("HOLD 信号没有成交方向");
        }
    }
}
