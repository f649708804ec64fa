package com.trade.quantlab.core;

/**
 * 成交方向
 */
public enum Side {
    BUY("买入"),
    SELL("卖出");

    private final String chineseName;

    Side(String chineseName) {
        this.chineseName = chineseName;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public String getChineseName() {
        return chineseName;
    }
}
