package com.trade.quantlab.backtest;

/**
 * 回测配置无法读取或不完整
 */
public class BacktestConfigException extends RuntimeException {

    public BacktestConfigException(String message) {
        super(message);
    }

    public BacktestConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
