package com.trade.quantlab.backtest;

/**
 * 回测运行异常
 * 行情源、策略或执行模型抛出的异常被包装后由 {@link BacktestEngine#run} 抛出
 */
public class BacktestException extends Exception {

    public BacktestException(String message) {
        super(message);
    }

    public BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
