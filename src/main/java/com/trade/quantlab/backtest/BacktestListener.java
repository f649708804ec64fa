package com.trade.quantlab.backtest;

import com.trade.quantlab.core.Trade;

/**
 * 回测事件监听
 * 所有回调都在回测线程上按发生顺序同步调用
 */
public interface BacktestListener {

    default void onStarted(BacktestConfig config) {
    }

    /**
     * 每处理1000根Bar回调一次
     */
    default void onProgress(BacktestProgress progress) {
    }

    default void onTrade(Trade trade) {
    }

    default void onPaused() {
    }

    default void onResumed() {
    }

    default void onStopped() {
    }

    default void onCompleted(BacktestResult result) {
    }

    default void onError(Throwable error) {
    }
}
