package com.trade.quantlab.backtest;

/**
 * 回测引擎状态
 */
public enum EngineState {
    IDLE,        // 空闲
    RUNNING,     // 运行中
    PAUSED,      // 已暂停
    STOPPED,     // 已停止（外部请求）
    COMPLETED,   // 数据耗尽正常结束
    ERRORED      // 运行出错
}
