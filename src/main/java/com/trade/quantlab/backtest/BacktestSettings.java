package com.trade.quantlab.backtest;

import com.trade.quantlab.core.Interval;

import java.nio.file.Path;

/**
 * 配置文件解析结果：回测参数 + 合成行情参数 + 报告输出路径
 */
public class BacktestSettings {

    private final BacktestConfig config;
    private final Interval interval;          // 合成行情Bar周期
    private final double initialPrice;        // 合成行情起始价
    private final double volatility;          // 年化波动率
    private final double trend;               // 年化漂移
    private final Long seed;                  // 随机种子，为null时不固定
    private final Path reportOutput;          // JSON报告路径，为null时不输出

    public BacktestSettings(BacktestConfig config, Interval interval, double initialPrice,
                            double volatility, double trend, Long seed, Path reportOutput) {
        this.config = config;
        this.interval = interval;
        this.initialPrice = initialPrice;
        this.volatility = volatility;
        this.trend = trend;
        this.seed = seed;
        this.reportOutput = reportOutput;
    }

    public BacktestConfig getConfig() { return config; }
    public Interval getInterval() { return interval; }
    public double getInitialPrice() { return initialPrice; }
    public double getVolatility() { return volatility; }
    public double getTrend() { return trend; }
    public Long getSeed() { return seed; }
    public Path getReportOutput() { return reportOutput; }

    public boolean hasReportOutput() {
        return reportOutput != null;
    }
}
