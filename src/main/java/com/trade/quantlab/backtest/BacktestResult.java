package com.trade.quantlab.backtest;

import com.trade.quantlab.analysis.PerformanceMetrics;
import com.trade.quantlab.core.Trade;

import java.util.List;

/**
 * 回测结果
 */
public class BacktestResult {

    private final BacktestConfig config;
    private final Portfolio portfolio;                  // 最终组合（副本）
    private final PerformanceMetrics metrics;           // 绩效指标
    private final List<EquityPoint> equityCurve;        // 资金曲线
    private final List<Trade> trades;                   // 全部成交
    private final List<PositionSnapshot> positions;     // 逐Bar持仓快照
    private final List<Double> strategyReturns;         // 逐Bar收益率
    private final List<Double> benchmarkReturns;        // 基准逐Bar收益率（未配置基准时为null）

    public BacktestResult(BacktestConfig config, Portfolio portfolio, PerformanceMetrics metrics,
                          List<EquityPoint> equityCurve, List<Trade> trades,
                          List<PositionSnapshot> positions, List<Double> strategyReturns,
                          List<Double> benchmarkReturns) {
        this.config = config;
        this.portfolio = portfolio;
        this.metrics = metrics;
        this.equityCurve = equityCurve;
        this.trades = trades;
        this.positions = positions;
        this.strategyReturns = strategyReturns;
        this.benchmarkReturns = benchmarkReturns;
    }

    public BacktestConfig getConfig() { return config; }
    public Portfolio getPortfolio() { return portfolio; }
    public PerformanceMetrics getMetrics() { return metrics; }
    public List<EquityPoint> getEquityCurve() { return equityCurve; }
    public List<Trade> getTrades() { return trades; }
    public List<PositionSnapshot> getPositions() { return positions; }
    public List<Double> getStrategyReturns() { return strategyReturns; }
    public List<Double> getBenchmarkReturns() { return benchmarkReturns; }

    @Override
    public String toString() {
        StringBuilder report = new StringBuilder(String.format(
                """
                ==================== 回测结果 ====================
                回测区间:        %s ~ %s
                初始资金:        %.2f
                最终市值:        %.2f
                现金:            %.2f
                持仓数:          %d

                收益与风险:
                  总收益率:      %.2f%%
                  年化收益率:    %.2f%%
                  年化波动率:    %.2f%%
                  最大回撤:      %.2f%%
                  夏普比率:      %.2f
                  索提诺比率:    %.2f
                  卡玛比率:      %.2f

                交易统计:
                  总成交笔数:    %d
                  胜率:          %.2f%%
                  盈亏比:        %.2f
                  平均每笔盈亏:  %.2f
                  平均盈利:      %.2f
                  平均亏损:      %.2f
                  最大盈利:      %.2f
                  最大亏损:      %.2f
                  最长连胜:      %d
                  最长连亏:      %d
                """,
                config.getStartDate(), config.getEndDate(),
                config.getInitialCapital(), portfolio.getTotalValue(), portfolio.getCash(),
                portfolio.getPositions().size(),
                metrics.getTotalReturn() * 100, metrics.getAnnualizedReturn() * 100,
                metrics.getVolatility() * 100, metrics.getMaxDrawdown() * 100,
                metrics.getSharpeRatio(), metrics.getSortinoRatio(), metrics.getCalmarRatio(),
                metrics.getTotalTrades(), metrics.getWinRate() * 100, metrics.getProfitFactor(),
                metrics.getAverageTradeReturn(), metrics.getAverageWin(), metrics.getAverageLoss(),
                metrics.getLargestWin(), metrics.getLargestLoss(),
                metrics.getConsecutiveWins(), metrics.getConsecutiveLosses()
        ));

        if (metrics.getBeta() != null) {
            report.append(String.format(
                    """

                    基准对比(%s):
                      Beta:          %.4f
                      Alpha(日):     %.6f
                      信息比率:      %.4f
                    """,
                    config.getBenchmarkSymbol(), metrics.getBeta(), metrics.getAlpha(), metrics.getInformationRatio()));
        }
        report.append("================================================\n");
        return report.toString();
    }
}
