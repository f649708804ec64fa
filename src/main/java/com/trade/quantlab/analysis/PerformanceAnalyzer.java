package com.trade.quantlab.analysis;

import com.trade.quantlab.backtest.BacktestConfig;
import com.trade.quantlab.backtest.EquityPoint;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.Trade;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 绩效分析器
 * 基于资金曲线和成交记录计算收益、风险与交易统计，无状态
 *
 * 年化统一按日线假设（252个交易日）处理，与Bar周期无关
 */
public class PerformanceAnalyzer {

    private static final int TRADING_DAYS = 252;
    private static final double DAYS_PER_YEAR = 365.25;
    private static final double DEFAULT_RISK_FREE_RATE = 0.02;

    public PerformanceMetrics calculateMetrics(List<EquityPoint> equityCurve, List<Trade> trades,
                                               BacktestConfig config) {
        return calculateMetrics(equityCurve, trades, config, null);
    }

    /**
     * 计算全部指标
     *
     * @param benchmarkReturns 基准逐Bar收益率，与资金曲线收益率一一对应；为null时不计算基准指标
     */
    public PerformanceMetrics calculateMetrics(List<EquityPoint> equityCurve, List<Trade> trades,
                                               BacktestConfig config, List<Double> benchmarkReturns) {
        if (equityCurve == null || equityCurve.isEmpty() || trades == null || trades.isEmpty()) {
            return PerformanceMetrics.empty();
        }

        double initialCapital = config.getInitialCapital().doubleValue();
        double riskFreeRate = config.getRiskFreeRate() != null
                ? config.getRiskFreeRate().doubleValue()
                : DEFAULT_RISK_FREE_RATE;

        List<Double> returns = calculateReturns(equityCurve);
        List<Double> tradePnLs = calculateTradePnLs(trades);

        double totalReturn = totalReturn(equityCurve, initialCapital);
        double annualizedReturn = annualizedReturn(totalReturn, config);
        double maxDrawdown = maxDrawdown(equityCurve);

        PerformanceMetrics.Builder builder = PerformanceMetrics.builder()
                .totalReturn(totalReturn)
                .annualizedReturn(annualizedReturn)
                .volatility(volatility(returns))
                .sharpeRatio(sharpeRatio(returns, riskFreeRate))
                .sortinoRatio(sortinoRatio(returns, riskFreeRate))
                .maxDrawdown(maxDrawdown)
                .calmarRatio(maxDrawdown == 0 ? 0 : annualizedReturn / maxDrawdown)
                .winRate(winRate(tradePnLs))
                .profitFactor(profitFactor(tradePnLs))
                .totalTrades(trades.size())
                .averageTradeReturn(mean(tradePnLs))
                .averageWin(mean(positives(tradePnLs)))
                .averageLoss(mean(negatives(tradePnLs)))
                .largestWin(positives(tradePnLs).stream().mapToDouble(Double::doubleValue).max().orElse(0))
                .largestLoss(negatives(tradePnLs).stream().mapToDouble(Double::doubleValue).min().orElse(0))
                .consecutiveWins(longestStreak(tradePnLs, true))
                .consecutiveLosses(longestStreak(tradePnLs, false));

        if (benchmarkReturns != null) {
            builder.beta(calculateBeta(returns, benchmarkReturns))
                    .alpha(calculateAlpha(returns, benchmarkReturns, riskFreeRate))
                    .informationRatio(calculateInformationRatio(returns, benchmarkReturns));
        }
        return builder.build();
    }

    /**
     * 相邻资金曲线点之间的简单收益率
     */
    public List<Double> calculateReturns(List<EquityPoint> equityCurve) {
        List<BigDecimal> values = new ArrayList<>(equityCurve.size());
        for (EquityPoint point : equityCurve) {
            values.add(point.value());
        }
        return calculatePriceReturns(values);
    }

    /**
     * 价格序列的简单收益率，缺失价格（null）所在区间记为0
     */
    public List<Double> calculatePriceReturns(List<BigDecimal> prices) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < prices.size(); i++) {
            BigDecimal previous = prices.get(i - 1);
            BigDecimal current = prices.get(i);
            if (previous == null || current == null || previous.signum() == 0) {
                returns.add(0.0);
                continue;
            }
            returns.add((current.doubleValue() - previous.doubleValue()) / previous.doubleValue());
        }
        return returns;
    }

    /**
     * 还原每笔平仓盈亏
     * 按标的顺序回放成交，维护可为负的净头寸和均价；
     * 卖出冲抵多头时记一笔 (卖价 - 均价) × 数量 - 手续费
     */
    List<Double> calculateTradePnLs(List<Trade> trades) {
        Map<String, List<Trade>> bySymbol = new LinkedHashMap<>();
        for (Trade trade : trades) {
            bySymbol.computeIfAbsent(trade.getSymbol(), k -> new ArrayList<>()).add(trade);
        }

        List<Double> pnls = new ArrayList<>();
        for (List<Trade> symbolTrades : bySymbol.values()) {
            BigDecimal position = BigDecimal.ZERO;
            BigDecimal avgPrice = BigDecimal.ZERO;

            for (Trade trade : symbolTrades) {
                if (trade.isBuy()) {
                    if (position.signum() <= 0) {
                        position = position.add(trade.getQuantity());
                        avgPrice = trade.getPrice();
                    } else {
                        BigDecimal totalCost = position.multiply(avgPrice).add(trade.getNotional());
                        position = position.add(trade.getQuantity());
                        avgPrice = Decimal.divide(totalCost, position);
                    }
                } else if (position.signum() > 0) {
                    BigDecimal quantity = Decimal.min(trade.getQuantity(), position);
                    BigDecimal pnl = trade.getPrice().subtract(avgPrice).multiply(quantity)
                            .subtract(trade.getCommission());
                    pnls.add(pnl.doubleValue());
                    position = position.subtract(quantity);
                } else {
                    // 开空
                    position = position.subtract(trade.getQuantity());
                    avgPrice = trade.getPrice();
                }
            }
        }
        return pnls;
    }

    private double totalReturn(List<EquityPoint> equityCurve, double initialCapital) {
        double finalValue = equityCurve.get(equityCurve.size() - 1).value().doubleValue();
        return (finalValue - initialCapital) / initialCapital;
    }

    private double annualizedReturn(double totalReturn, BacktestConfig config) {
        double millis = Duration.between(config.getStartDate(), config.getEndDate()).toMillis();
        double years = millis / (DAYS_PER_YEAR * 24 * 60 * 60 * 1000);
        if (years <= 0) {
            return 0;
        }
        return Math.pow(1 + totalReturn, 1 / years) - 1;
    }

    double volatility(List<Double> returns) {
        if (returns.size() < 2) {
            return 0;
        }
        return Math.sqrt(populationVariance(returns) * TRADING_DAYS);
    }

    double sharpeRatio(List<Double> returns, double riskFreeRate) {
        if (returns.isEmpty()) {
            return 0;
        }
        double volatility = volatility(returns);
        if (volatility == 0) {
            return 0;
        }
        double excess = mean(returns) - dailyRiskFreeRate(riskFreeRate);
        return excess * Math.sqrt(TRADING_DAYS) / volatility;
    }

    /**
     * 下行偏差只统计低于日无风险利率的收益，但按全部样本数平均；
     * 没有下行收益时返回正无穷
     */
    double sortinoRatio(List<Double> returns, double riskFreeRate) {
        if (returns.isEmpty()) {
            return 0;
        }
        double dailyRf = dailyRiskFreeRate(riskFreeRate);

        double downsideSum = 0;
        int downsideCount = 0;
        for (double r : returns) {
            if (r < dailyRf) {
                downsideSum += (r - dailyRf) * (r - dailyRf);
                downsideCount++;
            }
        }
        if (downsideCount == 0) {
            return Double.POSITIVE_INFINITY;
        }

        double downsideDeviation = Math.sqrt(downsideSum / returns.size() * TRADING_DAYS);
        if (downsideDeviation == 0) {
            return 0;
        }
        return (mean(returns) - dailyRf) * Math.sqrt(TRADING_DAYS) / downsideDeviation;
    }

    double maxDrawdown(List<EquityPoint> equityCurve) {
        double peak = equityCurve.get(0).value().doubleValue();
        double maxDrawdown = 0;
        for (EquityPoint point : equityCurve) {
            double value = point.value().doubleValue();
            if (value > peak) {
                peak = value;
            }
            if (peak <= 0) {
                continue;
            }
            double drawdown = (peak - value) / peak;
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    double winRate(List<Double> tradePnLs) {
        if (tradePnLs.isEmpty()) {
            return 0;
        }
        return (double) positives(tradePnLs).size() / tradePnLs.size();
    }

    /**
     * 总盈利 / 总亏损；无亏损时有盈利返回正无穷，否则返回0
     */
    double profitFactor(List<Double> tradePnLs) {
        double grossProfit = positives(tradePnLs).stream().mapToDouble(Double::doubleValue).sum();
        double grossLoss = Math.abs(negatives(tradePnLs).stream().mapToDouble(Double::doubleValue).sum());
        if (grossLoss == 0) {
            return grossProfit > 0 ? Double.POSITIVE_INFINITY : 0;
        }
        return grossProfit / grossLoss;
    }

    /**
     * 协方差 / 基准方差（总体口径），长度不一致或样本不足返回0
     */
    public double calculateBeta(List<Double> strategyReturns, List<Double> benchmarkReturns) {
        if (strategyReturns.size() != benchmarkReturns.size() || strategyReturns.size() < 2) {
            return 0;
        }
        double strategyMean = mean(strategyReturns);
        double benchmarkMean = mean(benchmarkReturns);

        double covariance = 0;
        double benchmarkVariance = 0;
        for (int i = 0; i < strategyReturns.size(); i++) {
            double strategyDiff = strategyReturns.get(i) - strategyMean;
            double benchmarkDiff = benchmarkReturns.get(i) - benchmarkMean;
            covariance += strategyDiff * benchmarkDiff;
            benchmarkVariance += benchmarkDiff * benchmarkDiff;
        }
        covariance /= strategyReturns.size();
        benchmarkVariance /= benchmarkReturns.size();

        return benchmarkVariance == 0 ? 0 : covariance / benchmarkVariance;
    }

    /**
     * 日Alpha = 策略均值 - (日无风险利率 + Beta × (基准均值 - 日无风险利率))
     */
    public double calculateAlpha(List<Double> strategyReturns, List<Double> benchmarkReturns, double riskFreeRate) {
        if (strategyReturns.isEmpty() || benchmarkReturns.isEmpty()) {
            return 0;
        }
        double beta = calculateBeta(strategyReturns, benchmarkReturns);
        double dailyRf = dailyRiskFreeRate(riskFreeRate);
        return mean(strategyReturns) - (dailyRf + beta * (mean(benchmarkReturns) - dailyRf));
    }

    public double calculateInformationRatio(List<Double> strategyReturns, List<Double> benchmarkReturns) {
        if (strategyReturns.size() != benchmarkReturns.size() || strategyReturns.size() < 2) {
            return 0;
        }
        List<Double> excess = new ArrayList<>(strategyReturns.size());
        for (int i = 0; i < strategyReturns.size(); i++) {
            excess.add(strategyReturns.get(i) - benchmarkReturns.get(i));
        }
        double trackingError = Math.sqrt(populationVariance(excess));
        return trackingError == 0 ? 0 : mean(excess) / trackingError;
    }

    private static double dailyRiskFreeRate(double riskFreeRate) {
        return Math.pow(1 + riskFreeRate, 1.0 / TRADING_DAYS) - 1;
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double populationVariance(List<Double> values) {
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / values.size();
    }

    private static List<Double> positives(List<Double> values) {
        return values.stream().filter(v -> v > 0).toList();
    }

    private static List<Double> negatives(List<Double> values) {
        return values.stream().filter(v -> v < 0).toList();
    }

    private static int longestStreak(List<Double> pnls, boolean wins) {
        int longest = 0;
        int current = 0;
        for (double pnl : pnls) {
            if (wins ? pnl > 0 : pnl < 0) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
