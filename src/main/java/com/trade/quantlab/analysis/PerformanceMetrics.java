package com.trade.quantlab.analysis;

/**
 * 绩效指标
 *
 * 比率类指标用 double 表示，盈亏比与索提诺比率可能为 {@link Double#POSITIVE_INFINITY}。
 * beta / alpha / informationRatio 仅在配置了基准时有值
 */
public class PerformanceMetrics {

    private final double totalReturn;          // 总收益率
    private final double annualizedReturn;     // 年化收益率
    private final double volatility;           // 年化波动率
    private final double sharpeRatio;          // 夏普比率
    private final double sortinoRatio;         // 索提诺比率
    private final double maxDrawdown;          // 最大回撤（0 ~ 1）
    private final double calmarRatio;          // 卡玛比率
    private final double winRate;              // 胜率（0 ~ 1）
    private final double profitFactor;         // 盈亏比
    private final int totalTrades;             // 总成交笔数
    private final double averageTradeReturn;   // 平均每笔盈亏
    private final double averageWin;           // 平均盈利
    private final double averageLoss;          // 平均亏损（负数）
    private final double largestWin;           // 最大盈利
    private final double largestLoss;          // 最大亏损（负数）
    private final int consecutiveWins;         // 最长连胜
    private final int consecutiveLosses;       // 最长连亏
    private final Double beta;
    private final Double alpha;
    private final Double informationRatio;

    private PerformanceMetrics(Builder builder) {
        this.totalReturn = builder.totalReturn;
        this.annualizedReturn = builder.annualizedReturn;
        this.volatility = builder.volatility;
        this.sharpeRatio = builder.sharpeRatio;
        this.sortinoRatio = builder.sortinoRatio;
        this.maxDrawdown = builder.maxDrawdown;
        this.calmarRatio = builder.calmarRatio;
        this.winRate = builder.winRate;
        this.profitFactor = builder.profitFactor;
        this.totalTrades = builder.totalTrades;
        this.averageTradeReturn = builder.averageTradeReturn;
        this.averageWin = builder.averageWin;
        this.averageLoss = builder.averageLoss;
        this.largestWin = builder.largestWin;
        this.largestLoss = builder.largestLoss;
        this.consecutiveWins = builder.consecutiveWins;
        this.consecutiveLosses = builder.consecutiveLosses;
        this.beta = builder.beta;
        this.alpha = builder.alpha;
        this.informationRatio = builder.informationRatio;
    }

    /**
     * 全部为0的指标，用于空输入
     */
    public static PerformanceMetrics empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getTotalReturn() { return totalReturn; }
    public double getAnnualizedReturn() { return annualizedReturn; }
    public double getVolatility() { return volatility; }
    public double getSharpeRatio() { return sharpeRatio; }
    public double getSortinoRatio() { return sortinoRatio; }
    public double getMaxDrawdown() { return maxDrawdown; }
    public double getCalmarRatio() { return calmarRatio; }
    public double getWinRate() { return winRate; }
    public double getProfitFactor() { return profitFactor; }
    public int getTotalTrades() { return totalTrades; }
    public double getAverageTradeReturn() { return averageTradeReturn; }
    public double getAverageWin() { return averageWin; }
    public double getAverageLoss() { return averageLoss; }
    public double getLargestWin() { return largestWin; }
    public double getLargestLoss() { return largestLoss; }
    public int getConsecutiveWins() { return consecutiveWins; }
    public int getConsecutiveLosses() { return consecutiveLosses; }
    public Double getBeta() { return beta; }
    public Double getAlpha() { return alpha; }
    public Double getInformationRatio() { return informationRatio; }

    @Override
    public String toString() {
        return String.format("PerformanceMetrics{totalReturn=%.4f, annualized=%.4f, vol=%.4f, sharpe=%.4f, sortino=%.4f, "
                        + "maxDD=%.4f, calmar=%.4f, winRate=%.4f, profitFactor=%.4f, trades=%d}",
                totalReturn, annualizedReturn, volatility, sharpeRatio, sortinoRatio,
                maxDrawdown, calmarRatio, winRate, profitFactor, totalTrades);
    }

    public static class Builder {
        private double totalReturn;
        private double annualizedReturn;
        private double volatility;
        private double sharpeRatio;
        private double sortinoRatio;
        private double maxDrawdown;
        private double calmarRatio;
        private double winRate;
        private double profitFactor;
        private int totalTrades;
        private double averageTradeReturn;
        private double averageWin;
        private double averageLoss;
        private double largestWin;
        private double largestLoss;
        private int consecutiveWins;
        private int consecutiveLosses;
        private Double beta;
        private Double alpha;
        private Double informationRatio;

        public Builder totalReturn(double totalReturn) {
            this.totalReturn = totalReturn;
            return this;
        }

        public Builder annualizedReturn(double annualizedReturn) {
            this.annualizedReturn = annualizedReturn;
            return this;
        }

        public Builder volatility(double volatility) {
            this.volatility = volatility;
            return this;
        }

        public Builder sharpeRatio(double sharpeRatio) {
            this.sharpeRatio = sharpeRatio;
            return this;
        }

        public Builder sortinoRatio(double sortinoRatio) {
            this.sortinoRatio = sortinoRatio;
            return this;
        }

        public Builder maxDrawdown(double maxDrawdown) {
            this.maxDrawdown = maxDrawdown;
            return this;
        }

        public Builder calmarRatio(double calmarRatio) {
            this.calmarRatio = calmarRatio;
            return this;
        }

        public Builder winRate(double winRate) {
            this.winRate = winRate;
            return this;
        }

        public Builder profitFactor(double profitFactor) {
            this.profitFactor = profitFactor;
            return this;
        }

        public Builder totalTrades(int totalTrades) {
            this.totalTrades = totalTrades;
            return this;
        }

        public Builder averageTradeReturn(double averageTradeReturn) {
            this.averageTradeReturn = averageTradeReturn;
            return this;
        }

        public Builder averageWin(double averageWin) {
            this.averageWin = averageWin;
            return this;
        }

        public Builder averageLoss(double averageLoss) {
            this.averageLoss = averageLoss;
            return this;
        }

        public Builder largestWin(double largestWin) {
            this.largestWin = largestWin;
            return this;
        }

        public Builder largestLoss(double largestLoss) {
            this.largestLoss = largestLoss;
            return this;
        }

        public Builder consecutiveWins(int consecutiveWins) {
            this.consecutiveWins = consecutiveWins;
            return this;
        }

        public Builder consecutiveLosses(int consecutiveLosses) {
            this.consecutiveLosses = consecutiveLosses;
            return this;
        }

        public Builder beta(Double beta) {
            this.beta = beta;
            return this;
        }

        public Builder alpha(Double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder informationRatio(Double informationRatio) {
            this.informationRatio = informationRatio;
            return this;
        }

        public PerformanceMetrics build() {
            return new PerformanceMetrics(this);
        }
    }
}
