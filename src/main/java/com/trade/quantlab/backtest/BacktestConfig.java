package com.trade.quantlab.backtest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 回测配置
 */
public class BacktestConfig {

    private final Instant startDate;
    private final Instant endDate;
    private final BigDecimal initialCapital;
    private final List<String> symbols;
    private final BigDecimal commission;       // 手续费率
    private final BigDecimal slippage;         // 滑点率
    private final String benchmarkSymbol;      // 基准标的（可选）
    private final BigDecimal riskFreeRate;     // 年化无风险利率（可选）

    private BacktestConfig(Builder builder) {
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.initialCapital = builder.initialCapital;
        this.symbols = Collections.unmodifiableList(new ArrayList<>(builder.symbols));
        this.commission = builder.commission;
        this.slippage = builder.slippage;
        this.benchmarkSymbol = builder.benchmarkSymbol;
        this.riskFreeRate = builder.riskFreeRate;
    }

    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }
    public BigDecimal getInitialCapital() { return initialCapital; }
    public List<String> getSymbols() { return symbols; }
    public BigDecimal getCommission() { return commission; }
    public BigDecimal getSlippage() { return slippage; }
    public String getBenchmarkSymbol() { return benchmarkSymbol; }
    public BigDecimal getRiskFreeRate() { return riskFreeRate; }

    public boolean hasBenchmark() {
        return benchmarkSymbol != null && !benchmarkSymbol.isBlank();
    }

    /**
     * 时间是否落在回测区间内（含两端）
     */
    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(startDate) && !timestamp.isAfter(endDate);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("BacktestConfig{%s ~ %s, capital=%s, symbols=%s, commission=%s, slippage=%s, benchmark=%s}",
                startDate, endDate, initialCapital, symbols, commission, slippage, benchmarkSymbol);
    }

    public static class Builder {
        private Instant startDate;
        private Instant endDate;
        private BigDecimal initialCapital = BigDecimal.valueOf(10000);  // 默认10000
        private List<String> symbols = new ArrayList<>();
        private BigDecimal commission = new BigDecimal("0.001");        // 0.1% 手续费
        private BigDecimal slippage = new BigDecimal("0.001");          // 0.1% 滑点
        private String benchmarkSymbol;
        private BigDecimal riskFreeRate;

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder initialCapital(BigDecimal capital) {
            this.initialCapital = capital;
            return this;
        }

        public Builder symbols(List<String> symbols) {
            this.symbols = new ArrayList<>(symbols);
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbols.add(symbol);
            return this;
        }

        public Builder commission(BigDecimal commission) {
            this.commission = commission;
            return this;
        }

        public Builder slippage(BigDecimal slippage) {
            this.slippage = slippage;
            return this;
        }

        public Builder benchmarkSymbol(String benchmarkSymbol) {
            this.benchmarkSymbol = benchmarkSymbol;
            return this;
        }

        public Builder riskFreeRate(BigDecimal riskFreeRate) {
            this.riskFreeRate = riskFreeRate;
            return this;
        }

        public BacktestConfig build() {
            if (startDate == null || endDate == null || initialCapital == null) {
                throw new IllegalStateException("startDate, endDate, initialCapital 必须设置");
            }
            if (symbols == null || symbols.isEmpty()) {
                throw new IllegalStateException("symbols 不能为空");
            }
            if (startDate.isAfter(endDate)) {
                throw new IllegalArgumentException("startDate 不能晚于 endDate");
            }
            if (initialCapital.signum() <= 0) {
                throw new IllegalArgumentException("initialCapital 必须大于0");
            }
            if (commission == null || commission.signum() < 0) {
                throw new IllegalArgumentException("commission 不能为负");
            }
            if (slippage == null || slippage.signum() < 0) {
                throw new IllegalArgumentException("slippage 不能为负");
            }
            return new BacktestConfig(this);
        }
    }
}
