package com.trade.quantlab.indicator;

import com.trade.quantlab.core.Decimal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 布林带（Bollinger Bands），标准差按总体口径计算
 */
public class BOLL {

    private final int period;
    private final BigDecimal stdDevMultiplier;
    private final SMA middleLine;

    public BOLL(int period, BigDecimal stdDevMultiplier) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        if (stdDevMultiplier.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("标准差倍数必须大于0");
        }
        this.period = period;
        this.stdDevMultiplier = stdDevMultiplier;
        this.middleLine = new SMA(period);
    }

    public BOLL(int period) {
        this(period, BigDecimal.valueOf(2)); // 默认2倍标准差
    }

    /**
     * 布林带结果
     */
    public static class BOLLResult {
        public final BigDecimal upper;  // 上轨
        public final BigDecimal middle; // 中轨
        public final BigDecimal lower;  // 下轨

        public BOLLResult(BigDecimal upper, BigDecimal middle, BigDecimal lower) {
            this.upper = upper;
            this.middle = middle;
            this.lower = lower;
        }
    }

    public List<BOLLResult> calculate(List<BigDecimal> prices) {
        List<BigDecimal> middles = middleLine.calculate(prices);
        BigDecimal divisor = BigDecimal.valueOf(period);

        List<BOLLResult> results = new ArrayList<>(middles.size());
        for (int k = 0; k < middles.size(); k++) {
            BigDecimal middle = middles.get(k);

            BigDecimal sumSq = BigDecimal.ZERO;
            for (int i = k; i < k + period; i++) {
                BigDecimal diff = prices.get(i).subtract(middle);
                sumSq = sumSq.add(diff.multiply(diff));
            }
            // 方差为0时 sqrt 返回0，上下轨与中轨重合
            BigDecimal width = Decimal.sqrt(Decimal.divide(sumSq, divisor)).multiply(stdDevMultiplier);

            results.add(new BOLLResult(middle.add(width), middle, middle.subtract(width)));
        }
        return results;
    }

    public BOLLResult latest(List<BigDecimal> prices) {
        List<BOLLResult> results = calculate(prices);
        return results.get(results.size() - 1);
    }

    public int getPeriod() {
        return period;
    }

    @Override
    public String toString() {
        return String.format("BOLL(%d,%.1f)", period, stdDevMultiplier);
    }
}
