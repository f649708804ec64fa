package com.trade.quantlab.indicator;

import com.trade.quantlab.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 相对强弱指标（Relative Strength Index），Wilder平滑
 */
public class RSI implements Indicator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int period;

    public RSI(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> prices) {
        if (prices.size() < period + 1) {
            throw new IllegalArgumentException("价格数量不足，需要至少 " + (period + 1) + " 个数据点");
        }

        BigDecimal periodValue = BigDecimal.valueOf(period);
        BigDecimal smoothing = BigDecimal.valueOf(period - 1);

        // 首个窗口取简单平均
        BigDecimal avgGain = BigDecimal.ZERO;
        BigDecimal avgLoss = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            BigDecimal change = prices.get(i).subtract(prices.get(i - 1));
            avgGain = avgGain.add(gain(change));
            avgLoss = avgLoss.add(loss(change));
        }
        avgGain = Decimal.divide(avgGain, periodValue);
        avgLoss = Decimal.divide(avgLoss, periodValue);

        List<BigDecimal> values = new ArrayList<>(prices.size() - period);
        values.add(toRsi(avgGain, avgLoss));

        for (int i = period + 1; i < prices.size(); i++) {
            BigDecimal change = prices.get(i).subtract(prices.get(i - 1));
            avgGain = Decimal.divide(avgGain.multiply(smoothing).add(gain(change)), periodValue);
            avgLoss = Decimal.divide(avgLoss.multiply(smoothing).add(loss(change)), periodValue);
            values.add(toRsi(avgGain, avgLoss));
        }
        return values;
    }

    private static BigDecimal gain(BigDecimal change) {
        return change.signum() > 0 ? change : BigDecimal.ZERO;
    }

    private static BigDecimal loss(BigDecimal change) {
        return change.signum() < 0 ? change.negate() : BigDecimal.ZERO;
    }

    private static BigDecimal toRsi(BigDecimal avgGain, BigDecimal avgLoss) {
        if (avgLoss.signum() == 0) {
            return HUNDRED;
        }
        BigDecimal rs = Decimal.divide(avgGain, avgLoss);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), 4, RoundingMode.HALF_UP));
    }

    @Override
    public int requiredPrices() {
        return period + 1;
    }

    @Override
    public String getName() {
        return "RSI-" + period;
    }
}
