package com.trade.quantlab.indicator;

import com.trade.quantlab.core.Decimal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 简单移动平均线（Simple Moving Average）
 */
public class SMA implements Indicator {

    private final int period;

    public SMA(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> prices) {
        if (prices.size() < period) {
            throw new IllegalArgumentException("价格数量不足，需要至少 " + period + " 个数据点");
        }

        List<BigDecimal> result = new ArrayList<>(prices.size() - period + 1);
        BigDecimal divisor = BigDecimal.valueOf(period);

        // 滑动窗口求和
        BigDecimal windowSum = BigDecimal.ZERO;
        for (int i = 0; i < prices.size(); i++) {
            windowSum = windowSum.add(prices.get(i));
            if (i >= period) {
                windowSum = windowSum.subtract(prices.get(i - period));
            }
            if (i >= period - 1) {
                result.add(Decimal.divide(windowSum, divisor));
            }
        }
        return result;
    }

    @Override
    public int requiredPrices() {
        return period;
    }

    public int getPeriod() {
        return period;
    }

    @Override
    public String getName() {
        return "SMA-" + period;
    }
}
