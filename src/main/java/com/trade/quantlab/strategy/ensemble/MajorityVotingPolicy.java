package com.trade.quantlab.strategy.ensemble;

import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.Signal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 多数表决
 *
 * - 至少两个买入信号：合并买入，置信度与权重取平均，权重上限25%
 * - 至少两个卖出信号，或任一卖出信号置信度超过0.8：合并卖出，数量取最大值
 * - 两者同时满足时都输出，买入在前
 */
public class MajorityVotingPolicy implements VotingPolicy {

    private static final int MIN_VOTES = 2;
    private static final BigDecimal DEFAULT_CONFIDENCE = new BigDecimal("0.5");
    private static final BigDecimal DEFAULT_WEIGHT = new BigDecimal("0.1");
    private static final BigDecimal MAX_WEIGHT = new BigDecimal("0.25");
    private static final BigDecimal STRONG_SELL_CONFIDENCE = new BigDecimal("0.8");

    @Override
    public List<Signal> combine(List<Signal> signals, String symbol, String strategyId) {
        List<Signal> buys = signals.stream().filter(Signal::isBuy).collect(Collectors.toList());
        List<Signal> sells = signals.stream().filter(Signal::isSell).collect(Collectors.toList());
        List<Signal> combined = new ArrayList<>();

        if (buys.size() >= MIN_VOTES) {
            BigDecimal confidence = average(buys, true);
            BigDecimal weight = Decimal.min(MAX_WEIGHT, average(buys, false));
            combined.add(Signal.buy(symbol, strategyId)
                    .targetWeight(weight)
                    .confidence(confidence)
                    .reason(String.format("多因子买入: %d/%d 票", buys.size(), signals.size()))
                    .build());
        }

        boolean strongSell = sells.stream().anyMatch(s -> s.getConfidence() != null
                && s.getConfidence().compareTo(STRONG_SELL_CONFIDENCE) > 0);
        if (sells.size() >= MIN_VOTES || strongSell) {
            Signal.Builder builder = Signal.sell(symbol, strategyId)
                    .confidence(average(sells, true))
                    .reason(String.format("多因子卖出: %d/%d 票%s", sells.size(), signals.size(), strongSell ? "（强信号）" : ""));
            BigDecimal quantity = sells.stream()
                    .map(Signal::getQuantity)
                    .filter(q -> q != null)
                    .reduce(Decimal::max)
                    .orElse(null);
            if (quantity != null) {
                builder.quantity(quantity);
            }
            combined.add(builder.build());
        }

        return combined;
    }

    /**
     * 对置信度或目标权重取平均，缺失的值用默认值代替
     */
    private static BigDecimal average(List<Signal> signals, boolean confidence) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Signal signal : signals) {
            BigDecimal value = confidence ? signal.getConfidence() : signal.getTargetWeight();
            if (value == null) {
                value = confidence ? DEFAULT_CONFIDENCE : DEFAULT_WEIGHT;
            }
            sum = sum.add(value);
        }
        return Decimal.divide(sum, BigDecimal.valueOf(signals.size()));
    }
}
