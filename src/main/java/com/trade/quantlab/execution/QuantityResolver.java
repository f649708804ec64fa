package com.trade.quantlab.execution;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.Signal;

import java.math.BigDecimal;

/**
 * 信号数量解析
 *
 * 优先级：
 * 1. 信号显式数量
 * 2. 目标权重 × 组合总市值 / 价格（向下取整）
 * 3. 买入默认使用10%可用现金，卖出默认全部持仓
 */
public final class QuantityResolver {

    private QuantityResolver() {}

    static final BigDecimal DEFAULT_CASH_FRACTION = new BigDecimal("0.1");

    /**
     * @param price 用于折算数量的价格
     * @return 数量，可能为0
     */
    public static BigDecimal resolve(Signal signal, Portfolio portfolio, BigDecimal price) {
        if (signal.hasQuantity()) {
            return signal.getQuantity();
        }
        if (!Decimal.isPositive(price)) {
            return BigDecimal.ZERO;
        }

        if (signal.hasTargetWeight()) {
            BigDecimal targetValue = portfolio.getTotalValue().multiply(signal.getTargetWeight());
            return Decimal.floorUnits(Decimal.divide(targetValue, price));
        }

        if (signal.isBuy()) {
            BigDecimal availableCash = portfolio.getCash().multiply(DEFAULT_CASH_FRACTION);
            return Decimal.floorUnits(Decimal.divide(availableCash, price));
        }

        return portfolio.getPositionQuantity(signal.getSymbol());
    }

    /**
     * 卖出数量不超过当前持仓
     */
    public static BigDecimal clipSell(Signal signal, Portfolio portfolio, BigDecimal quantity) {
        if (!signal.isSell()) {
            return quantity;
        }
        return Decimal.min(quantity, portfolio.getPositionQuantity(signal.getSymbol()));
    }
}
