package com.trade.quantlab.backtest;

import com.trade.quantlab.core.Decimal;

import java.math.BigDecimal;

/**
 * 持仓（仅做多）
 * 每个标的一条，数量归零即从组合中移除
 *
 * 修改方法仅对回测引擎可见，策略拿到的持仓只读
 */
public class Position {
    private final String symbol;
    private BigDecimal quantity;        // 持仓数量（>=0）
    private BigDecimal averagePrice;    // 持仓均价（不含手续费）
    private BigDecimal marketValue;     // 市值
    private BigDecimal unrealizedPnL;   // 未实现盈亏
    private BigDecimal realizedPnL;     // 已实现盈亏

    Position(String symbol, BigDecimal quantity, BigDecimal averagePrice) {
        this(symbol, quantity, averagePrice, quantity.multiply(averagePrice), BigDecimal.ZERO, BigDecimal.ZERO);
    }

    Position(String symbol, BigDecimal quantity, BigDecimal averagePrice,
             BigDecimal marketValue, BigDecimal unrealizedPnL, BigDecimal realizedPnL) {
        this.symbol = symbol;
        this.quantity = quantity;
        this.averagePrice = averagePrice;
        this.marketValue = marketValue;
        this.unrealizedPnL = unrealizedPnL;
        this.realizedPnL = realizedPnL;
    }

    public String getSymbol() { return symbol; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getMarketValue() { return marketValue; }
    public BigDecimal getUnrealizedPnL() { return unrealizedPnL; }
    public BigDecimal getRealizedPnL() { return realizedPnL; }

    /**
     * 持仓成本（数量 × 均价）
     */
    public BigDecimal getCostBasis() {
        return quantity.multiply(averagePrice);
    }

    public boolean isOpen() {
        return Decimal.isPositive(quantity);
    }

    /**
     * 按标记价格更新市值与未实现盈亏
     */
    void markToMarket(BigDecimal markPrice) {
        this.marketValue = quantity.multiply(markPrice);
        this.unrealizedPnL = marketValue.subtract(getCostBasis());
    }

    /**
     * 加仓，均价按数量加权（手续费不计入成本）
     */
    void add(BigDecimal addQuantity, BigDecimal price) {
        BigDecimal totalQuantity = quantity.add(addQuantity);
        BigDecimal totalCost = getCostBasis().add(addQuantity.multiply(price));
        this.averagePrice = Decimal.divide(totalCost, totalQuantity);
        this.quantity = totalQuantity;
        this.marketValue = totalQuantity.multiply(price);
        this.unrealizedPnL = marketValue.subtract(totalCost);
    }

    /**
     * 减仓并累计已实现盈亏
     */
    void reduce(BigDecimal reduceQuantity, BigDecimal price) {
        if (reduceQuantity.compareTo(quantity) > 0) {
            throw new IllegalArgumentException("减仓数量不能超过当前持仓");
        }
        this.realizedPnL = realizedPnL.add(price.subtract(averagePrice).multiply(reduceQuantity));
        this.quantity = quantity.subtract(reduceQuantity);
        this.marketValue = quantity.multiply(price);
        this.unrealizedPnL = marketValue.subtract(getCostBasis());
    }

    /**
     * 复制一份独立的持仓
     */
    public Position copy() {
        return new Position(symbol, quantity, averagePrice, marketValue, unrealizedPnL, realizedPnL);
    }

    @Override
    public String toString() {
        return String.format("Position{symbol=%s, qty=%s, avgPrice=%s, marketValue=%s, unrealizedPnL=%s, realizedPnL=%s}",
                symbol, quantity, averagePrice, marketValue, unrealizedPnL, realizedPnL);
    }
}
