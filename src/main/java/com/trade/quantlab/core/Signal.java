package com.trade.quantlab.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 交易信号
 * 策略层的输出，表示某根Bar上的交易意图，尚未成交
 *
 * quantity 与 targetWeight 均为可选，二者都缺省时由执行模型按默认规则定量
 */
public final class Signal {

    private final String symbol;
    private final SignalAction action;
    private final BigDecimal quantity;       // 指定数量（可选）
    private final BigDecimal targetWeight;   // 目标仓位权重（可选）
    private final BigDecimal price;          // 参考价（可选，缺省用收盘价）
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final String strategyId;
    private final BigDecimal confidence;     // 置信度（可选）
    private final String reason;

    private Signal(Builder builder) {
        this.symbol = builder.symbol;
        this.action = builder.action;
        this.quantity = builder.quantity;
        this.targetWeight = builder.targetWeight;
        this.price = builder.price;
        this.stopLoss = builder.stopLoss;
        this.takeProfit = builder.takeProfit;
        this.strategyId = builder.strategyId;
        this.confidence = builder.confidence;
        this.reason = builder.reason;
    }

    public String getSymbol() { return symbol; }
    public SignalAction getAction() { return action; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getTargetWeight() { return targetWeight; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStopLoss() { return stopLoss; }
    public BigDecimal getTakeProfit() { return takeProfit; }
    public String getStrategyId() { return strategyId; }
    public BigDecimal getConfidence() { return confidence; }
    public String getReason() { return reason; }

    public boolean isBuy() {
        return action == SignalAction.BUY;
    }

    public boolean isSell() {
        return action == SignalAction.SELL;
    }

    public boolean isHold() {
        return action == SignalAction.HOLD;
    }

    /**
     * 是否显式指定了数量（缺省或为0视为未指定）
     */
    public boolean hasQuantity() {
        return Decimal.isPositive(quantity);
    }

    /**
     * 是否指定了目标权重（缺省或为0视为未指定）
     */
    public boolean hasTargetWeight() {
        return Decimal.isPositive(targetWeight);
    }

    public static Builder builder(String symbol, SignalAction action, String strategyId) {
        return new Builder(symbol, action, strategyId);
    }

    public static Builder buy(String symbol, String strategyId) {
        return new Builder(symbol, SignalAction.BUY, strategyId);
    }

    public static Builder sell(String symbol, String strategyId) {
        return new Builder(symbol, SignalAction.SELL, strategyId);
    }

    @Override
    public String toString() {
        return String.format("Signal{action=%s, symbol=%s, qty=%s, weight=%s, price=%s, confidence=%s, strategy=%s, reason=%s}",
                action, symbol, quantity, targetWeight, price, confidence, strategyId, reason);
    }

    public static class Builder {
        private final String symbol;
        private final SignalAction action;
        private final String strategyId;
        private BigDecimal quantity;
        private BigDecimal targetWeight;
        private BigDecimal price;
        private BigDecimal stopLoss;
        private BigDecimal takeProfit;
        private BigDecimal confidence;
        private String reason;

        private Builder(String symbol, SignalAction action, String strategyId) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.action = Objects.requireNonNull(action, "action");
            this.strategyId = strategyId;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder targetWeight(BigDecimal targetWeight) {
            this.targetWeight = targetWeight;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder stopLoss(BigDecimal stopLoss) {
            this.stopLoss = stopLoss;
            return this;
        }

        public Builder takeProfit(BigDecimal takeProfit) {
            this.takeProfit = takeProfit;
            return this;
        }

        public Builder confidence(BigDecimal confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Signal build() {
            return new Signal(this);
        }
    }
}
