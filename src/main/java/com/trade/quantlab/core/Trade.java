package com.trade.quantlab.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 成交记录
 * 只追加的审计记录，创建后不再修改
 */
public final class Trade {
    private final String id;                // 成交ID
    private final Instant timestamp;        // 成交时间（Bar时间）
    private final String symbol;            // 标的
    private final Side side;                // 方向
    private final BigDecimal quantity;      // 成交数量
    private final BigDecimal price;         // 成交价格（已含滑点与冲击）
    private final BigDecimal commission;    // 手续费
    private final BigDecimal slippage;      // 滑点成本
    private final String strategyId;        // 策略ID

    public Trade(String id, Instant timestamp, String symbol, Side side,
                 BigDecimal quantity, BigDecimal price,
                 BigDecimal commission, BigDecimal slippage, String strategyId) {
        this.id = Objects.requireNonNull(id, "id");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.price = Objects.requireNonNull(price, "price");
        this.commission = Objects.requireNonNull(commission, "commission");
        this.slippage = Objects.requireNonNull(slippage, "slippage");
        this.strategyId = strategyId;
    }

    public String getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getCommission() { return commission; }
    public BigDecimal getSlippage() { return slippage; }
    public String getStrategyId() { return strategyId; }

    public boolean isBuy() {
        return side == Side.BUY;
    }

    /**
     * 成交金额
     */
    public BigDecimal getNotional() {
        return price.multiply(quantity);
    }

    /**
     * 以新数量生成一笔成交，其余字段不变
     */
    public Trade withQuantity(BigDecimal newQuantity, BigDecimal newSlippage) {
        return new Trade(id, timestamp, symbol, side, newQuantity, price, commission, newSlippage, strategyId);
    }

    @Override
    public String toString() {
        return String.format("Trade{id=%s, symbol=%s, side=%s, price=%s, qty=%s, commission=%s, slippage=%s, time=%s}",
                id, symbol, side, price, quantity, commission, slippage, timestamp);
    }
}
