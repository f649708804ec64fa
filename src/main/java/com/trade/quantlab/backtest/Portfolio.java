package com.trade.quantlab.backtest;

import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 投资组合账本
 *
 * 不变式：
 * 1. 每次变更后 cash >= 0
 * 2. 每次估值后 totalValue == cash + Σ position.marketValue
 * 3. 持仓数量归零即移除
 *
 * 只有回测引擎的成交处理步骤会修改组合，对外只暴露只读视图
 */
public class Portfolio {

    private static final Logger logger = LoggerFactory.getLogger(Portfolio.class);

    private final BigDecimal initialCapital;
    private BigDecimal cash;
    private final Map<String, Position> positions;   // 按插入顺序
    private BigDecimal totalValue;
    private BigDecimal totalPnL;
    private final List<Trade> trades;

    Portfolio(BigDecimal initialCapital) {
        this.initialCapital = initialCapital;
        this.positions = new LinkedHashMap<>();
        this.trades = new ArrayList<>();
        reset();
    }

    private Portfolio(Portfolio source) {
        this.initialCapital = source.initialCapital;
        this.cash = source.cash;
        this.positions = new LinkedHashMap<>();
        source.positions.forEach((symbol, position) -> positions.put(symbol, position.copy()));
        this.totalValue = source.totalValue;
        this.totalPnL = source.totalPnL;
        this.trades = new ArrayList<>(source.trades);
    }

    public BigDecimal getInitialCapital() { return initialCapital; }
    public BigDecimal getCash() { return cash; }
    public BigDecimal getTotalValue() { return totalValue; }
    public BigDecimal getTotalPnL() { return totalPnL; }

    /**
     * 持仓只读视图
     */
    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public Position getPosition(String symbol) {
        return positions.get(symbol);
    }

    public boolean hasPosition(String symbol) {
        Position position = positions.get(symbol);
        return position != null && position.isOpen();
    }

    /**
     * 持仓数量，无持仓返回0
     */
    public BigDecimal getPositionQuantity(String symbol) {
        Position position = positions.get(symbol);
        return position == null ? BigDecimal.ZERO : position.getQuantity();
    }

    /**
     * 成交记录只读视图
     */
    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    /**
     * 复制一份与账本完全独立的组合
     */
    public Portfolio copy() {
        return new Portfolio(this);
    }

    /**
     * 恢复到初始状态
     */
    void reset() {
        this.cash = initialCapital;
        this.positions.clear();
        this.totalValue = initialCapital;
        this.totalPnL = BigDecimal.ZERO;
        this.trades.clear();
    }

    /**
     * 按Bar收盘价更新同标的持仓市值
     * 其他标的市值保持各自上次更新的值
     */
    void markToMarket(MarketData bar) {
        Position position = positions.get(bar.getSymbol());
        if (position != null) {
            position.markToMarket(bar.getClose());
        }
        revalue();
    }

    /**
     * 重新汇总总市值与总盈亏
     */
    void revalue() {
        BigDecimal value = cash;
        for (Position position : positions.values()) {
            value = value.add(position.getMarketValue());
        }
        this.totalValue = value;
        this.totalPnL = value.subtract(initialCapital);
    }

    /**
     * 记入一笔成交
     *
     * @return 实际记账的成交（买入可能被缩量），无法成交返回null
     */
    Trade apply(Trade trade) {
        Trade applied = trade.isBuy() ? applyBuy(trade) : applySell(trade);
        if (applied != null) {
            trades.add(applied);
            revalue();
        }
        return applied;
    }

    private Trade applyBuy(Trade trade) {
        BigDecimal cost = trade.getNotional().add(trade.getCommission()).add(trade.getSlippage());

        if (cost.compareTo(cash) > 0) {
            // 资金不足：按手续费和单位滑点重新计算最大可买整数数量
            BigDecimal unitSlippage = Decimal.divide(trade.getSlippage(), trade.getQuantity());
            BigDecimal unitCost = trade.getPrice().add(unitSlippage);
            BigDecimal budget = cash.subtract(trade.getCommission());
            if (unitCost.signum() <= 0 || budget.signum() <= 0) {
                logger.warn("资金不足，放弃买入: {} 需要 {} 可用 {}", trade.getSymbol(), cost, cash);
                return null;
            }
            BigDecimal maxQuantity = budget.divide(unitCost, 0, RoundingMode.DOWN);
            if (maxQuantity.signum() <= 0) {
                logger.warn("资金不足，放弃买入: {} 需要 {} 可用 {}", trade.getSymbol(), cost, cash);
                return null;
            }
            logger.warn("资金不足，买入数量由 {} 缩减为 {}: {}", trade.getQuantity(), maxQuantity, trade.getSymbol());
            trade = trade.withQuantity(maxQuantity, unitSlippage.multiply(maxQuantity));
            cost = trade.getNotional().add(trade.getCommission()).add(trade.getSlippage());
        }

        cash = cash.subtract(cost);

        Position position = positions.get(trade.getSymbol());
        if (position == null) {
            positions.put(trade.getSymbol(), new Position(trade.getSymbol(), trade.getQuantity(), trade.getPrice()));
        } else {
            position.add(trade.getQuantity(), trade.getPrice());
        }
        return trade;
    }

    private Trade applySell(Trade trade) {
        Position position = positions.get(trade.getSymbol());
        if (position == null || !position.isOpen()) {
            logger.warn("无持仓，忽略卖出: {}", trade.getSymbol());
            return null;
        }

        if (trade.getQuantity().compareTo(position.getQuantity()) > 0) {
            logger.warn("卖出数量 {} 超过持仓 {}，按持仓卖出: {}",
                    trade.getQuantity(), position.getQuantity(), trade.getSymbol());
            trade = trade.withQuantity(position.getQuantity(), trade.getSlippage());
        }

        BigDecimal proceeds = trade.getNotional().subtract(trade.getCommission()).subtract(trade.getSlippage());
        cash = cash.add(proceeds);

        position.reduce(trade.getQuantity(), trade.getPrice());
        if (Decimal.isZero(position.getQuantity())) {
            positions.remove(trade.getSymbol());
        }
        return trade;
    }

    @Override
    public String toString() {
        return String.format("Portfolio{cash=%s, totalValue=%s, totalPnL=%s, positions=%d, trades=%d}",
                cash, totalValue, totalPnL, positions.size(), trades.size());
    }
}
