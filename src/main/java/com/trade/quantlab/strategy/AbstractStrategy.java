package com.trade.quantlab.strategy;

import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.MarketData;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 策略抽象基类
 * 维护每个标的的收盘价滚动窗口，窗口长度由子类按指标需要指定
 */
public abstract class AbstractStrategy implements Strategy {

    private final String name;
    private final int historyLength;
    private final Map<String, Deque<BigDecimal>> closes;

    protected AbstractStrategy(String name, int historyLength) {
        if (historyLength <= 0) {
            throw new IllegalArgumentException("历史窗口长度必须大于0");
        }
        this.name = name;
        this.historyLength = historyLength;
        this.closes = new HashMap<>();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void initialize(List<String> symbols) {
        closes.clear();
    }

    /**
     * 记录收盘价并返回当前窗口（按时间正序）
     */
    protected List<BigDecimal> recordClose(MarketData data) {
        Deque<BigDecimal> history = closes.computeIfAbsent(data.getSymbol(), k -> new ArrayDeque<>());
        history.addLast(data.getClose());
        while (history.size() > historyLength) {
            history.removeFirst();
        }
        return new ArrayList<>(history);
    }

    protected int getHistoryLength() {
        return historyLength;
    }

    // ==================== 工具方法 ====================

    protected static boolean hasPosition(Portfolio portfolio, String symbol) {
        return portfolio.hasPosition(symbol);
    }

    protected static BigDecimal positionQuantity(Portfolio portfolio, String symbol) {
        return portfolio.getPositionQuantity(symbol);
    }
}
