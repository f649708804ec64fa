package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 历史行情回放
 * 构造时按时间升序排序，游标单向前进
 */
public class HistoricalDataSimulator implements MarketSimulator {

    private final List<MarketData> data;
    private final List<String> symbols;
    private int currentIndex;

    public HistoricalDataSimulator(List<MarketData> data) {
        List<MarketData> sorted = new ArrayList<>(data);
        // 稳定排序，同一时间的Bar保持输入顺序
        sorted.sort(Comparator.comparing(MarketData::getTimestamp));
        this.data = List.copyOf(sorted);

        Set<String> distinct = new LinkedHashSet<>();
        for (MarketData bar : this.data) {
            distinct.add(bar.getSymbol());
        }
        this.symbols = List.copyOf(distinct);
        this.currentIndex = 0;
    }

    @Override
    public boolean hasMoreData() {
        return currentIndex < data.size();
    }

    @Override
    public MarketData getNextBar() {
        if (currentIndex >= data.size()) {
            return null;
        }
        return data.get(currentIndex++);
    }

    /**
     * 尚未读取时返回第一根Bar的时间，读完后返回最后一根，否则返回最近读取的Bar时间
     */
    @Override
    public Instant getCurrentTimestamp() {
        if (data.isEmpty()) {
            return null;
        }
        if (currentIndex == 0) {
            return data.get(0).getTimestamp();
        }
        if (currentIndex >= data.size()) {
            return data.get(data.size() - 1).getTimestamp();
        }
        return data.get(currentIndex - 1).getTimestamp();
    }

    @Override
    public List<String> getSymbols() {
        return symbols;
    }

    @Override
    public void reset() {
        currentIndex = 0;
    }

    /**
     * 时间区间内（含两端）的Bar
     * @param symbols 标的过滤，null表示不过滤
     */
    public List<MarketData> getDataInRange(Instant start, Instant end, List<String> symbols) {
        return data.stream()
                .filter(bar -> !bar.getTimestamp().isBefore(start))
                .filter(bar -> !bar.getTimestamp().isAfter(end))
                .filter(bar -> symbols == null || symbols.contains(bar.getSymbol()))
                .toList();
    }

    public int size() {
        return data.size();
    }
}
