package com.trade.quantlab.market;

import com.trade.quantlab.core.MarketData;

import java.time.Instant;
import java.util.List;

/**
 * 行情模拟器
 * 按时间顺序逐根输出Bar，内部维护单向游标
 */
public interface MarketSimulator {

    /**
     * 是否还有未读取的Bar
     */
    boolean hasMoreData();

    /**
     * 读取下一根Bar并前移游标
     * @return 下一根Bar，暂无数据返回null
     */
    MarketData getNextBar();

    /**
     * 当前游标所处的时间，无数据返回null
     */
    Instant getCurrentTimestamp();

    List<String> getSymbols();

    /**
     * 游标回到起点，不重新生成数据
     */
    void reset();
}
