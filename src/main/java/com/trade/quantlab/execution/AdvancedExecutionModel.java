package com.trade.quantlab.execution;

import com.trade.quantlab.backtest.BacktestConfig;
import com.trade.quantlab.backtest.Portfolio;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 流动性约束成交模型
 *
 * 1. 单笔数量不超过近20根Bar平均成交量的10%
 * 2. 超过平均成交量5%的大单按TWAP拆分，只成交第一片
 * 3. 滑点随历史波动率和 sqrt(数量/成交量) 放大
 */
public class AdvancedExecutionModel implements ExecutionModel {

    private static final Logger logger = LoggerFactory.getLogger(AdvancedExecutionModel.class);

    private static final int HISTORY_LENGTH = 20;
    private static final BigDecimal MAX_VOLUME_FRACTION = new BigDecimal("0.1");
    private static final BigDecimal LARGE_ORDER_FRACTION = new BigDecimal("0.05");
    private static final int MAX_TWAP_SLICES = 10;
    private static final int TWAP_SLICE_UNIT = 100;
    private static final double DEFAULT_VOLATILITY = 0.02;
    private static final int TRADING_DAYS = 252;

    private final BacktestConfig config;
    private final Map<String, Deque<BigDecimal>> priceHistory;
    private final Map<String, Deque<BigDecimal>> volumeHistory;
    private final Map<String, Instant> lastRecorded;   // 每个标的最后记入历史的Bar时间

    public AdvancedExecutionModel(BacktestConfig config) {
        this.config = config;
        this.priceHistory = new HashMap<>();
        this.volumeHistory = new HashMap<>();
        this.lastRecorded = new HashMap<>();
    }

    @Override
    public void onMarketData(MarketData data) {
        record(data);
    }

    @Override
    public Trade executeSignal(Signal signal, MarketData data, Portfolio portfolio) {
        if (signal.isHold()) {
            return null;
        }

        record(data);

        BigDecimal quantity = Decimal.min(
                QuantityResolver.resolve(signal, portfolio, data.getClose()),
                calculateMaxQuantity(data));
        quantity = QuantityResolver.clipSell(signal, portfolio, quantity);
        if (!Decimal.isPositive(quantity)) {
            logger.debug("数量为0，忽略信号: {}", signal);
            return null;
        }

        if (isLargeOrder(quantity, data)) {
            BigDecimal slice = firstTwapSlice(quantity);
            logger.debug("大单TWAP拆分: {} 总量 {} 首片 {}", signal.getSymbol(), quantity, slice);
            quantity = slice;
        }

        BigDecimal executionPrice = calculateExecutionPrice(signal, data, quantity);
        return new Trade(
                UUID.randomUUID().toString(),
                data.getTimestamp(),
                signal.getSymbol(),
                signal.getAction().toSide(),
                quantity,
                executionPrice,
                calculateCommission(quantity, executionPrice),
                executionPrice.subtract(data.getClose()).abs(),
                signal.getStrategyId()
        );
    }

    /**
     * 滑点已计入成交价，单独计算时为0
     */
    @Override
    public BigDecimal calculateSlippage(Signal signal, MarketData data) {
        return BigDecimal.ZERO;
    }

    @Override
    public BigDecimal calculateCommission(BigDecimal quantity, BigDecimal price) {
        BigDecimal percentage = quantity.multiply(price).multiply(config.getCommission());
        return Decimal.scalePrice(Decimal.max(BigDecimal.ONE, percentage));
    }

    /**
     * 清空价格、成交量历史，重新回测时与首次运行一致
     */
    @Override
    public void reset() {
        priceHistory.clear();
        volumeHistory.clear();
        lastRecorded.clear();
    }

    private void record(MarketData data) {
        Instant last = lastRecorded.get(data.getSymbol());
        if (data.getTimestamp().equals(last)) {
            return;
        }
        lastRecorded.put(data.getSymbol(), data.getTimestamp());
        append(priceHistory, data.getSymbol(), data.getClose());
        append(volumeHistory, data.getSymbol(), data.getVolume());
    }

    private static void append(Map<String, Deque<BigDecimal>> history, String symbol, BigDecimal value) {
        Deque<BigDecimal> values = history.computeIfAbsent(symbol, k -> new ArrayDeque<>());
        values.addLast(value);
        while (values.size() > HISTORY_LENGTH) {
            values.removeFirst();
        }
    }

    /**
     * 近期平均成交量，无历史时使用当前Bar成交量
     */
    BigDecimal averageVolume(MarketData data) {
        Deque<BigDecimal> volumes = volumeHistory.get(data.getSymbol());
        if (volumes == null || volumes.isEmpty()) {
            return data.getVolume();
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal volume : volumes) {
            sum = sum.add(volume);
        }
        return Decimal.divide(sum, BigDecimal.valueOf(volumes.size()));
    }

    BigDecimal calculateMaxQuantity(MarketData data) {
        return Decimal.floorUnits(averageVolume(data).multiply(MAX_VOLUME_FRACTION));
    }

    private boolean isLargeOrder(BigDecimal quantity, MarketData data) {
        return quantity.compareTo(averageVolume(data).multiply(LARGE_ORDER_FRACTION)) > 0;
    }

    /**
     * 切片数 = min(10, 数量/100)，至少1片
     */
    static BigDecimal firstTwapSlice(BigDecimal quantity) {
        int slices = Math.min(MAX_TWAP_SLICES,
                quantity.divide(BigDecimal.valueOf(TWAP_SLICE_UNIT), 0, RoundingMode.DOWN).intValue());
        slices = Math.max(1, slices);
        BigDecimal slice = quantity.divide(BigDecimal.valueOf(slices), 0, RoundingMode.DOWN);
        return slice.signum() > 0 ? slice : quantity;
    }

    BigDecimal calculateExecutionPrice(Signal signal, MarketData data, BigDecimal quantity) {
        BigDecimal basePrice = signal.getPrice() != null ? signal.getPrice() : data.getClose();

        double volatility = historicalVolatility(data.getSymbol());
        double volumeRatio = Decimal.divide(quantity, data.getVolume()).doubleValue();
        double multiplier = (1 + volatility * 2) * (1 + Math.sqrt(volumeRatio) * 0.5);

        BigDecimal slippage = config.getSlippage().multiply(basePrice).multiply(BigDecimal.valueOf(multiplier));
        return Decimal.scalePrice(signal.isBuy() ? basePrice.add(slippage) : basePrice.subtract(slippage));
    }

    /**
     * 对数收益率的年化标准差，样本不足时返回默认值
     */
    double historicalVolatility(String symbol) {
        Deque<BigDecimal> prices = priceHistory.get(symbol);
        if (prices == null || prices.size() < 2) {
            return DEFAULT_VOLATILITY;
        }

        double[] returns = new double[prices.size() - 1];
        BigDecimal previous = null;
        int i = 0;
        for (BigDecimal price : prices) {
            if (previous != null) {
                returns[i++] = Math.log(price.doubleValue() / previous.doubleValue());
            }
            previous = price;
        }

        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;

        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        variance /= returns.length;

        return Math.sqrt(variance * TRADING_DAYS);
    }
}
