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
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * 仿真成交模型
 *
 * 成交价 = 参考价 ± 滑点 ± 市场冲击
 * - 滑点：基础滑点率 × (1 + 10×振幅 + 5×波动代理) × 收盘价，开盘/收盘时段再乘1.5
 * - 冲击：sqrt(数量 / (成交量/100)) × 0.001 × 收盘价
 * - 手续费：max(1, min(名义金额 × 费率, 数量 × 0.005))
 */
public class RealisticExecutionModel implements ExecutionModel {

    private static final Logger logger = LoggerFactory.getLogger(RealisticExecutionModel.class);

    private static final BigDecimal SPREAD_FACTOR = BigDecimal.valueOf(10);
    private static final BigDecimal VOLATILITY_FACTOR = BigDecimal.valueOf(5);
    private static final BigDecimal SESSION_EDGE_MULTIPLIER = new BigDecimal("1.5");
    private static final BigDecimal IMPACT_COEFFICIENT = new BigDecimal("0.001");
    private static final BigDecimal TRADABLE_VOLUME_DIVISOR = BigDecimal.valueOf(100);  // 假设只能吃掉1%的成交量
    private static final BigDecimal MIN_COMMISSION = BigDecimal.ONE;
    private static final BigDecimal PER_UNIT_COMMISSION = new BigDecimal("0.005");
    private static final int SESSION_OPEN_HOUR = 10;
    private static final int SESSION_CLOSE_HOUR = 15;

    private final BacktestConfig config;
    private final ZoneId zone;   // 判断交易时段用的时区

    public RealisticExecutionModel(BacktestConfig config) {
        this(config, ZoneOffset.UTC);
    }

    public RealisticExecutionModel(BacktestConfig config, ZoneId zone) {
        this.config = config;
        this.zone = zone;
    }

    @Override
    public Trade executeSignal(Signal signal, MarketData data, Portfolio portfolio) {
        if (signal.isHold()) {
            return null;
        }

        BigDecimal basePrice = signal.getPrice() != null ? signal.getPrice() : data.getClose();
        BigDecimal slippage = calculateSlippage(signal, data);
        BigDecimal executionPrice = signal.isBuy() ? basePrice.add(slippage) : basePrice.subtract(slippage);

        BigDecimal quantity = QuantityResolver.resolve(signal, portfolio, executionPrice);
        quantity = QuantityResolver.clipSell(signal, portfolio, quantity);
        if (!Decimal.isPositive(quantity)) {
            logger.debug("数量为0，忽略信号: {}", signal);
            return null;
        }

        BigDecimal impact = calculateMarketImpact(quantity, data);
        BigDecimal finalPrice = Decimal.scalePrice(
                signal.isBuy() ? executionPrice.add(impact) : executionPrice.subtract(impact));

        return new Trade(
                UUID.randomUUID().toString(),
                data.getTimestamp(),
                signal.getSymbol(),
                signal.getAction().toSide(),
                quantity,
                finalPrice,
                calculateCommission(quantity, finalPrice),
                Decimal.scalePrice(slippage.add(impact)),
                signal.getStrategyId()
        );
    }

    @Override
    public BigDecimal calculateSlippage(Signal signal, MarketData data) {
        BigDecimal rangeRatio = data.getRangeRatio();

        // 振幅同时作为价差和波动率的代理
        BigDecimal rate = config.getSlippage().multiply(
                BigDecimal.ONE.add(rangeRatio.multiply(SPREAD_FACTOR)).add(rangeRatio.multiply(VOLATILITY_FACTOR)));

        int hour = data.getTimestamp().atZone(zone).getHour();
        if (hour < SESSION_OPEN_HOUR || hour > SESSION_CLOSE_HOUR) {
            rate = rate.multiply(SESSION_EDGE_MULTIPLIER);
        }

        return Decimal.scalePrice(rate.multiply(data.getClose()));
    }

    @Override
    public BigDecimal calculateCommission(BigDecimal quantity, BigDecimal price) {
        BigDecimal percentage = quantity.multiply(price).multiply(config.getCommission());
        BigDecimal perUnit = quantity.multiply(PER_UNIT_COMMISSION);
        return Decimal.scalePrice(Decimal.max(MIN_COMMISSION, Decimal.min(percentage, perUnit)));
    }

    /**
     * 平方根冲击模型
     */
    BigDecimal calculateMarketImpact(BigDecimal quantity, MarketData data) {
        BigDecimal tradableVolume = Decimal.divide(data.getVolume(), TRADABLE_VOLUME_DIVISOR);
        BigDecimal volumeRatio = Decimal.divide(quantity, tradableVolume);
        return Decimal.sqrt(volumeRatio).multiply(IMPACT_COEFFICIENT).multiply(data.getClose());
    }
}
