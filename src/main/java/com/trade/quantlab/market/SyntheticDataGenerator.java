package com.trade.quantlab.market;

import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * 合成行情生成
 *
 * 价格按几何布朗运动演化：close = last × exp(trend×dt + volatility×sqrt(dt)×Z)，
 * dt 以年为单位，Z 为标准正态（Box-Muller）。
 * 计算过程使用 double，生成 MarketData 时转换为 BigDecimal
 */
public final class SyntheticDataGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SyntheticDataGenerator.class);

    public static final int DEFAULT_INTERVAL_MINUTES = 1;
    public static final double DEFAULT_INITIAL_PRICE = 100;
    public static final double DEFAULT_VOLATILITY = 0.02;
    public static final double DEFAULT_TREND = 0.0001;
    public static final double DEFAULT_VOLUME_BASE = 1_000_000;

    private static final double MINUTES_PER_YEAR = 60 * 24 * 365;
    private static final double SINGLE_RANGE_WIDENING = 0.5;
    private static final double CORRELATED_RANGE_WIDENING = 0.3;
    private static final double CORRELATED_VOLUME_BASE = 1_000_000;

    private SyntheticDataGenerator() {
    }

    public static List<MarketData> generateOHLCData(String symbol, Instant startDate, Instant endDate) {
        return generateOHLCData(symbol, startDate, endDate, DEFAULT_INTERVAL_MINUTES,
                DEFAULT_INITIAL_PRICE, DEFAULT_VOLATILITY, DEFAULT_TREND, DEFAULT_VOLUME_BASE, new Random());
    }

    public static List<MarketData> generateOHLCData(String symbol, Instant startDate, Instant endDate,
                                                    int intervalMinutes, double initialPrice,
                                                    double volatility, double trend, double volumeBase) {
        return generateOHLCData(symbol, startDate, endDate, intervalMinutes,
                initialPrice, volatility, trend, volumeBase, new Random());
    }

    /**
     * 单标的GBM序列，时间从 startDate 到 endDate（含）按固定间隔生成
     *
     * @param random 随机源，传入固定种子可复现
     */
    public static List<MarketData> generateOHLCData(String symbol, Instant startDate, Instant endDate,
                                                    int intervalMinutes, double initialPrice,
                                                    double volatility, double trend, double volumeBase,
                                                    Random random) {
        requirePositiveInterval(intervalMinutes);

        List<MarketData> data = new ArrayList<>();
        Duration step = Duration.ofMinutes(intervalMinutes);
        double dt = intervalMinutes / MINUTES_PER_YEAR;
        double lastPrice = initialPrice;

        for (Instant time = startDate; !time.isAfter(endDate); time = time.plus(step)) {
            double shock = normalRandom(random) * Math.sqrt(dt);
            double close = lastPrice * Math.exp(trend * dt + volatility * shock);
            double open = lastPrice;

            double range = Math.abs(close - open);
            double high = Math.max(open, close) + random.nextDouble() * range * SINGLE_RANGE_WIDENING;
            double low = Math.min(open, close) - random.nextDouble() * range * SINGLE_RANGE_WIDENING;

            // 成交量与本Bar涨跌幅正相关
            double movement = Math.abs((close - open) / open);
            double volumeMultiplier = 1 + movement * 2 + (random.nextDouble() - 0.5) * 0.5;
            long volume = Math.max(0, Math.round(volumeBase * volumeMultiplier));

            data.add(bar(time, symbol, open, high, low, close, volume));
            lastPrice = close;
        }

        logger.debug("生成合成行情: {} {} 条", symbol, data.size());
        return data;
    }

    public static List<MarketData> generateCorrelatedData(List<String> symbols, Instant startDate, Instant endDate,
                                                          double[][] correlationMatrix, double[] initialPrices,
                                                          double[] volatilities, double[] trends,
                                                          int intervalMinutes) {
        return generateCorrelatedData(symbols, startDate, endDate, correlationMatrix,
                initialPrices, volatilities, trends, intervalMinutes, new Random());
    }

    /**
     * 多标的相关行情
     * 对相关系数矩阵做Cholesky分解，把独立正态冲击转换为相关冲击；输出按时间排序
     *
     * @throws IllegalArgumentException 参数维度不一致或矩阵不是正定矩阵
     */
    public static List<MarketData> generateCorrelatedData(List<String> symbols, Instant startDate, Instant endDate,
                                                          double[][] correlationMatrix, double[] initialPrices,
                                                          double[] volatilities, double[] trends,
                                                          int intervalMinutes, Random random) {
        int n = symbols.size();
        if (correlationMatrix.length != n || initialPrices.length != n
                || volatilities.length != n || trends.length != n) {
            throw new IllegalArgumentException(String.format(
                    "参数维度不一致: symbols=%d, matrix=%d, initialPrices=%d, volatilities=%d, trends=%d",
                    n, correlationMatrix.length, initialPrices.length, volatilities.length, trends.length));
        }
        for (double[] row : correlationMatrix) {
            if (row.length != n) {
                throw new IllegalArgumentException("相关系数矩阵必须为 " + n + "×" + n);
            }
        }
        requirePositiveInterval(intervalMinutes);

        double[][] lower = choleskyDecomposition(correlationMatrix);

        List<MarketData> data = new ArrayList<>();
        Duration step = Duration.ofMinutes(intervalMinutes);
        double dt = intervalMinutes / MINUTES_PER_YEAR;
        double[] lastPrices = initialPrices.clone();

        for (Instant time = startDate; !time.isAfter(endDate); time = time.plus(step)) {
            double[] independent = new double[n];
            for (int i = 0; i < n; i++) {
                independent[i] = normalRandom(random);
            }
            double[] correlated = applyCorrelation(independent, lower);

            for (int i = 0; i < n; i++) {
                double shock = correlated[i] * Math.sqrt(dt);
                double open = lastPrices[i];
                double close = open * Math.exp(trends[i] * dt + volatilities[i] * shock);

                double range = Math.abs(close - open);
                double high = Math.max(open, close) + random.nextDouble() * range * CORRELATED_RANGE_WIDENING;
                double low = Math.min(open, close) - random.nextDouble() * range * CORRELATED_RANGE_WIDENING;
                long volume = Math.max(0, Math.round(CORRELATED_VOLUME_BASE * (1 + random.nextDouble())));

                data.add(bar(time, symbols.get(i), open, high, low, close, volume));
                lastPrices[i] = close;
            }
        }

        data.sort(Comparator.comparing(MarketData::getTimestamp));
        logger.debug("生成相关行情: {} 个标的 {} 条", n, data.size());
        return data;
    }

    public static List<MarketData> generateCrashScenario(String symbol, Instant normalStartDate,
                                                         Instant crashStartDate, Instant crashEndDate,
                                                         Instant recoveryEndDate) {
        return generateCrashScenario(symbol, normalStartDate, crashStartDate, crashEndDate, recoveryEndDate,
                0.3, DEFAULT_INTERVAL_MINUTES, new Random());
    }

    /**
     * 崩盘情景：正常 → 高波动下跌 → 温和波动反弹，每段以上一段最后收盘价为起点。
     * 相邻两段共享边界时间点
     *
     * @param crashSeverity 保留参数，当前下跌幅度由崩盘段的趋势和波动率决定
     */
    public static List<MarketData> generateCrashScenario(String symbol, Instant normalStartDate,
                                                         Instant crashStartDate, Instant crashEndDate,
                                                         Instant recoveryEndDate, double crashSeverity,
                                                         int intervalMinutes, Random random) {
        List<MarketData> data = new ArrayList<>();

        List<MarketData> normal = generateOHLCData(symbol, normalStartDate, crashStartDate, intervalMinutes,
                DEFAULT_INITIAL_PRICE, 0.015, 0.0002, DEFAULT_VOLUME_BASE, random);
        data.addAll(normal);
        double preCrashPrice = lastClose(normal, DEFAULT_INITIAL_PRICE);

        List<MarketData> crash = generateOHLCData(symbol, crashStartDate, crashEndDate, intervalMinutes,
                preCrashPrice, 0.08, -0.02, 2_000_000, random);
        data.addAll(crash);
        double postCrashPrice = lastClose(crash, preCrashPrice);

        List<MarketData> recovery = generateOHLCData(symbol, crashEndDate, recoveryEndDate, intervalMinutes,
                postCrashPrice, 0.04, 0.001, 1_500_000, random);
        data.addAll(recovery);

        logger.debug("生成崩盘情景: {} 正常{}条 崩盘{}条 反弹{}条", symbol, normal.size(), crash.size(), recovery.size());
        return data;
    }

    /**
     * Box-Muller 标准正态随机数
     */
    static double normalRandom(Random random) {
        double u = 0;
        double v = 0;
        while (u == 0) {
            u = random.nextDouble();
        }
        while (v == 0) {
            v = random.nextDouble();
        }
        return Math.sqrt(-2.0 * Math.log(u)) * Math.cos(2.0 * Math.PI * v);
    }

    /**
     * Cholesky分解，返回下三角矩阵 L，满足 L × Lᵀ = matrix
     */
    static double[][] choleskyDecomposition(double[][] matrix) {
        int n = matrix.length;
        double[][] lower = new double[n][n];

        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = 0;
                for (int k = 0; k < j; k++) {
                    sum += lower[i][k] * lower[j][k];
                }
                if (i == j) {
                    double diagonal = matrix[i][i] - sum;
                    if (diagonal <= 0) {
                        throw new IllegalArgumentException("相关系数矩阵不是正定矩阵");
                    }
                    lower[i][j] = Math.sqrt(diagonal);
                } else {
                    lower[i][j] = (matrix[i][j] - sum) / lower[j][j];
                }
            }
        }
        return lower;
    }

    private static double[] applyCorrelation(double[] independent, double[][] lower) {
        int n = independent.length;
        double[] correlated = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                correlated[i] += lower[i][j] * independent[j];
            }
        }
        return correlated;
    }

    private static MarketData bar(Instant time, String symbol, double open, double high, double low,
                                  double close, long volume) {
        double vwap = (high + low + close) / 3;
        return new MarketData(time, symbol,
                price(open), price(high), price(low), price(close),
                BigDecimal.valueOf(volume), price(vwap));
    }

    private static BigDecimal price(double value) {
        return Decimal.scalePrice(BigDecimal.valueOf(value));
    }

    private static double lastClose(List<MarketData> data, double fallback) {
        return data.isEmpty() ? fallback : data.get(data.size() - 1).getClose().doubleValue();
    }

    private static void requirePositiveInterval(int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes 必须大于0");
        }
    }
}
