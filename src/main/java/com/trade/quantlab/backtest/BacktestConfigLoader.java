package com.trade.quantlab.backtest;

import com.trade.quantlab.core.Interval;
import com.trade.quantlab.market.SyntheticDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 从 properties 文件加载回测配置
 *
 * 必填: backtest.start, backtest.end, backtest.symbols
 * 可选: backtest.capital, backtest.commission, backtest.slippage, backtest.benchmark,
 *       backtest.riskFreeRate, synthetic.*, report.output
 */
public final class BacktestConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(BacktestConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "backtest.properties";

    private BacktestConfigLoader() {
    }

    /**
     * 从文件加载（UTF-8）
     */
    public static BacktestSettings load(Path path) {
        if (!Files.exists(path)) {
            throw new BacktestConfigException("配置文件不存在: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            logger.info("已加载配置文件: {}", path);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new BacktestConfigException("无法读取配置文件: " + path, e);
        }
    }

    /**
     * 从classpath资源加载
     */
    public static BacktestSettings loadResource(String resource) {
        InputStream in = BacktestConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new BacktestConfigException("classpath 中找不到配置: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            logger.info("已加载内置配置: {}", resource);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new BacktestConfigException("无法读取配置: " + resource, e);
        }
    }

    public static BacktestSettings fromProperties(Properties properties) {
        BacktestConfig.Builder builder = BacktestConfig.builder()
                .startDate(parseInstant(properties, "backtest.start"))
                .endDate(parseInstant(properties, "backtest.end"))
                .symbols(parseSymbols(required(properties, "backtest.symbols")));

        String capital = optional(properties, "backtest.capital");
        if (capital != null) {
            builder.initialCapital(parseDecimal("backtest.capital", capital));
        }
        String commission = optional(properties, "backtest.commission");
        if (commission != null) {
            builder.commission(parseDecimal("backtest.commission", commission));
        }
        String slippage = optional(properties, "backtest.slippage");
        if (slippage != null) {
            builder.slippage(parseDecimal("backtest.slippage", slippage));
        }
        String riskFreeRate = optional(properties, "backtest.riskFreeRate");
        if (riskFreeRate != null) {
            builder.riskFreeRate(parseDecimal("backtest.riskFreeRate", riskFreeRate));
        }
        builder.benchmarkSymbol(optional(properties, "backtest.benchmark"));

        BacktestConfig config;
        try {
            config = builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new BacktestConfigException("回测配置无效: " + e.getMessage(), e);
        }

        Interval interval;
        try {
            String code = optional(properties, "synthetic.interval");
            interval = code != null ? Interval.fromCode(code) : Interval.ONE_MINUTE;
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigException(e.getMessage(), e);
        }

        double initialPrice = parseDouble(properties, "synthetic.initialPrice", SyntheticDataGenerator.DEFAULT_INITIAL_PRICE);
        double volatility = parseDouble(properties, "synthetic.volatility", SyntheticDataGenerator.DEFAULT_VOLATILITY);
        double trend = parseDouble(properties, "synthetic.trend", SyntheticDataGenerator.DEFAULT_TREND);

        String seedValue = optional(properties, "synthetic.seed");
        Long seed = null;
        if (seedValue != null) {
            try {
                seed = Long.parseLong(seedValue);
            } catch (NumberFormatException e) {
                throw new BacktestConfigException("synthetic.seed 不是整数: " + seedValue, e);
            }
        }

        String output = optional(properties, "report.output");
        Path reportOutput = output != null ? Paths.get(output) : null;

        return new BacktestSettings(config, interval, initialPrice, volatility, trend, seed, reportOutput);
    }

    private static String required(Properties properties, String key) {
        String value = optional(properties, key);
        if (value == null) {
            throw new BacktestConfigException("配置项缺失: " + key);
        }
        return value;
    }

    private static String optional(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    /**
     * 支持 ISO-8601 时间戳或 yyyy-MM-dd（按UTC零点）
     */
    private static Instant parseInstant(Properties properties, String key) {
        String value = required(properties, key);
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new BacktestConfigException(key + " 时间格式错误: " + value, e);
        }
    }

    private static List<String> parseSymbols(String value) {
        List<String> symbols = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (symbols.isEmpty()) {
            throw new BacktestConfigException("backtest.symbols 不能为空");
        }
        return symbols;
    }

    private static BigDecimal parseDecimal(String key, String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new BacktestConfigException(key + " 不是数字: " + value, e);
        }
    }

    private static double parseDouble(Properties properties, String key, double defaultValue) {
        String value = optional(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new BacktestConfigException(key + " 不是数字: " + value, e);
        }
    }
}
