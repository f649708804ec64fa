package com.trade.quantlab;

import com.trade.quantlab.backtest.BacktestConfig;
import com.trade.quantlab.backtest.BacktestConfigException;
import com.trade.quantlab.backtest.BacktestConfigLoader;
import com.trade.quantlab.backtest.BacktestEngine;
import com.trade.quantlab.backtest.BacktestException;
import com.trade.quantlab.backtest.BacktestListener;
import com.trade.quantlab.backtest.BacktestProgress;
import com.trade.quantlab.backtest.BacktestReportWriter;
import com.trade.quantlab.backtest.BacktestResult;
import com.trade.quantlab.backtest.BacktestSettings;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.market.HistoricalDataSimulator;
import com.trade.quantlab.market.SyntheticDataGenerator;
import com.trade.quantlab.strategy.Strategy;
import com.trade.quantlab.strategy.impl.BollingerBandsStrategy;
import com.trade.quantlab.strategy.impl.BuyAndHoldStrategy;
import com.trade.quantlab.strategy.impl.MomentumStrategy;
import com.trade.quantlab.strategy.impl.MultiFactorStrategy;
import com.trade.quantlab.strategy.impl.RsiMeanReversionStrategy;
import com.trade.quantlab.strategy.impl.SmaCrossoverStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 回测命令行入口
 *
 * 用法: java -jar quantlab-backtest.jar [strategy] [configFile]
 */
public class BacktestMain {

    private static final Logger logger = LoggerFactory.getLogger(BacktestMain.class);

    static final String DEFAULT_STRATEGY = "sma";

    public static void main(String[] args) {
        System.out.println("""
            ================================================
               量化回测引擎 v1.0
               行情回放 · 信号执行 · 绩效分析
            ================================================
            """);

        String strategyName = args.length > 0 ? args[0] : DEFAULT_STRATEGY;
        if ("-h".equals(strategyName) || "--help".equals(strategyName)) {
            printUsage();
            return;
        }

        try {
            BacktestSettings settings = args.length > 1
                    ? BacktestConfigLoader.load(Paths.get(args[1]))
                    : BacktestConfigLoader.loadResource(BacktestConfigLoader.DEFAULT_RESOURCE);

            BacktestResult result = runBacktest(createStrategy(strategyName), settings);
            System.out.println(result);

            if (settings.hasReportOutput()) {
                new BacktestReportWriter().write(result, settings.getReportOutput());
            }
        } catch (IllegalArgumentException | BacktestConfigException e) {
            System.err.println("参数错误: " + e.getMessage());
            printUsage();
            System.exit(2);
        } catch (BacktestException | IOException e) {
            logger.error("回测失败: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * 按配置生成合成行情并运行回测
     */
    static BacktestResult runBacktest(Strategy strategy, BacktestSettings settings) throws BacktestException {
        BacktestConfig config = settings.getConfig();
        Random random = settings.getSeed() != null ? new Random(settings.getSeed()) : new Random();

        // 基准不在交易标的中时同样需要行情
        Set<String> symbols = new LinkedHashSet<>(config.getSymbols());
        if (config.hasBenchmark()) {
            symbols.add(config.getBenchmarkSymbol());
        }

        List<MarketData> data = new ArrayList<>();
        for (String symbol : symbols) {
            data.addAll(SyntheticDataGenerator.generateOHLCData(symbol, config.getStartDate(), config.getEndDate(),
                    settings.getInterval().getMinutes(), settings.getInitialPrice(), settings.getVolatility(),
                    settings.getTrend(), SyntheticDataGenerator.DEFAULT_VOLUME_BASE, random));
        }
        logger.info("合成行情: {} 个标的, 共 {} 根Bar, 周期 {}", symbols.size(), data.size(), settings.getInterval().getCode());

        BacktestEngine engine = new BacktestEngine(config, strategy, new HistoricalDataSimulator(data));
        engine.addListener(new BacktestListener() {
            @Override
            public void onProgress(BacktestProgress progress) {
                logger.info("进度: {} 已处理 {} 根Bar, 市值 {}",
                        progress.currentTimestamp(), progress.barsProcessed(), progress.portfolioValue());
            }
        });
        return engine.run();
    }

    static Strategy createStrategy(String name) {
        return switch (name) {
            case "buy-and-hold" -> new BuyAndHoldStrategy();
            case "sma" -> new SmaCrossoverStrategy();
            case "rsi" -> new RsiMeanReversionStrategy();
            case "momentum" -> new MomentumStrategy();
            case "bollinger" -> new BollingerBandsStrategy();
            case "multi-factor" -> new MultiFactorStrategy();
            default -> throw new IllegalArgumentException("未知策略: " + name);
        };
    }

    private static void printUsage() {
        System.out.println("使用方法:");
        System.out.println("  java -jar quantlab-backtest.jar [strategy] [configFile]");
        System.out.println();
        System.out.println("策略:");
        System.out.println("  buy-and-hold | sma | rsi | momentum | bollinger | multi-factor");
        System.out.println();
        System.out.println("配置文件为 .properties，缺省时使用内置 backtest.properties");
    }
}
