package com.trade.quantlab.backtest;

import com.trade.quantlab.analysis.PerformanceAnalyzer;
import com.trade.quantlab.analysis.PerformanceMetrics;
import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import com.trade.quantlab.core.Signal;
import com.trade.quantlab.core.Trade;
import com.trade.quantlab.execution.ExecutionModel;
import com.trade.quantlab.execution.RealisticExecutionModel;
import com.trade.quantlab.market.MarketSimulator;
import com.trade.quantlab.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 回测引擎
 *
 * 职责：
 * 1. 逐Bar回放行情并按收盘价估值
 * 2. 调用策略产出信号，经成交模型转换为成交
 * 3. 按顺序把成交记入组合账本
 * 4. 记录资金曲线与持仓快照，输出回测结果
 *
 * 状态：IDLE → RUNNING → {PAUSED ⇄ RUNNING} → {STOPPED | COMPLETED | ERRORED}
 *
 * 回测循环只在一个线程上运行；pause/resume/stop 可以从其他线程调用，
 * 标志只在每轮循环开始时读取，正在处理的Bar总会完整处理完
 */
public class BacktestEngine {

    private static final Logger logger = LoggerFactory.getLogger(BacktestEngine.class);

    private static final int PROGRESS_INTERVAL = 1000;  // 每1000根Bar通知一次进度

    private final BacktestConfig config;
    private final Strategy strategy;
    private final MarketSimulator simulator;
    private final ExecutionModel executionModel;
    private final PerformanceAnalyzer analyzer;
    private final Portfolio portfolio;
    private final List<BacktestListener> listeners;

    private final List<EquityPoint> equityCurve;
    private final List<PositionSnapshot> positionHistory;
    private final List<BigDecimal> benchmarkPrices;    // 与资金曲线一一对应的基准收盘价

    private final AtomicBoolean running;
    private final AtomicBoolean paused;
    private final ReentrantLock pauseLock;
    private final Condition resumed;

    private volatile EngineState state;
    private volatile Instant currentTimestamp;
    private volatile long barsProcessed;
    private BigDecimal peakValue;
    private BigDecimal latestBenchmarkPrice;

    public BacktestEngine(BacktestConfig config, Strategy strategy, MarketSimulator simulator) {
        this(config, strategy, simulator, new RealisticExecutionModel(config));
    }

    public BacktestEngine(BacktestConfig config, Strategy strategy, MarketSimulator simulator,
                          ExecutionModel executionModel) {
        this.config = config;
        this.strategy = strategy;
        this.simulator = simulator;
        this.executionModel = executionModel;
        this.analyzer = new PerformanceAnalyzer();
        this.portfolio = new Portfolio(config.getInitialCapital());
        this.listeners = new CopyOnWriteArrayList<>();
        this.equityCurve = new ArrayList<>();
        this.positionHistory = new ArrayList<>();
        this.benchmarkPrices = new ArrayList<>();
        this.running = new AtomicBoolean(false);
        this.paused = new AtomicBoolean(false);
        this.pauseLock = new ReentrantLock();
        this.resumed = pauseLock.newCondition();
        this.state = EngineState.IDLE;
        this.currentTimestamp = config.getStartDate();
        this.peakValue = config.getInitialCapital();
    }

    public void addListener(BacktestListener listener) {
        listeners.add(listener);
    }

    public void removeListener(BacktestListener listener) {
        listeners.remove(listener);
    }

    /**
     * 运行回测
     *
     * @return 回测结果；被 stop() 中止时返回截至当前的部分结果
     * @throws BacktestException 行情源、策略或成交模型抛出异常时
     */
    public BacktestResult run() throws BacktestException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("回测正在运行中");
        }
        paused.set(false);
        state = EngineState.RUNNING;

        logger.info("开始回测: {} {} - {} 初始资金: {}",
                strategy.getName(), config.getStartDate(), config.getEndDate(), config.getInitialCapital());
        fire(listener -> listener.onStarted(config));

        try {
            strategy.initialize(config.getSymbols());
            simulator.reset();

            while (simulator.hasMoreData() && running.get()) {
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("回测线程被中断，停止回测");
                    running.set(false);
                    state = EngineState.STOPPED;
                    break;
                }
                if (paused.get()) {
                    awaitResume();
                    continue;
                }

                MarketData bar = simulator.getNextBar();
                if (bar == null) {
                    continue;
                }

                currentTimestamp = bar.getTimestamp();

                // 跳过回测区间外的Bar
                if (!config.contains(bar.getTimestamp())) {
                    continue;
                }

                processBar(bar);
            }

            strategy.finish(portfolio);

            BacktestResult result = generateResult();
            if (state != EngineState.STOPPED) {
                state = EngineState.COMPLETED;
            }

            logger.info("回测结束({}): 处理 {} 根Bar, 成交 {} 笔, 最终市值 {}",
                    state, barsProcessed, result.getTrades().size(), result.getPortfolio().getTotalValue());
            fire(listener -> listener.onCompleted(result));
            return result;

        } catch (RuntimeException e) {
            state = EngineState.ERRORED;
            logger.error("回测运行失败: {}", e.getMessage(), e);
            fire(listener -> listener.onError(e));
            throw new BacktestException("回测运行失败: " + e.getMessage(), e);
        } finally {
            running.set(false);
            paused.set(false);
        }
    }

    /**
     * 处理一根区间内的Bar
     */
    private void processBar(MarketData bar) {
        executionModel.onMarketData(bar);

        synchronized (portfolio) {
            portfolio.markToMarket(bar);
        }
        if (config.hasBenchmark() && config.getBenchmarkSymbol().equals(bar.getSymbol())) {
            latestBenchmarkPrice = bar.getClose();
        }

        List<Signal> signals = strategy.onBar(bar, portfolio);
        if (signals != null) {
            // 信号按返回顺序逐个执行
            for (Signal signal : signals) {
                Trade trade = executionModel.executeSignal(signal, bar, portfolio);
                if (trade == null) {
                    continue;
                }
                Trade applied;
                synchronized (portfolio) {
                    applied = portfolio.apply(trade);
                }
                if (applied != null) {
                    logger.debug("成交: {} {} {} @ {} 手续费:{} 滑点:{}",
                            applied.getSide().getChineseName(), applied.getSymbol(), applied.getQuantity(),
                            applied.getPrice(), applied.getCommission(), applied.getSlippage());
                    fire(listener -> listener.onTrade(applied));
                    strategy.onTrade(applied, portfolio);
                }
            }
        }

        synchronized (portfolio) {
            recordEquityPoint();
            recordPositions();
            barsProcessed++;
        }

        if (barsProcessed % PROGRESS_INTERVAL == 0) {
            BacktestProgress progress = getProgress();
            fire(listener -> listener.onProgress(progress));
        }
    }

    private void recordEquityPoint() {
        BigDecimal value = portfolio.getTotalValue();
        peakValue = Decimal.max(peakValue, value);
        BigDecimal drawdown = Decimal.divide(peakValue.subtract(value), peakValue);
        equityCurve.add(new EquityPoint(currentTimestamp, value, drawdown));
        if (config.hasBenchmark()) {
            benchmarkPrices.add(latestBenchmarkPrice);
        }
    }

    private void recordPositions() {
        List<Position> copies = new ArrayList<>();
        for (Position position : portfolio.getPositions().values()) {
            copies.add(position.copy());
        }
        positionHistory.add(new PositionSnapshot(currentTimestamp, List.copyOf(copies)));
    }

    private BacktestResult generateResult() {
        List<Double> benchmarkReturns = config.hasBenchmark()
                ? analyzer.calculatePriceReturns(benchmarkPrices)
                : null;
        synchronized (portfolio) {
            List<Trade> trades = List.copyOf(portfolio.getTrades());
            PerformanceMetrics metrics = analyzer.calculateMetrics(equityCurve, trades, config, benchmarkReturns);
            List<Double> strategyReturns = analyzer.calculateReturns(equityCurve);
            return new BacktestResult(
                    config,
                    portfolio.copy(),
                    metrics,
                    List.copyOf(equityCurve),
                    trades,
                    List.copyOf(positionHistory),
                    strategyReturns,
                    benchmarkReturns
            );
        }
    }

    /**
     * 等待 resume() 或 stop()
     */
    private void awaitResume() {
        pauseLock.lock();
        try {
            while (paused.get() && running.get()) {
                resumed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("回测线程在暂停期间被中断，停止回测");
            running.set(false);
            state = EngineState.STOPPED;
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * 暂停回测，当前Bar处理完后生效
     */
    public void pause() {
        pauseLock.lock();
        try {
            // 与 stop() 互斥，已停止的回测不能再进入暂停
            if (!running.get() || !paused.compareAndSet(false, true)) {
                return;
            }
            state = EngineState.PAUSED;
            logger.info("回测已暂停");
            fire(BacktestListener::onPaused);
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * 恢复回测
     */
    public void resume() {
        if (!paused.compareAndSet(true, false)) {
            return;
        }
        pauseLock.lock();
        try {
            if (running.get()) {
                state = EngineState.RUNNING;
            }
            resumed.signalAll();
        } finally {
            pauseLock.unlock();
        }
        logger.info("回测已恢复");
        fire(BacktestListener::onResumed);
    }

    /**
     * 停止回测，run() 在当前Bar处理完后返回部分结果
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        pauseLock.lock();
        try {
            paused.set(false);
            state = EngineState.STOPPED;
            resumed.signalAll();
        } finally {
            pauseLock.unlock();
        }
        logger.info("回测已停止");
        fire(BacktestListener::onStopped);
    }

    /**
     * 恢复到初始状态以便再次运行
     */
    public void reset() {
        if (running.get()) {
            throw new IllegalStateException("回测运行中不能重置");
        }
        synchronized (portfolio) {
            portfolio.reset();
            equityCurve.clear();
            positionHistory.clear();
            benchmarkPrices.clear();
            barsProcessed = 0;
        }
        executionModel.reset();
        peakValue = config.getInitialCapital();
        latestBenchmarkPrice = null;
        currentTimestamp = config.getStartDate();
        state = EngineState.IDLE;
        logger.info("回测引擎已重置");
    }

    /**
     * 当前进度（副本）
     */
    public BacktestProgress getProgress() {
        synchronized (portfolio) {
            return new BacktestProgress(currentTimestamp, portfolio.getTotalValue(),
                    portfolio.getTotalPnL(), barsProcessed, state);
        }
    }

    /**
     * 当前组合（独立副本，修改不会影响引擎）
     */
    public Portfolio getPortfolioSnapshot() {
        synchronized (portfolio) {
            return portfolio.copy();
        }
    }

    public EngineState getState() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isPaused() {
        return paused.get();
    }

    public BacktestConfig getConfig() {
        return config;
    }

    /**
     * 通知监听器，监听器异常只记录日志
     */
    private void fire(Consumer<BacktestListener> event) {
        for (BacktestListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                logger.error("回测监听器处理事件失败: {}", e.getMessage(), e);
            }
        }
    }
}
