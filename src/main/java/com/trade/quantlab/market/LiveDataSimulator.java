package com.trade.quantlab.market;

import com.trade.quantlab.core.Decimal;
import com.trade.quantlab.core.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 模拟实时行情流
 *
 * 后台线程按固定间隔生成Bar放入缓冲队列，回测线程通过拉取接口消费。
 * 生成中或缓冲区仍有未读Bar时 hasMoreData() 为 true
 */
public class LiveDataSimulator implements MarketSimulator {

    private static final Logger logger = LoggerFactory.getLogger(LiveDataSimulator.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    private final List<String> symbols;
    private final Duration interval;
    private final Duration pollTimeout;   // getNextBar 等待新Bar的最长时间
    private final Supplier<List<MarketData>> generator;
    private final BlockingQueue<MarketData> buffer;
    private final Random random;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;
    private volatile boolean running;
    private volatile Instant lastTimestamp;

    public LiveDataSimulator(List<String> symbols) {
        this(symbols, DEFAULT_INTERVAL, null);
    }

    /**
     * @param generator 每个周期产生一批Bar，为null时使用默认随机生成
     */
    public LiveDataSimulator(List<String> symbols, Duration interval, Supplier<List<MarketData>> generator) {
        this.symbols = List.copyOf(symbols);
        this.interval = interval;
        this.pollTimeout = interval;
        this.random = new Random();
        this.generator = generator != null ? generator : this::randomBars;
        this.buffer = new LinkedBlockingQueue<>();
    }

    /**
     * 开始生成，立即产生第一批
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "live-data-simulator");
            t.setDaemon(true);
            return t;
        });
        task = scheduler.scheduleAtFixedRate(this::generate, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("实时行情模拟已启动: {} 间隔 {}ms", symbols, interval.toMillis());
    }

    /**
     * 停止生成，已缓冲的Bar仍可读取
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (task != null) {
            task.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        logger.info("实时行情模拟已停止，剩余未读 {} 条", buffer.size());
    }

    public boolean isRunning() {
        return running;
    }

    private void generate() {
        if (!running) {
            return;
        }
        try {
            List<MarketData> bars = generator.get();
            if (bars != null) {
                buffer.addAll(bars);
            }
        } catch (RuntimeException e) {
            // 单次生成失败不影响后续周期
            logger.error("生成实时行情失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public boolean hasMoreData() {
        return running || !buffer.isEmpty();
    }

    /**
     * 读取下一根Bar，缓冲区为空且仍在生成时最多等待一个周期
     */
    @Override
    public MarketData getNextBar() {
        MarketData bar = buffer.poll();
        if (bar == null && running) {
            try {
                bar = buffer.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("等待实时行情时被中断");
                return null;
            }
        }
        if (bar != null) {
            lastTimestamp = bar.getTimestamp();
        }
        return bar;
    }

    /**
     * 最近读取的Bar时间，尚未读取时返回当前时间
     */
    @Override
    public Instant getCurrentTimestamp() {
        Instant timestamp = lastTimestamp;
        return timestamp != null ? timestamp : Instant.now();
    }

    @Override
    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * 清空缓冲区，不影响生成状态
     */
    @Override
    public void reset() {
        buffer.clear();
        lastTimestamp = null;
    }

    private List<MarketData> randomBars() {
        Instant now = Instant.now();
        List<MarketData> bars = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            double open = 100 + random.nextDouble() * 10;
            double close = 100 + random.nextDouble() * 10;
            double high = Math.max(open, close) + random.nextDouble() * 5;
            double low = Math.min(open, close) - random.nextDouble() * 5;
            long volume = Math.round(1_000_000 * (0.5 + random.nextDouble()));
            bars.add(new MarketData(now, symbol,
                    Decimal.scalePrice(BigDecimal.valueOf(open)),
                    Decimal.scalePrice(BigDecimal.valueOf(high)),
                    Decimal.scalePrice(BigDecimal.valueOf(low)),
                    Decimal.scalePrice(BigDecimal.valueOf(close)),
                    BigDecimal.valueOf(volume),
                    Decimal.scalePrice(BigDecimal.valueOf((high + low + close) / 3))));
        }
        return bars;
    }
}
