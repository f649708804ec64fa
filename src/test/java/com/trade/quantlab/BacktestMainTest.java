package com.trade.quantlab;

import com.trade.quantlab.backtest.BacktestConfigLoader;
import com.trade.quantlab.backtest.BacktestResult;
import com.trade.quantlab.backtest.BacktestSettings;
import com.trade.quantlab.strategy.impl.BollingerBandsStrategy;
import com.trade.quantlab.strategy.impl.BuyAndHoldStrategy;
import com.trade.quantlab.strategy.impl.MomentumStrategy;
import com.trade.quantlab.strategy.impl.MultiFactorStrategy;
import com.trade.quantlab.strategy.impl.RsiMeanReversionStrategy;
import com.trade.quantlab.strategy.impl.SmaCrossoverStrategy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口测试
 */
class BacktestMainTest {

    private static BacktestSettings smallSettings() {
        Properties properties = new Properties();
        properties.setProperty("backtest.start", "2024-01-01");
        properties.setProperty("backtest.end", "2024-01-03");
        properties.setProperty("backtest.capital", "10000");
        properties.setProperty("backtest.symbols", "AAPL");
        properties.setProperty("backtest.benchmark", "SPY");
        properties.setProperty("synthetic.interval", "1h");
        properties.setProperty("synthetic.seed", "7");
        return BacktestConfigLoader.fromProperties(properties);
    }

    @Test
    void testCreateStrategy() {
        assertInstanceOf(BuyAndHoldStrategy.class, BacktestMain.createStrategy("buy-and-hold"));
        assertInstanceOf(SmaCrossoverStrategy.class, BacktestMain.createStrategy("sma"));
        assertInstanceOf(RsiMeanReversionStrategy.class, BacktestMain.createStrategy("rsi"));
        assertInstanceOf(MomentumStrategy.class, BacktestMain.createStrategy("momentum"));
        assertInstanceOf(BollingerBandsStrategy.class, BacktestMain.createStrategy("bollinger"));
        assertInstanceOf(MultiFactorStrategy.class, BacktestMain.createStrategy("multi-factor"));
    }

    @Test
    void testUnknownStrategy() {
        assertThrows(IllegalArgumentException.class, () -> BacktestMain.createStrategy("macd"));
    }

    @Test
    void testSeededRunIsReproducible() throws Exception {
        BacktestResult first = BacktestMain.runBacktest(new BuyAndHoldStrategy(), smallSettings());
        BacktestResult second = BacktestMain.runBacktest(new BuyAndHoldStrategy(), smallSettings());

        assertFalse(first.getTrades().isEmpty());
        assertFalse(first.getEquityCurve().isEmpty());
        assertEquals(0, first.getPortfolio().getTotalValue().compareTo(second.getPortfolio().getTotalValue()));
        assertEquals(first.getTrades().size(), second.getTrades().size());
    }
}
