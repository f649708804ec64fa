package com.trade.quantlab.backtest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trade.quantlab.core.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 回测结果导出为JSON
 */
public class BacktestReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(BacktestReportWriter.class);

    private final ObjectMapper objectMapper;

    public BacktestReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void write(BacktestResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), toReport(result));
        logger.info("回测报告已写入: {}", path);
    }

    public String toJson(BacktestResult result) {
        try {
            return objectMapper.writeValueAsString(toReport(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("回测报告序列化失败", e);
        }
    }

    private Map<String, Object> toReport(BacktestResult result) {
        BacktestConfig config = result.getConfig();
        Map<String, Object> report = new LinkedHashMap<>();

        Map<String, Object> configNode = new LinkedHashMap<>();
        configNode.put("startDate", config.getStartDate());
        configNode.put("endDate", config.getEndDate());
        configNode.put("initialCapital", config.getInitialCapital());
        configNode.put("symbols", config.getSymbols());
        configNode.put("commission", config.getCommission());
        configNode.put("slippage", config.getSlippage());
        configNode.put("benchmarkSymbol", config.getBenchmarkSymbol());
        report.put("config", configNode);

        report.put("metrics", result.getMetrics());

        Portfolio portfolio = result.getPortfolio();
        Map<String, Object> portfolioNode = new LinkedHashMap<>();
        portfolioNode.put("cash", portfolio.getCash());
        portfolioNode.put("totalValue", portfolio.getTotalValue());
        portfolioNode.put("totalPnL", portfolio.getTotalPnL());
        List<Map<String, Object>> positions = new ArrayList<>();
        for (Position position : portfolio.getPositions().values()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("symbol", position.getSymbol());
            node.put("quantity", position.getQuantity());
            node.put("averagePrice", position.getAveragePrice());
            node.put("marketValue", position.getMarketValue());
            node.put("unrealizedPnL", position.getUnrealizedPnL());
            node.put("realizedPnL", position.getRealizedPnL());
            positions.add(node);
        }
        portfolioNode.put("positions", positions);
        report.put("portfolio", portfolioNode);

        List<Map<String, Object>> trades = new ArrayList<>();
        for (Trade trade : result.getTrades()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", trade.getId());
            node.put("timestamp", trade.getTimestamp());
            node.put("symbol", trade.getSymbol());
            node.put("side", trade.getSide());
            node.put("quantity", trade.getQuantity());
            node.put("price", trade.getPrice());
            node.put("commission", trade.getCommission());
            node.put("slippage", trade.getSlippage());
            node.put("strategyId", trade.getStrategyId());
            trades.add(node);
        }
        report.put("trades", trades);

        report.put("equityCurve", result.getEquityCurve());
        return report;
    }
}
