package com.trade.scalp.execution;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.strategy.Signal;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文件持久化实现
 * 每类记录一个 JSON Lines 文件，追加写入
 */
public class FilePersistence implements Persistence {

    public static final String SIGNALS_FILE = "signals.jsonl";
    public static final String TRADES_FILE = "trades.jsonl";

    private static final TypeReference<LinkedHashMap<String, String>> RECORD_TYPE = new TypeReference<>() {};

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public FilePersistence(String dataDir) {
        this.dataDir = Paths.get(dataDir);
        this.objectMapper = new ObjectMapper();

        // 确保目录存在
        try {
            Files.createDirectories(this.dataDir);
        } catch (IOException e) {
            throw new IllegalStateException("无法创建数据目录: " + dataDir, e);
        }
    }

    @Override
    public void saveSignal(Signal signal) {
        Map<String, String> record = new LinkedHashMap<>();
        record.put("symbol", signal.getSymbol().toPairString());
        record.put("side", signal.getSide().name());
        record.put("price", signal.getPrice().toPlainString());
        record.put("strength", signal.getStrength().toPlainString());
        record.put("stopLoss", signal.getStopLoss().toPlainString());
        record.put("takeProfit", signal.getTakeProfit().toPlainString());
        record.put("generatedAt", signal.getGeneratedAt().toString());
        append(SIGNALS_FILE, record);
    }

    @Override
    public void saveTrade(ClosedTrade trade) {
        Map<String, String> record = new LinkedHashMap<>();
        record.put("tradeId", trade.getTradeId());
        record.put("symbol", trade.getSymbol().toPairString());
        record.put("side", trade.getSide().name());
        record.put("entryPrice", trade.getEntryPrice().toPlainString());
        record.put("exitPrice", trade.getExitPrice().toPlainString());
        record.put("quantity", trade.getQuantity().toPlainString());
        record.put("pnl", trade.getPnl().toPlainString());
        record.put("openedAt", trade.getOpenedAt().toString());
        record.put("closedAt", trade.getClosedAt().toString());
        record.put("reason", trade.getReason().name());
        record.put("signalStrength", trade.getSignalStrength().toPlainString());
        append(TRADES_FILE, record);
    }

    /**
     * 读取已保存的交易记录
     */
    public List<Map<String, String>> loadTrades() {
        return load(TRADES_FILE);
    }

    /**
     * 读取已保存的信号记录
     */
    public List<Map<String, String>> loadSignals() {
        return load(SIGNALS_FILE);
    }

    private synchronized void append(String fileName, Map<String, String> record) {
        Path path = dataDir.resolve(fileName);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(objectMapper.writeValueAsString(record));
            writer.newLine();
        } catch (IOException e) {
            throw new IllegalStateException("写入记录失败: " + path, e);
        }
    }

    private synchronized List<Map<String, String>> load(String fileName) {
        Path path = dataDir.resolve(fileName);
        List<Map<String, String>> records = new ArrayList<>();
        if (!Files.exists(path)) {
            return records;
        }
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    records.add(objectMapper.readValue(line, RECORD_TYPE));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("读取记录失败: " + path, e);
        }
        return records;
    }
}
