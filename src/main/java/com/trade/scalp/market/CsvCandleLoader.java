package com.trade.scalp.market;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Symbol;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV K线加载器
 * 格式（首行为表头）：closeTime,open,high,low,close,volume
 * closeTime 支持 ISO-8601 或毫秒时间戳
 */
public final class CsvCandleLoader {

    private CsvCandleLoader() {
    }

    public static List<Candle> load(Path path, Symbol symbol) throws IOException {
        List<Candle> candles = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line = reader.readLine(); // header
            if (line == null) {
                return candles;
            }
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < 6) {
                    throw new IOException("第 " + lineNo + " 行字段不足: " + line);
                }
                try {
                    candles.add(new Candle(
                            symbol,
                            parseTime(parts[0].trim()),
                            new BigDecimal(parts[1].trim()),
                            new BigDecimal(parts[2].trim()),
                            new BigDecimal(parts[3].trim()),
                            new BigDecimal(parts[4].trim()),
                            new BigDecimal(parts[5].trim())
                    ));
                } catch (RuntimeException e) {
                    throw new IOException("第 " + lineNo + " 行解析失败: " + line, e);
                }
            }
        }

        return candles;
    }

    private static Instant parseTime(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        return Instant.parse(value);
    }
}
