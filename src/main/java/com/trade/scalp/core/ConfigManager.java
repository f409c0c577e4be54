package com.trade.scalp.core;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 配置管理器
 * 加载顺序：classpath 下的 scalp-defaults.properties，再用工作目录的 config.properties 覆盖
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    public static final String DEFAULTS_RESOURCE = "scalp-defaults.properties";
    public static final String CONFIG_FILE = "config.properties";

    private static ConfigManager instance;

    private final Properties properties;

    public ConfigManager(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = load(Paths.get(CONFIG_FILE));
        }
        return instance;
    }

    /**
     * 加载默认配置，并用指定文件覆盖（文件不存在时只使用默认值）
     */
    public static ConfigManager load(Path overrideFile) {
        Properties merged = new Properties();
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("未找到默认配置 {}，全部使用代码内默认值", DEFAULTS_RESOURCE);
            } else {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    merged.load(reader);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法加载默认配置: " + DEFAULTS_RESOURCE, e);
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                merged.load(reader);
                logger.info("已加载配置文件: {}", overrideFile.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("无法加载配置文件: " + overrideFile, e);
            }
        }
        return new ConfigManager(merged);
    }

    /**
     * 获取必填配置
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("配置项缺失: " + key);
        }
        return value.trim();
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    /**
     * 检查属性是否存在且非空
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    public int getIntProperty(String key, int defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是整数: {}，使用默认值 {}", key, properties.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是整数: {}，使用默认值 {}", key, properties.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(getProperty(key));
    }

    public BigDecimal getDecimalProperty(String key, BigDecimal defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return new BigDecimal(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是数字: {}，使用默认值 {}", key, properties.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    /**
     * 逗号分隔的整数列表，如 trading.days=1,2,3,4,5
     */
    public List<Integer> getIntListProperty(String key, List<Integer> defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        List<Integer> values = new ArrayList<>();
        for (String part : getProperty(key).split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                values.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                logger.warn("配置项 {} 含非法整数: {}，使用默认值 {}", key, part, defaultValue);
                return defaultValue;
            }
        }
        return values;
    }
}
