package com.ashscreener.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.StringJoiner;

/**
 * 模块说明：Config（class）。
 * 主要职责：汇总筛选器的运行参数，取值顺序为工作目录 config.properties、classpath config.properties、内置默认值。
 * 使用建议：空白值视为未配置；数值解析失败时回退到调用方给出的兜底值。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final String FILE_NAME = "config.properties";

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry("outputs.dir", "outputs"),
            Map.entry("cache.dir", "outputs/cache"),
            Map.entry("snapshot.stock_list.path", "outputs/stock_list_snapshot.json"),
            Map.entry("ratelimit.max_calls_per_minute", "80"),
            Map.entry("fetch.retry.max_attempts", "3"),
            Map.entry("fetch.retry.delay_ms", "2000"),
            Map.entry("eastmoney.request_timeout_sec", "30"),
            Map.entry("eastmoney.page_size", "500"),
            Map.entry("eastmoney.max_pages", "200"),
            Map.entry("app.zone", "Asia/Shanghai"),
            Map.entry("screen.pool.max_threads", "16"),
            Map.entry("screen.progress.every", "20"),
            Map.entry("screen.dividend_yield.min_pct", "4.0"),
            Map.entry("screen.pledge_ratio.max_pct", "30"),
            Map.entry("screen.dividend.required_years", "5"),
            Map.entry("screen.financing.lookback_years", "5"),
            Map.entry("screen.criteria.default", "1,2,3,4,5,6,7,8")
    );

    private final Properties values = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    /**
     * Reads the bundled {@code config.properties}, then lets a file of the same name in
     * {@code workingDir} replace individual keys. An unreadable local file is logged and skipped.
     */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.values.load(in);
            }
        } catch (IOException e) {
            LOG.warn("bundled {} unreadable, using defaults: {}", FILE_NAME, e.getMessage());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            Properties overrides = new Properties();
            try (InputStream in = Files.newInputStream(local)) {
                overrides.load(in);
                config.values.putAll(overrides);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }
        return config;
    }

    /**
     * Builds a config from nested maps, {@code Map.of("screen", Map.of("pool", Map.of("max_threads", 4)))}
     * becomes {@code screen.pool.max_threads=4}. Collections are joined with commas.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> nested) {
        Config config = new Config(workingDir);
        config.bind("", nested);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = values.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return DEFAULTS.getOrDefault(key, "");
        }
        return raw.trim();
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    public int getInt(String key, int fallback) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public long getLong(String key, long fallback) {
        try {
            return Long.parseLong(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        try {
            return Double.parseDouble(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Resolves a configured path against the working directory; relative values stay inside it.
     */
    public Path getPath(String key) {
        String value = getString(key);
        return value.isEmpty() ? workingDir : workingDir.resolve(value).normalize();
    }

    private void bind(String prefix, Object value) {
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (!key.isEmpty()) {
                    bind(prefix.isEmpty() ? key : prefix + "." + key, entry.getValue());
                }
            }
        } else if (value instanceof Iterable<?> items) {
            StringJoiner joined = new StringJoiner(",");
            for (Object item : items) {
                joined.add(item == null ? "" : item.toString());
            }
            values.setProperty(prefix, joined.toString());
        } else if (value != null && !prefix.isEmpty()) {
            values.setProperty(prefix, value.toString());
        }
    }
}
