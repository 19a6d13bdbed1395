package com.ashscreener.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsShouldApplyWhenNothingConfigured() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());

        assertEquals(80, config.getInt("ratelimit.max_calls_per_minute", 0));
        assertEquals(4.0, config.getDouble("screen.dividend_yield.min_pct", 0.0), 1e-9);
        assertEquals("Asia/Shanghai", config.getString("app.zone"));
        assertEquals(tempDir.resolve("outputs/cache").normalize(), config.getPath("cache.dir"));
        assertEquals("1,2,3,4,5,6,7,8", config.getString("screen.criteria.default"));
    }

    @Test
    void nestedMapsShouldFlattenToDottedKeys() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "screen", Map.of("pool", Map.of("max_threads", 4), "criteria", Map.of("default", List.of(5, 6))),
                "fetch", Map.of("retry", Map.of("delay_ms", "0"))
        ));

        assertEquals(4, config.getInt("screen.pool.max_threads", 16));
        assertEquals("5,6", config.getString("screen.criteria.default"));
        assertEquals(0L, config.getLong("fetch.retry.delay_ms", 2000L));
    }

    @Test
    void localFileShouldOverrideClasspathResource() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"),
                "ratelimit.max_calls_per_minute=20\nscreen.pledge_ratio.max_pct=\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals(20, config.getInt("ratelimit.max_calls_per_minute", 80));
        assertEquals("Asia/Shanghai", config.getString("app.zone"));
        // blank values fall back
        assertEquals(30.0, config.getDouble("screen.pledge_ratio.max_pct", 0.0), 1e-9);
    }

    @Test
    void unparseableNumbersShouldUseFallback() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of("screen", Map.of("progress", Map.of("every", "often"))));

        assertEquals(20, config.getInt("screen.progress.every", 20));
        assertEquals("fallback", config.getString("no.such.key", "fallback"));
    }
}
