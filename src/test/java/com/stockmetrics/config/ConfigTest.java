package com.stockmetrics.config;

import com.stockmetrics.rolling.WindowAlignment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void load_shouldLayerLocalFileOverResourceAndDefaults(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"),
                "rolling.window=20\npipeline.threads=  \n", StandardCharsets.UTF_8);

        Config config = Config.load(dir);

        assertEquals(20, config.getInt("rolling.window", 30));
        assertEquals("local", config.sourceOf("rolling.window"));
        assertEquals(1, config.getInt("pipeline.threads", 8));
        assertEquals("resource", config.sourceOf("returns.scale"));
        assertEquals("default", config.sourceOf("log.route_stdout"));
        assertTrue(config.getBoolean("log.route_stdout", false));
    }

    @Test
    void withOverrides_shouldWinOverEveryOtherLayer(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "rolling.window=20\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir).withOverrides(Map.of("rolling.window", "45", " ", "ignored"));

        assertEquals(45, config.getInt("rolling.window", 30));
        assertEquals("rolling.window=45 (override)", config.resolve("rolling.window").toString());
    }

    @Test
    void of_shouldFallBackToBuiltInDefaults(@TempDir Path dir) {
        Config config = Config.of(dir, Map.of("correlation.symbol_pairwise.enabled", "yes"));

        assertEquals(30, config.getInt("rolling.window", 0));
        assertEquals(2, config.getInt("returns.scale", 0));
        assertTrue(config.getBoolean("correlation.symbol_pairwise.enabled", false));
        assertTrue(config.getBoolean("output.pretty_json", false));
        assertEquals("fallback", config.getString("no.such.key", "fallback"));
        assertEquals(dir.resolve("outputs").normalize(), config.getPath("outputs.dir"));
    }

    @Test
    void getInt_shouldUseFallbackForMalformedNumbers(@TempDir Path dir) {
        Config config = Config.of(dir, Map.of("pipeline.threads", "four"));

        assertEquals(3, config.getInt("pipeline.threads", 3));
    }

    @Test
    void getEnum_shouldMatchCaseInsensitivelyAndFallBackOnUnknown(@TempDir Path dir) {
        Config lower = Config.of(dir, Map.of("rolling.summary_alignment", "trailing"));
        Config unknown = Config.of(dir, Map.of("rolling.summary_alignment", "sideways"));

        assertEquals(WindowAlignment.TRAILING,
                lower.getEnum("rolling.summary_alignment", WindowAlignment.class, WindowAlignment.CENTERED));
        assertEquals(WindowAlignment.CENTERED,
                unknown.getEnum("rolling.summary_alignment", WindowAlignment.class, WindowAlignment.CENTERED));
        assertFalse(lower.getBoolean("no.such.flag"));
    }
}
