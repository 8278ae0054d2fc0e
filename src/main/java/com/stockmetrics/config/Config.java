package com.stockmetrics.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 → classpath config.properties → 工作目录 config.properties → 命令行覆盖 的顺序合并配置。
 * 使用建议：新增配置项时同步在 buildDefaults 中登记默认值，sourceOf 依赖这里判断来源。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties localProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：先读 classpath 资源，再用工作目录下的同名文件覆盖。
 * 维护提示：本地文件读取失败只告警，不中断运行。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.localProps.load(in);
                config.props.putAll(config.localProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Config backed only by defaults plus the given values; used by tests and embedders.
     */
    public static Config of(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        return config.withOverrides(values);
    }

    /**
     * Applies command-line style overrides on top of whatever was loaded.
     */
    public Config withOverrides(Map<String, String> overrides) {
        if (overrides == null) {
            return this;
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().trim();
            if (key.isEmpty() || entry.getValue() == null) {
                continue;
            }
            overrideProps.setProperty(key, entry.getValue());
            props.setProperty(key, entry.getValue());
        }
        return this;
    }

/**
 * 方法说明：getString，负责获取数据并返回结果。
 * 处理流程：空白值视为未配置，回落到默认值表。
 */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

/**
 * 方法说明：getEnum，负责获取数据并返回结果。
 * 处理流程：大小写不敏感地匹配枚举名，无法识别时使用 fallback。
 */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("WARN: unknown value for " + key + ": " + value + ", using " + fallback);
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(localProps.getProperty(key)).isEmpty()) {
            return "local";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("input.path", "");
        defaults.put("output.pretty_json", "true");
        defaults.put("log.route_stdout", "true");

        defaults.put("returns.scale", "2");

        defaults.put("rolling.window", "30");
        defaults.put("rolling.summary_alignment", "CENTERED");

        defaults.put("correlation.symbol_pairwise.enabled", "false");

        defaults.put("pipeline.threads", "1");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }

        @Override
        public String toString() {
            return key + "=" + value + " (" + source + ")";
        }
    }
}
