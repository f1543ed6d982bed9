package com.venturescout.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 → classpath config.properties → 工作目录 config.properties 的顺序叠加配置。
 * 使用建议：新增配置项时同步更新 DEFAULTS，避免调用方各自写死默认值。
 */
public final class Config {

    /** Where a value came from, lowest precedence first. */
    enum Layer {
        DEFAULT("default"),
        RESOURCE("resource"),
        OVERRIDE("override");

        final String label;

        Layer(String label) {
            this.label = label;
        }
    }

    private static final Map<String, String> DEFAULTS = defaultTable(
            "outputs.dir", "outputs",
            "batch.threads", "4",
            "batch.top_n", "20",
            "cache.capacity", "1000",
            "cache.ttl_sec", "3600",
            "cache.max_chars", "2000",
            "embedding.provider", "hashing",
            "embedding.dimension", "384",
            "ollama.base_url", "http://127.0.0.1:11434",
            "ollama.model", "nomic-embed-text",
            "ollama.timeout_sec", "60",
            "ratelimit.max_requests", "20",
            "ratelimit.window_sec", "60",
            "weight.overall.fit", "0.4",
            "weight.overall.quality", "0.3",
            "weight.overall.portfolio", "0.3",
            "weight.quality.founder", "0.4",
            "weight.quality.company", "0.35",
            "weight.quality.team", "0.25",
            "weight.fit.similarity", "0.40",
            "weight.fit.industry", "0.20",
            "weight.fit.stage", "0.15",
            "weight.fit.location", "0.10",
            "weight.fit.network", "0.15",
            "conflict.threshold", "60",
            "recommendation.strong", "80",
            "recommendation.good", "60",
            "recommendation.moderate", "40"
    );

    private final Path workingDir;
    private final EnumMap<Layer, Map<String, String>> layers = new EnumMap<>(Layer.class);

    private Config(Path workingDir) {
        this.workingDir = workingDir == null ? Path.of(".").toAbsolutePath().normalize() : workingDir;
        layers.put(Layer.DEFAULT, DEFAULTS);
        layers.put(Layer.RESOURCE, new LinkedHashMap<>());
        layers.put(Layer.OVERRIDE, new LinkedHashMap<>());
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.readInto(Layer.RESOURCE, new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            System.err.println("WARN: classpath config.properties unreadable: " + e.getMessage());
        }

        Path local = config.workingDir.resolve("config.properties");
        if (Files.isRegularFile(local)) {
            try (Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                config.readInto(Layer.OVERRIDE, reader);
            } catch (IOException e) {
                System.err.println("WARN: " + local + " unreadable: " + e.getMessage());
            }
        }
        return config;
    }

    /**
     * Config from Spring-bound {@code venturescout.*} properties. Nested maps become dotted keys;
     * lists and arrays become comma-separated values. Everything lands in the override layer.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        config.flatten("", rawProperties);
        return config;
    }

    public static Config defaultsOnly() {
        return new Config(null);
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * Highest-precedence non-blank value, or "" when no layer has one.
     */
    public String getString(String key) {
        Layer layer = layerOf(key);
        return layer == null ? "" : layers.get(layer).get(key).trim();
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    public int getInt(String key, int fallback) {
        return parse(key, fallback, Integer::valueOf);
    }

    public long getLong(String key, long fallback) {
        return parse(key, fallback, Long::valueOf);
    }

    public double getDouble(String key, double fallback) {
        return parse(key, fallback, Double::valueOf);
    }

    public Path getPath(String key) {
        String value = getString(key);
        return value.isEmpty() ? workingDir : workingDir.resolve(value).normalize();
    }

    /**
     * Comma- or semicolon-separated value, blank items dropped.
     */
    public List<String> getList(String key) {
        List<String> out = new ArrayList<>();
        for (String token : getString(key).split("[,;]")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    /**
     * Explicitly configured keys under {@code prefix + "."}, with the prefix removed. Defaults are
     * not included.
     */
    public Map<String, String> getSection(String prefix) {
        String head = prefix == null || prefix.isBlank() ? "" : prefix.trim() + ".";
        Map<String, String> out = new TreeMap<>();
        for (Layer layer : List.of(Layer.RESOURCE, Layer.OVERRIDE)) {
            layers.get(layer).forEach((name, value) -> {
                if (name.startsWith(head) && name.length() > head.length() && !value.isBlank()) {
                    out.put(name.substring(head.length()), value.trim());
                }
            });
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    /**
     * "override", "resource" or "default": the layer that supplies {@code key}.
     */
    public String sourceOf(String key) {
        Layer layer = layerOf(key);
        return layer == null ? Layer.DEFAULT.label : layer.label;
    }

    private Layer layerOf(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        Layer[] order = Layer.values();
        for (int i = order.length - 1; i >= 0; i--) {
            String value = layers.get(order[i]).get(key);
            if (value != null && !value.isBlank()) {
                return order[i];
            }
        }
        return null;
    }

    private <T> T parse(String key, T fallback, Function<String, T> parser) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            System.err.println("WARN: config " + key + "=" + value + " is not a number, using " + fallback);
            return fallback;
        }
    }

    private void readInto(Layer layer, Reader reader) throws IOException {
        Properties loaded = new Properties();
        loaded.load(reader);
        Map<String, String> target = layers.get(layer);
        for (String name : loaded.stringPropertyNames()) {
            target.put(name, loaded.getProperty(name));
        }
    }

    private void flatten(String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                String name = k == null ? "" : k.toString().trim();
                if (!name.isEmpty()) {
                    flatten(prefix.isEmpty() ? name : prefix + "." + name, v);
                }
            });
        } else if (value instanceof Collection<?> items) {
            bind(prefix, joined(items));
        } else if (value instanceof Object[] array) {
            bind(prefix, joined(Arrays.asList(array)));
        } else {
            bind(prefix, String.valueOf(value));
        }
    }

    private void bind(String key, String value) {
        if (!key.isBlank()) {
            layers.get(Layer.OVERRIDE).put(key.trim(), value);
        }
    }

    private static String joined(Collection<?> items) {
        List<String> parts = new ArrayList<>(items.size());
        for (Object item : items) {
            parts.add(item == null ? "" : String.valueOf(item));
        }
        return String.join(",", parts);
    }

    private static Map<String, String> defaultTable(String... keyValuePairs) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValuePairs.length; i += 2) {
            table.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return Map.copyOf(table);
    }
}
