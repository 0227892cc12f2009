package com.retrykit.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * retry.yml을 읽어 RetryConfig로 변환.
 *
 * 예상 YAML 키(모두 옵션):
 * maxAttempts: 5
 * initialDelayMs: 1000
 * multiplier: 2.0
 * maxDelayMs: 300000
 * tickIntervalMs: 10
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static RetryConfig loadDefault() throws IOException {
        return load(Path.of("retry.yml"));
    }

    public static RetryConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("retry.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static RetryConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        RetryConfig cfg = RetryConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        setInt(map, "maxAttempts", cfg::setMaxAttempts);
        setLong(map, "initialDelayMs", cfg::setInitialDelayMs);
        setDouble(map, "multiplier", cfg::setMultiplier);
        setLong(map, "maxDelayMs", cfg::setMaxDelayMs);
        setLong(map, "tickIntervalMs", cfg::setTickIntervalMs);

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }
}
