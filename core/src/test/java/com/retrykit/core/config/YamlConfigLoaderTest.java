package com.retrykit.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    @Test
    void loadsAllKeys() throws IOException {
        Path yml = tmp.resolve("retry.yml");
        Files.writeString(yml, String.join("\n",
                "maxAttempts: 7",
                "initialDelayMs: 250",
                "multiplier: 1.5",
                "maxDelayMs: 4000",
                "tickIntervalMs: 5",
                "unknownKey: ignored"));

        RetryConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getMaxAttempts()).isEqualTo(7);
        assertThat(cfg.getInitialDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(cfg.getMultiplier()).isEqualTo(1.5);
        assertThat(cfg.getMaxDelay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(cfg.getTickInterval()).isEqualTo(Duration.ofMillis(5));
    }

    @Test
    void stringValuesAreParsed() {
        RetryConfig cfg = YamlConfigLoader.load(in("maxAttempts: \"3\"\nmultiplier: \"2.5\"\n"));
        assertThat(cfg.getMaxAttempts()).isEqualTo(3);
        assertThat(cfg.getMultiplier()).isEqualTo(2.5);
    }

    @Test
    void emptyDocumentKeepsDefaults() {
        RetryConfig cfg = YamlConfigLoader.load(in(""));
        assertThat(cfg.getMaxAttempts()).isEqualTo(5);
        assertThat(cfg.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void invalidValuesFailValidation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(in("maxAttempts: 0\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void missingFileIsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("retry.yml not found");
    }

    private static ByteArrayInputStream in(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
