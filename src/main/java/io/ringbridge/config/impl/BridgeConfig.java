package io.ringbridge.config.impl;

import io.ringbridge.ack.FailurePolicy;
import io.ringbridge.config.InvalidConfigurationException;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable application settings loaded from bridge.yaml
 */
@Getter
public final class BridgeConfig {

    private static final String COMPONENT = "bridge.yaml";

    private String name;
    private Duration resolvePendingTimeout;
    private FailurePolicy onFailure;
    private int concurrency;
    private int maxDemand;

    public static BridgeConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static BridgeConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        return from(m == null ? Map.of() : m);
    }

    public static BridgeConfig defaults() {
        return from(Map.of());
    }

    static BridgeConfig from(final Map<String, Object> m) {
        final BridgeConfig cfg = new BridgeConfig();

        cfg.name                  = string(m, "name", "memory-producer");
        cfg.resolvePendingTimeout = Duration.ofMillis(positive(m, "resolvePendingTimeoutMs", 100));
        cfg.concurrency           = (int) positive(m, "concurrency", 4);
        cfg.maxDemand             = (int) positive(m, "maxDemand", 10);

        final Object onFailure = m.getOrDefault("onFailure", "discard");
        cfg.onFailure = FailurePolicy.from(onFailure);
        if (cfg.onFailure == null) {
            throw new InvalidConfigurationException(COMPONENT, "onFailure",
                    "expected one of [discard, requeue], got: " + onFailure);
        }

        return cfg;
    }

    private static String string(final Map<String, Object> m, final String key, final String def) {
        final Object v = m.getOrDefault(key, def);
        if (!(v instanceof String s) || s.isBlank()) {
            throw new InvalidConfigurationException(COMPONENT, key, "expected a non-blank string, got: " + v);
        }
        return s;
    }

    private static long positive(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.getOrDefault(key, def);
        if (!(v instanceof Integer || v instanceof Long) || ((Number) v).longValue() <= 0) {
            throw new InvalidConfigurationException(COMPONENT, key, "expected a positive integer, got: " + v);
        }
        return ((Number) v).longValue();
    }
}
