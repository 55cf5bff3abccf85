package io.ringbridge.config.type;

import io.ringbridge.buffer.Buffer;
import io.ringbridge.config.impl.BridgeConfig;
import io.ringbridge.config.impl.ProducerConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads application settings from a YAML file by delegating to {@link BridgeConfig#load(String)}.
     * <p>
     * Expected structure, every key optional:
     * <pre>
     * name: memory-producer
     * resolvePendingTimeoutMs: 100
     * onFailure: requeue
     * concurrency: 4
     * maxDemand: 10
     * </pre>
     *
     * @param path the path to the YAML configuration file
     * @throws IOException if the file cannot be read
     */
    public static BridgeConfig load(final String path) throws IOException {
        return BridgeConfig.load(path);
    }

    /**
     * Builds the producer options for {@code buffer} out of the application settings.
     */
    public static <T> ProducerConfig<T> producerConfig(final BridgeConfig cfg, final Buffer<T> buffer) {
        return ProducerConfig.<T>builder()
                .name(cfg.getName())
                .buffer(buffer)
                .resolvePendingTimeout(cfg.getResolvePendingTimeout())
                .onFailure(cfg.getOnFailure())
                .build();
    }
}
