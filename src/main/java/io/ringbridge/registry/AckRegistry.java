package io.ringbridge.registry;

import io.ringbridge.ack.AckConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Producer identity to {@link AckConfig} map shared between a producer and its acknowledgers.
 * <p>
 * Written once when a producer starts, read on every ack from any thread.
 */
@Slf4j
public final class AckRegistry {
    private static final AckRegistry GLOBAL = new AckRegistry();

    private final ConcurrentMap<String, AckConfig<?>> configs = new ConcurrentHashMap<>();

    /**
     * Process-wide registry used when none is injected.
     */
    public static AckRegistry global() {
        return GLOBAL;
    }

    /**
     * Add or replace the configuration for {@code ackRef}.
     */
    public void register(final String ackRef, final AckConfig<?> config) {
        Objects.requireNonNull(ackRef, "ackRef");
        Objects.requireNonNull(config, "config");

        final AckConfig<?> previous = configs.put(ackRef, config);
        if (previous != null) {
            log.warn("Replaced ack configuration registered under {}", ackRef);
        }
    }

    /**
     * @throws UnregisteredProducerException if nothing is registered under {@code ackRef}
     */
    @SuppressWarnings("unchecked")
    public <T> AckConfig<T> lookup(final String ackRef) {
        final AckConfig<?> config = ackRef == null ? null : configs.get(ackRef);
        if (config == null) {
            throw new UnregisteredProducerException(ackRef);
        }
        return (AckConfig<T>) config;
    }

    public boolean contains(final String ackRef) {
        return configs.containsKey(ackRef);
    }

    public void unregister(final String ackRef) {
        configs.remove(ackRef);
    }

    /**
     * Removes {@code ackRef} only while it still maps to this very {@code config} instance, so a
     * producer replaced under the same name cannot drop its successor's entry. Identity, not
     * equality: a successor over the same buffer and policy is still a different registration.
     *
     * @return whether anything was removed
     */
    public boolean unregister(final String ackRef, final AckConfig<?> config) {
        final boolean[] removed = {false};
        configs.computeIfPresent(ackRef, (ref, current) -> {
            if (current != config) return current;
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    public Set<String> ackRefs() {
        return Collections.unmodifiableSet(configs.keySet());
    }
}
