package io.ringbridge.config.impl;

import io.ringbridge.ack.FailurePolicy;
import io.ringbridge.buffer.Buffer;
import io.ringbridge.config.InvalidConfigurationException;
import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Validated startup options of a {@code MemoryProducer}.
 * <p>
 * Recognised keys:
 * <pre>
 * name                   required, producer identity used as the ack reference
 * buffer                 required, the {@link Buffer} to pull from and requeue into
 * resolvePendingTimeout  Duration or milliseconds, default 100ms
 * onFailure              discard | requeue, default discard
 * </pre>
 *
 * @param <T> the item type of the buffer
 */
@Getter
public final class ProducerConfig<T> {

    public static final String NAME = "name";
    public static final String BUFFER = "buffer";
    public static final String RESOLVE_PENDING_TIMEOUT = "resolvePendingTimeout";
    public static final String ON_FAILURE = "onFailure";

    public static final Duration DEFAULT_RESOLVE_PENDING_TIMEOUT = Duration.ofMillis(100);
    public static final FailurePolicy DEFAULT_ON_FAILURE = FailurePolicy.DISCARD;

    private static final String COMPONENT = "MemoryProducer";
    private static final List<String> KNOWN_KEYS = List.of(NAME, BUFFER, RESOLVE_PENDING_TIMEOUT, ON_FAILURE);

    private String name;
    private Buffer<T> buffer;
    private Duration resolvePendingTimeout;
    private FailurePolicy onFailure;

    private ProducerConfig() {
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Validates a raw option map.
     *
     * @throws InvalidConfigurationException naming the first offending key
     */
    @SuppressWarnings("unchecked")
    public static <T> ProducerConfig<T> load(final Map<String, ?> options) {
        if (options == null) {
            throw new InvalidConfigurationException(COMPONENT, null, "expected an option map, got: null");
        }

        final TreeSet<String> unknown = new TreeSet<>(options.keySet());
        KNOWN_KEYS.forEach(unknown::remove);
        if (!unknown.isEmpty()) {
            throw new InvalidConfigurationException(COMPONENT, null,
                    "unknown options " + unknown + ", valid options are: " + KNOWN_KEYS);
        }

        final ProducerConfig<T> cfg = new ProducerConfig<>();

        final Object name = options.get(NAME);
        if (name == null) {
            throw new InvalidConfigurationException(COMPONENT, NAME, "required option not found");
        }
        if (!(name instanceof String s) || s.isBlank()) {
            throw new InvalidConfigurationException(COMPONENT, NAME, "expected a non-blank string, got: " + name);
        }
        cfg.name = (String) name;

        final Object buffer = options.get(BUFFER);
        if (buffer == null) {
            throw new InvalidConfigurationException(COMPONENT, BUFFER, "required option not found");
        }
        if (!(buffer instanceof Buffer)) {
            throw new InvalidConfigurationException(COMPONENT, BUFFER,
                    "expected a " + Buffer.class.getName() + ", got: " + buffer.getClass().getName());
        }
        cfg.buffer = (Buffer<T>) buffer;

        cfg.resolvePendingTimeout = options.containsKey(RESOLVE_PENDING_TIMEOUT)
                ? toTimeout(options.get(RESOLVE_PENDING_TIMEOUT))
                : DEFAULT_RESOLVE_PENDING_TIMEOUT;

        if (options.containsKey(ON_FAILURE)) {
            final Object raw = options.get(ON_FAILURE);
            final FailurePolicy policy = FailurePolicy.from(raw);
            if (policy == null) {
                throw new InvalidConfigurationException(COMPONENT, ON_FAILURE,
                        "expected one of [discard, requeue], got: " + raw);
            }
            cfg.onFailure = policy;
        } else {
            cfg.onFailure = DEFAULT_ON_FAILURE;
        }

        return cfg;
    }

    private static Duration toTimeout(final Object raw) {
        final Duration timeout;
        if (raw instanceof Duration d) {
            timeout = d;
        } else if (raw instanceof Integer || raw instanceof Long) {
            timeout = Duration.ofMillis(((Number) raw).longValue());
        } else {
            throw new InvalidConfigurationException(COMPONENT, RESOLVE_PENDING_TIMEOUT,
                    "expected a positive Duration or integer milliseconds, got: " + raw);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigurationException(COMPONENT, RESOLVE_PENDING_TIMEOUT,
                    "expected a positive duration, got: " + raw);
        }
        return timeout;
    }

    public static final class Builder<T> {
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder<T> name(final String name) {
            options.put(NAME, name);
            return this;
        }

        public Builder<T> buffer(final Buffer<T> buffer) {
            options.put(BUFFER, buffer);
            return this;
        }

        public Builder<T> resolvePendingTimeout(final Duration timeout) {
            options.put(RESOLVE_PENDING_TIMEOUT, timeout);
            return this;
        }

        public Builder<T> onFailure(final FailurePolicy onFailure) {
            options.put(ON_FAILURE, onFailure);
            return this;
        }

        public ProducerConfig<T> build() {
            return load(options);
        }
    }
}
