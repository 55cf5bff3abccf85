package io.ringbridge.producer;

import io.ringbridge.ack.AckConfig;
import io.ringbridge.ack.BufferAcknowledger;
import io.ringbridge.config.impl.ProducerConfig;
import io.ringbridge.core.model.Message;
import io.ringbridge.registry.AckRegistry;
import io.ringbridge.telemetry.Telemetry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pull-based producer over a {@link io.ringbridge.buffer.Buffer}.
 * <p>
 * Demand signals and the periodic re-resolution tick both run on one scheduler thread, which is the
 * only thread that ever touches the {@link ProducerState}. The tick is re-armed after each cycle
 * rather than at a fixed rate, so cycles never overlap.
 * <p>
 * A failing buffer is fatal: the cycle's exception is recorded in {@link #getFailure()} and the
 * producer stops.
 */
@Slf4j
public final class MemoryProducer<T> implements AutoCloseable {

    @Getter
    private final String name;
    private final AckRegistry registry;
    private final AckConfig<T> ackConfig;
    private final DemandResolver<T> resolver;
    private final MessageSink<T> sink;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ProducerState<T> state;
    @Getter
    private volatile Throwable failure;

    private MemoryProducer(final ProducerConfig<T> config,
                           final MessageSink<T> sink,
                           final Telemetry telemetry,
                           final AckRegistry registry,
                           final AckConfig<T> ackConfig) {
        this.name = config.getName();
        this.registry = registry;
        this.ackConfig = ackConfig;
        this.sink = sink;
        this.resolver = new DemandResolver<>(new BufferAcknowledger<>(registry), telemetry);
        this.state = ProducerState.initial(config.getName(), config.getBuffer(), config.getResolvePendingTimeout());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "producer-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Validates {@code options}, registers the producer's ack configuration and arms the tick.
     *
     * @throws io.ringbridge.config.InvalidConfigurationException on any invalid option
     */
    public static <T> MemoryProducer<T> start(final Map<String, ?> options,
                                              final MessageSink<T> sink,
                                              final Telemetry telemetry,
                                              final AckRegistry registry) {
        return start(ProducerConfig.<T>load(options), sink, telemetry, registry);
    }

    public static <T> MemoryProducer<T> start(final ProducerConfig<T> config,
                                              final MessageSink<T> sink,
                                              final Telemetry telemetry,
                                              final AckRegistry registry) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(telemetry, "telemetry");
        Objects.requireNonNull(registry, "registry");

        final AckConfig<T> ackConfig = new AckConfig<>(config.getBuffer(), config.getOnFailure());
        registry.register(config.getName(), ackConfig);

        final MemoryProducer<T> producer = new MemoryProducer<>(config, sink, telemetry, registry, ackConfig);
        producer.scheduleTick();

        log.info("Producer {} started (resolvePendingTimeout={}, onFailure={})",
                config.getName(), config.getResolvePendingTimeout(), config.getOnFailure());
        return producer;
    }

    /**
     * Asks for {@code demand} more messages. Returns immediately, the resulting batch (if any)
     * reaches the sink on the producer's thread.
     *
     * @return completes once this signal's cycle has run
     * @throws IllegalArgumentException if {@code demand} is negative
     * @throws IllegalStateException    if the producer is closed or has failed
     */
    public Future<?> request(final long demand) {
        if (demand < 0) {
            throw new IllegalArgumentException("demand must be >= 0, got " + demand);
        }
        ensureRunning();
        try {
            return scheduler.submit(() -> cycle(demand));
        } catch (final RejectedExecutionException e) {
            throw new IllegalStateException("producer " + name + " is not running", e);
        }
    }

    /**
     * Pending demand as of the last completed cycle.
     */
    public long pendingDemand() {
        return state.pendingDemand();
    }

    public boolean isRunning() {
        return !closed.get() && failure == null;
    }

    /**
     * Waits for every cycle submitted so far to complete.
     */
    public void sync() throws InterruptedException, ExecutionException {
        ensureRunning();
        try {
            scheduler.submit(() -> { }).get();
        } catch (final RejectedExecutionException e) {
            throw new IllegalStateException("producer " + name + " is not running", e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Producer {} scheduler did not terminate within 5s", name);
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        if (!registry.unregister(name, ackConfig)) {
            log.debug("Producer {} was replaced in the registry, leaving its successor registered", name);
        }

        log.info("Producer {} stopped with {} pending demand", name, state.pendingDemand());
    }

    private void tick() {
        try {
            cycle(0L);
        } finally {
            if (isRunning()) {
                scheduleTick();
            }
        }
    }

    private void scheduleTick() {
        try {
            scheduler.schedule(this::tick, state.resolvePendingTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (final RejectedExecutionException e) {
            log.debug("Producer {} shut down before its next tick was armed", name);
        }
    }

    private void cycle(final long demand) {
        if (!isRunning()) return;

        try {
            final Resolution<T> resolution = resolver.resolve(demand, state);
            state = resolution.state();

            final List<Message<T>> messages = resolution.messages();
            if (!messages.isEmpty()) {
                sink.accept(messages);
            }
        } catch (final RuntimeException | Error e) {
            fail(e);
            throw e;
        }
    }

    private void fail(final Throwable cause) {
        failure = cause;
        log.error("Producer {} crashed during a resolve cycle, shutting down", name, cause);
        scheduler.shutdown();
    }

    private void ensureRunning() {
        if (failure != null) {
            throw new IllegalStateException("producer " + name + " has failed", failure);
        }
        if (closed.get()) {
            throw new IllegalStateException("producer " + name + " is closed");
        }
    }
}
