package io.ringbridge.host;

import io.ringbridge.ack.Acknowledgers;
import io.ringbridge.ack.FailurePolicy;
import io.ringbridge.config.impl.ProducerConfig;
import io.ringbridge.core.model.AckToken;
import io.ringbridge.core.model.Message;
import io.ringbridge.producer.MemoryProducer;
import io.ringbridge.registry.AckRegistry;
import io.ringbridge.telemetry.Telemetry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal demand-driven host: a fixed pool of processors fed by one {@link MemoryProducer}.
 * <p>
 * At start it asks for {@code concurrency * maxDemand} messages. Each processed message is acked on
 * its own and then replaced by one unit of fresh demand, so at most that many messages are in flight.
 * Messages that arrive while the pipeline is shutting down are handed back to the buffer.
 */
@Slf4j
public final class Pipeline<T> implements AutoCloseable {

    private final MessageHandler<T> handler;
    private final ExecutorService processors;
    private final AtomicBoolean draining = new AtomicBoolean(false);

    @Getter
    private final MemoryProducer<T> producer;
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();

    private Pipeline(final ProducerConfig<T> config,
                     final MessageHandler<T> handler,
                     final int concurrency,
                     final Telemetry telemetry,
                     final AckRegistry registry) {
        this.handler = Objects.requireNonNull(handler, "handler");

        final AtomicInteger ids = new AtomicInteger();
        this.processors = Executors.newFixedThreadPool(concurrency, r -> {
            final Thread t = new Thread(r, config.getName() + "-processor-" + ids.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.producer = MemoryProducer.start(config, this::dispatch, telemetry, registry);
    }

    public static <T> Pipeline<T> start(final ProducerConfig<T> config,
                                        final MessageHandler<T> handler,
                                        final int concurrency,
                                        final int maxDemand,
                                        final Telemetry telemetry,
                                        final AckRegistry registry) {
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
        if (maxDemand <= 0) throw new IllegalArgumentException("maxDemand must be > 0");

        final Pipeline<T> pipeline = new Pipeline<>(config, handler, concurrency, telemetry, registry);
        pipeline.producer.request((long) concurrency * maxDemand);

        log.info("Pipeline {} started with {} processors, max demand {}", config.getName(), concurrency, maxDemand);
        return pipeline;
    }

    public long succeededCount() {
        return succeeded.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * Messages handed to a processor and not yet acknowledged.
     */
    public int inFlight() {
        return inFlight.get();
    }

    private void dispatch(final List<Message<T>> messages) {
        final List<Message<T>> rejected = new ArrayList<>();
        for (final Message<T> message : messages) {
            if (draining.get()) {
                rejected.add(message);
                continue;
            }
            inFlight.incrementAndGet();
            try {
                processors.execute(() -> process(message));
            } catch (final RejectedExecutionException e) {
                inFlight.decrementAndGet();
                rejected.add(message);
            }
        }

        if (!rejected.isEmpty()) {
            log.debug("Pipeline is draining, returning {} messages to the buffer", rejected.size());
            final List<Message<T>> requeue = new ArrayList<>(rejected.size());
            for (final Message<T> message : rejected) {
                requeue.add(message.configureAck(Map.of(AckToken.ON_FAILURE, FailurePolicy.REQUEUE)));
            }
            Acknowledgers.ackMessages(List.of(), requeue);
        }
    }

    private void process(final Message<T> message) {
        Message<T> result;
        try {
            result = handler.handle(message);
            if (result == null) {
                result = message;
            }
        } catch (final Exception e) {
            log.warn("Handler failed on {}: {}", message.data(), e.toString());
            result = message.failed(e.toString());
        }

        try {
            if (result.isFailed()) {
                failed.incrementAndGet();
                Acknowledgers.ackMessages(List.of(), List.of(result));
            } else {
                succeeded.incrementAndGet();
                Acknowledgers.ackMessages(List.of(result), List.of());
            }
        } catch (final RuntimeException e) {
            log.error("Acknowledging {} failed", message.data(), e);
            throw e;
        } finally {
            inFlight.decrementAndGet();
        }

        if (!draining.get()) {
            try {
                producer.request(1);
            } catch (final IllegalStateException e) {
                // producer closed or failed underneath us
                log.debug("Producer {} stopped before demand could be replenished: {}",
                        producer.getName(), e.getMessage());
            }
        }
    }

    /**
     * Stops asking for demand, lets in-flight messages finish and shuts the producer down.
     */
    @Override
    public void close() {
        if (!draining.compareAndSet(false, true)) return;

        processors.shutdown();
        try {
            if (!processors.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Pipeline {} processors did not finish within 30s", producer.getName());
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        producer.close();

        log.info("Pipeline {} stopped: {} succeeded, {} failed",
                producer.getName(), succeeded.get(), failed.get());
    }
}
