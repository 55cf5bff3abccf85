package io.ringbridge.telemetry;

import io.ringbridge.core.model.Message;

import java.time.Duration;
import java.util.List;

/**
 * Events bracketing one buffer fetch of a resolve cycle.
 */
public sealed interface FetchEvent permits FetchEvent.Start, FetchEvent.Stop {

    String START = "ringbridge.receive_messages.start";
    String STOP = "ringbridge.receive_messages.stop";

    /** Event name, one of {@link #START} or {@link #STOP}. */
    String name();

    /** Identity of the producer running the cycle. */
    String producer();

    /** Total demand the cycle tried to satisfy. */
    long demand();

    /**
     * Emitted right before the buffer is asked for items.
     *
     * @param systemTimeMillis wall clock at start
     * @param monotonicNanos   {@link System#nanoTime()} at start
     */
    record Start(String producer, long demand, long systemTimeMillis, long monotonicNanos) implements FetchEvent {
        @Override
        public String name() {
            return START;
        }
    }

    /**
     * Emitted once the fetched items are wrapped, or once the fetch has failed.
     *
     * @param messages       the wrapped messages, empty on failure
     * @param duration       time elapsed since the matching {@link Start}
     * @param monotonicNanos {@link System#nanoTime()} at stop
     * @param error          the failure that ended the fetch, {@code null} on success
     */
    record Stop(String producer,
                long demand,
                List<? extends Message<?>> messages,
                Duration duration,
                long monotonicNanos,
                Throwable error) implements FetchEvent {
        @Override
        public String name() {
            return STOP;
        }

        public int producedCount() {
            return messages.size();
        }
    }
}
