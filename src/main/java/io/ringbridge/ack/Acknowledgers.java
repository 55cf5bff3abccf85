package io.ringbridge.ack;

import io.ringbridge.core.model.AckToken;
import io.ringbridge.core.model.Message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a finished batch to the acknowledgers of its messages.
 */
public final class Acknowledgers {

    private Acknowledgers() {
    }

    /**
     * Groups both lists by (acknowledger, ackRef) and makes one {@link Acknowledger#ack} call per
     * group, keeping the relative order of messages inside each group.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static void ackMessages(final List<? extends Message<?>> successful, final List<? extends Message<?>> failed) {
        final Map<Route, Batch> batches = new LinkedHashMap<>();

        for (final Message<?> m : successful) {
            batches.computeIfAbsent(Route.of(m.ackToken()), r -> new Batch()).successful.add(m);
        }
        for (final Message<?> m : failed) {
            batches.computeIfAbsent(Route.of(m.ackToken()), r -> new Batch()).failed.add(m);
        }

        for (final Map.Entry<Route, Batch> e : batches.entrySet()) {
            final Acknowledger acknowledger = e.getKey().acknowledger();
            acknowledger.ack(e.getKey().ackRef(), e.getValue().successful, e.getValue().failed);
        }
    }

    private record Route(Acknowledger<?> acknowledger, String ackRef) {
        static Route of(final AckToken<?> token) {
            return new Route(token.acknowledger(), token.ackRef());
        }
    }

    private static final class Batch {
        final List<Message<?>> successful = new ArrayList<>();
        final List<Message<?>> failed = new ArrayList<>();
    }
}
