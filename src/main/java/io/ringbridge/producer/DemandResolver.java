package io.ringbridge.producer;

import io.ringbridge.ack.Acknowledger;
import io.ringbridge.core.model.AckToken;
import io.ringbridge.core.model.Message;
import io.ringbridge.telemetry.Telemetry;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns demand into messages by popping at most the outstanding amount from the buffer.
 * <p>
 * Stateless: the caller owns the {@link ProducerState} and replaces it with the one returned.
 */
@RequiredArgsConstructor
public final class DemandResolver<T> {
    private final Acknowledger<T> acknowledger;
    private final Telemetry telemetry;

    /**
     * Adds {@code additional} to the pending demand and pops up to the total.
     *
     * @param additional newly requested demand, 0 for a timer re-attempt
     * @param state      current producer state
     * @return the wrapped messages and the state with the unmet remainder as pending demand
     */
    public Resolution<T> resolve(final long additional, final ProducerState<T> state) {
        if (additional < 0) {
            throw new IllegalArgumentException("demand must be >= 0, got " + additional);
        }

        final long demand = Math.addExact(additional, state.pendingDemand());
        final List<Message<T>> messages = telemetry.span(state.name(), demand, () -> fetch(state, demand));

        return new Resolution<>(messages, state.withPendingDemand(demand - messages.size()));
    }

    private List<Message<T>> fetch(final ProducerState<T> state, final long demand) {
        if (demand == 0) return List.of();

        final List<T> items = state.buffer().pop((int) Math.min(demand, Integer.MAX_VALUE));
        if (items.size() > demand) {
            throw new IllegalStateException("buffer returned " + items.size() + " items for a demand of " + demand);
        }

        final AckToken<T> token = new AckToken<>(acknowledger, state.name(), Map.of());
        final List<Message<T>> messages = new ArrayList<>(items.size());
        for (final T item : items) {
            messages.add(new Message<>(item, token));
        }
        return messages;
    }
}
