package io.ringbridge.core.model;

import io.ringbridge.ack.Acknowledger;
import io.ringbridge.ack.FailurePolicy;

import java.util.Map;
import java.util.Objects;

/**
 * Routing information a {@link Message} carries back to whoever must acknowledge it.
 *
 * @param acknowledger the component that receives the ack call
 * @param ackRef       identity of the producer the message came from
 * @param ackData      per-message options, only {@link #ON_FAILURE} is interpreted
 */
public record AckToken<T>(Acknowledger<T> acknowledger, String ackRef, Map<String, Object> ackData) {

    /** Per-message override of the producer's failure policy. */
    public static final String ON_FAILURE = "onFailure";

    public AckToken {
        Objects.requireNonNull(acknowledger, "acknowledger");
        Objects.requireNonNull(ackRef, "ackRef");
        ackData = ackData == null ? Map.of() : Map.copyOf(ackData);
    }

    /**
     * @return the message-level failure policy, or {@code null} when the producer default applies
     */
    public FailurePolicy onFailure() {
        return FailurePolicy.from(ackData.get(ON_FAILURE));
    }

    public AckToken<T> withAckData(final Map<String, Object> data) {
        return new AckToken<>(acknowledger, ackRef, data);
    }
}
