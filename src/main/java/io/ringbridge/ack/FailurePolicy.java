package io.ringbridge.ack;

import java.util.Locale;

/**
 * What happens to a message's payload when the pipeline reports it as failed.
 */
public enum FailurePolicy {
    /**
     * Drop the payload.
     */
    DISCARD,
    /**
     * Push the payload back to the buffer it was popped from.
     */
    REQUEUE;

    /**
     * Accepts either a {@link FailurePolicy} or its case-insensitive name.
     *
     * @return the policy, or {@code null} if {@code value} is neither
     */
    public static FailurePolicy from(final Object value) {
        if (value instanceof FailurePolicy policy) {
            return policy;
        }
        if (value instanceof String name) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "discard":
                    return DISCARD;
                case "requeue":
                    return REQUEUE;
                default:
                    return null;
            }
        }
        return null;
    }

    public String optionName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
