package io.ringbridge.config;

import lombok.Getter;

/**
 * Raised at startup when an option is missing, unknown or violates its constraint.
 */
@Getter
public final class InvalidConfigurationException extends IllegalArgumentException {

    /**
     * The offending option, or {@code null} when the error is not tied to a single key.
     */
    private final String key;

    public InvalidConfigurationException(final String component, final String key, final String constraint) {
        super(key == null
                ? "invalid configuration given to " + component + ", " + constraint
                : "invalid configuration given to " + component + " for key [" + key + "], " + constraint);
        this.key = key;
    }
}
