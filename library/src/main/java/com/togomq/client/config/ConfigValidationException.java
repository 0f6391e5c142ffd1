package com.togomq.client.config;

/**
 * Thrown by {@link ClientConfig#requireValid()} when a configuration breaks one
 * of its invariants.
 */
public class ConfigValidationException extends IllegalArgumentException {

    private final ConfigViolation violation;

    public ConfigValidationException(ConfigViolation violation) {
        super(violation.message());
        this.violation = violation;
    }

    public ConfigViolation violation() {
        return violation;
    }
}
