package com.togomq.client.config;

/**
 * The invariants a {@link ClientConfig} must satisfy, in the order they are
 * checked. Each carries the fixed message reported when it is violated.
 */
public enum ConfigViolation {
    EMPTY_HOST("host cannot be empty"),
    PORT_OUT_OF_RANGE("port must be between 1 and 65535"),
    MISSING_TOKEN("token is required"),
    MAX_MESSAGE_SIZE("max message size must be greater than 0"),
    INITIAL_WINDOW_SIZE("initial window size must be greater than 0"),
    INITIAL_CONN_WINDOW_SIZE("initial connection window size must be greater than 0"),
    WRITE_BUFFER_SIZE("write buffer size must be greater than 0"),
    READ_BUFFER_SIZE("read buffer size must be greater than 0"),
    KEEPALIVE_TIME("keepalive time must be greater than 0"),
    KEEPALIVE_TIMEOUT("keepalive timeout must be greater than 0");

    private final String message;

    ConfigViolation(String message) {
        this.message = message;
    }

    /**
     * @return the human readable description of the violated invariant
     */
    public String message() {
        return message;
    }
}
