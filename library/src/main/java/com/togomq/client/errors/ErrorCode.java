package com.togomq.client.errors;

/**
 * Categories of failure reported by the client.
 */
public enum ErrorCode {
    CONNECTION("CONNECTION_ERROR"),
    AUTH("AUTH_ERROR"),
    VALIDATION("VALIDATION_ERROR"),
    PUBLISH("PUBLISH_ERROR"),
    SUBSCRIBE("SUBSCRIBE_ERROR"),
    STREAM("STREAM_ERROR"),
    CONFIGURATION("CONFIG_ERROR");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * @return the stable code rendered in error messages
     */
    public String code() {
        return code;
    }
}
