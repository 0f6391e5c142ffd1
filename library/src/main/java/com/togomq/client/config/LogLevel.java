package com.togomq.client.config;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;
import org.slf4j.spi.NOPLoggingEventBuilder;

/**
 * Verbosity of the client's own logging. Messages below the configured level
 * are dropped before they reach SLF4J; {@link #NONE} silences the client.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    NONE(null);

    private final Level threshold;

    LogLevel(Level threshold) {
        this.threshold = threshold;
    }

    /**
     * Parses a level name. Matching ignores case, {@code warning} is accepted
     * for {@link #WARN} and anything unrecognised falls back to {@link #INFO}.
     *
     * @param level the level name, may be null
     * @return the parsed level
     */
    public static LogLevel parse(String level) {
        if (level == null) {
            return INFO;
        }
        switch (level.trim().toLowerCase(Locale.ROOT)) {
            case "debug":
                return DEBUG;
            case "info":
                return INFO;
            case "warn":
            case "warning":
                return WARN;
            case "error":
                return ERROR;
            case "none":
                return NONE;
            default:
                return INFO;
        }
    }

    /**
     * @param level an SLF4J level
     * @return true if messages at {@code level} pass this threshold
     */
    public boolean allows(Level level) {
        return threshold != null && level.toInt() >= threshold.toInt();
    }

    /**
     * Returns an event builder for {@code level} on {@code logger}, or a no-op
     * builder when this threshold filters the level out.
     */
    public LoggingEventBuilder at(Logger logger, Level level) {
        if (!allows(level)) {
            return NOPLoggingEventBuilder.singleton();
        }
        return logger.atLevel(level);
    }
}
