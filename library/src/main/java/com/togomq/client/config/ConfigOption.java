package com.togomq.client.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;

import com.togomq.client.errors.ErrorCode;
import com.togomq.client.errors.TogoMQException;

/**
 * A single override applied to a {@link ClientConfig.Builder}.
 */
@FunctionalInterface
public interface ConfigOption {

    String PREFIX = "togomq.";

    void apply(ClientConfig.Builder builder);

    static ConfigOption withHost(String host) {
        return b -> b.host(host);
    }

    static ConfigOption withPort(int port) {
        return b -> b.port(port);
    }

    static ConfigOption withLogLevel(LogLevel level) {
        return b -> b.logLevel(level);
    }

    static ConfigOption withLogLevel(String level) {
        return withLogLevel(LogLevel.parse(level));
    }

    static ConfigOption withToken(String token) {
        return b -> b.token(token);
    }

    static ConfigOption withUseTls(boolean useTls) {
        return b -> b.useTls(useTls);
    }

    /**
     * Sets the maximum message size and resets both flow-control windows to
     * the same value. Window options applied afterwards take precedence.
     */
    static ConfigOption withMaxMessageSize(int size) {
        return b -> b.maxMessageSize(size)
                .initialWindowSize(size)
                .initialConnWindowSize(size);
    }

    static ConfigOption withInitialWindowSize(int size) {
        return b -> b.initialWindowSize(size);
    }

    static ConfigOption withInitialConnWindowSize(int size) {
        return b -> b.initialConnWindowSize(size);
    }

    static ConfigOption withWriteBufferSize(int size) {
        return b -> b.writeBufferSize(size);
    }

    static ConfigOption withReadBufferSize(int size) {
        return b -> b.readBufferSize(size);
    }

    static ConfigOption withKeepaliveTime(Duration duration) {
        return b -> b.keepaliveTime(duration);
    }

    static ConfigOption withKeepaliveTimeout(Duration duration) {
        return b -> b.keepaliveTimeout(duration);
    }

    /**
     * Builds a composite option from {@code togomq.*} properties. Keys that
     * are absent leave the corresponding setting untouched;
     * {@code togomq.max-message-size} is applied before the explicit window
     * sizes so those still win.
     *
     * @param props the properties to read
     * @return an option applying every recognised key
     * @throws TogoMQException with {@link ErrorCode#CONFIGURATION} if a value
     *                         cannot be parsed
     */
    static ConfigOption fromProperties(Properties props) {
        List<ConfigOption> options = new ArrayList<>();
        String value;
        if ((value = property(props, "host")) != null) {
            options.add(withHost(value));
        }
        if ((value = property(props, "port")) != null) {
            options.add(withPort(parse(value, "port", Integer::parseInt)));
        }
        if ((value = property(props, "token")) != null) {
            options.add(withToken(value));
        }
        if ((value = property(props, "log-level")) != null) {
            options.add(withLogLevel(value));
        }
        if ((value = property(props, "use-tls")) != null) {
            options.add(withUseTls(Boolean.parseBoolean(value)));
        }
        if ((value = property(props, "max-message-size")) != null) {
            options.add(withMaxMessageSize(parse(value, "max-message-size", Integer::parseInt)));
        }
        if ((value = property(props, "initial-window-size")) != null) {
            options.add(withInitialWindowSize(parse(value, "initial-window-size", Integer::parseInt)));
        }
        if ((value = property(props, "initial-conn-window-size")) != null) {
            options.add(withInitialConnWindowSize(parse(value, "initial-conn-window-size", Integer::parseInt)));
        }
        if ((value = property(props, "write-buffer-size")) != null) {
            options.add(withWriteBufferSize(parse(value, "write-buffer-size", Integer::parseInt)));
        }
        if ((value = property(props, "read-buffer-size")) != null) {
            options.add(withReadBufferSize(parse(value, "read-buffer-size", Integer::parseInt)));
        }
        if ((value = property(props, "keepalive-time-seconds")) != null) {
            options.add(withKeepaliveTime(
                    Duration.ofSeconds(parse(value, "keepalive-time-seconds", Long::parseLong))));
        }
        if ((value = property(props, "keepalive-timeout-seconds")) != null) {
            options.add(withKeepaliveTimeout(
                    Duration.ofSeconds(parse(value, "keepalive-timeout-seconds", Long::parseLong))));
        }
        return b -> options.forEach(o -> o.apply(b));
    }

    private static String property(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static <T> T parse(String value, String key, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new TogoMQException(ErrorCode.CONFIGURATION,
                    "invalid value for " + PREFIX + key + ": " + value, e);
        }
    }
}
