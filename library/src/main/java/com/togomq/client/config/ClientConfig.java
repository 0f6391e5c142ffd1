package com.togomq.client.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for a {@code TogoMQClient}.
 *
 * <p>
 * Instances are immutable. Build one from the defaults with
 * {@link #newConfig(ConfigOption...)}; options are applied in order, so a
 * later option overrides an earlier one:
 * </p>
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.newConfig(
 *         ConfigOption.withToken("my-token"),
 *         ConfigOption.withMaxMessageSize(10 * 1024 * 1024),
 *         ConfigOption.withInitialWindowSize(64 * 1024 * 1024));
 * }</pre>
 *
 * @param host                  server host name
 * @param port                  server port
 * @param logLevel              verbosity of the client's own logging
 * @param token                 authentication token sent with every call
 * @param useTls                whether the connection uses TLS
 * @param maxMessageSize        largest message, in bytes, sent or received
 * @param initialWindowSize     initial per-stream flow-control window in bytes
 * @param initialConnWindowSize initial connection flow-control window in bytes
 * @param writeBufferSize       socket write buffer size in bytes
 * @param readBufferSize        socket read buffer size in bytes
 * @param keepaliveTime         idle time before a keepalive ping is sent
 * @param keepaliveTimeout      time to wait for a keepalive acknowledgement
 */
public record ClientConfig(String host,
        int port,
        LogLevel logLevel,
        String token,
        boolean useTls,
        int maxMessageSize,
        int initialWindowSize,
        int initialConnWindowSize,
        int writeBufferSize,
        int readBufferSize,
        Duration keepaliveTime,
        Duration keepaliveTimeout) {

    public static final String DEFAULT_HOST = "q.togomq.io";
    public static final int DEFAULT_PORT = 5123;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 50 * 1024 * 1024;
    public static final int DEFAULT_WINDOW_SIZE = 128 * 1024 * 1024;
    public static final int DEFAULT_BUFFER_SIZE = 2 * 1024 * 1024;
    public static final Duration DEFAULT_KEEPALIVE_TIME = Duration.ofSeconds(60);
    public static final Duration DEFAULT_KEEPALIVE_TIMEOUT = Duration.ofSeconds(20);

    public ClientConfig {
        logLevel = logLevel == null ? LogLevel.INFO : logLevel;
    }

    /**
     * @return a fully populated configuration with every default applied and
     *         an empty token
     */
    public static ClientConfig defaultConfig() {
        return new Builder().build();
    }

    /**
     * Applies {@code options} in order on top of {@link #defaultConfig()}.
     *
     * @param options the overrides to apply
     * @return the resulting configuration
     */
    public static ClientConfig newConfig(ConfigOption... options) {
        Builder builder = new Builder();
        for (ConfigOption option : options) {
            option.apply(builder);
        }
        return builder.build();
    }

    /**
     * @return a builder holding this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .logLevel(logLevel)
                .token(token)
                .useTls(useTls)
                .maxMessageSize(maxMessageSize)
                .initialWindowSize(initialWindowSize)
                .initialConnWindowSize(initialConnWindowSize)
                .writeBufferSize(writeBufferSize)
                .readBufferSize(readBufferSize)
                .keepaliveTime(keepaliveTime)
                .keepaliveTimeout(keepaliveTimeout);
    }

    /**
     * Checks the invariants in a fixed order and reports the first one broken.
     *
     * @return the first violation, or empty if the configuration is valid
     */
    public Optional<ConfigViolation> validate() {
        if (host == null || host.trim().isEmpty()) {
            return Optional.of(ConfigViolation.EMPTY_HOST);
        }
        if (port <= 0 || port > 65535) {
            return Optional.of(ConfigViolation.PORT_OUT_OF_RANGE);
        }
        if (token == null || token.trim().isEmpty()) {
            return Optional.of(ConfigViolation.MISSING_TOKEN);
        }
        if (maxMessageSize <= 0) {
            return Optional.of(ConfigViolation.MAX_MESSAGE_SIZE);
        }
        if (initialWindowSize <= 0) {
            return Optional.of(ConfigViolation.INITIAL_WINDOW_SIZE);
        }
        if (initialConnWindowSize <= 0) {
            return Optional.of(ConfigViolation.INITIAL_CONN_WINDOW_SIZE);
        }
        if (writeBufferSize <= 0) {
            return Optional.of(ConfigViolation.WRITE_BUFFER_SIZE);
        }
        if (readBufferSize <= 0) {
            return Optional.of(ConfigViolation.READ_BUFFER_SIZE);
        }
        if (!isPositive(keepaliveTime)) {
            return Optional.of(ConfigViolation.KEEPALIVE_TIME);
        }
        if (!isPositive(keepaliveTimeout)) {
            return Optional.of(ConfigViolation.KEEPALIVE_TIMEOUT);
        }
        return Optional.empty();
    }

    /**
     * @throws ConfigValidationException if {@link #validate()} reports a
     *                                   violation
     */
    public void requireValid() {
        Optional<ConfigViolation> violation = validate();
        if (violation.isPresent()) {
            throw new ConfigValidationException(violation.get());
        }
    }

    /**
     * @return the server address as {@code host:port}
     */
    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return "ClientConfig[address=" + address()
                + ", logLevel=" + logLevel
                + ", useTls=" + useTls
                + ", token=" + (token == null || token.isEmpty() ? "<none>" : "<redacted>")
                + ", maxMessageSize=" + maxMessageSize
                + ", initialWindowSize=" + initialWindowSize
                + ", initialConnWindowSize=" + initialConnWindowSize
                + ", writeBufferSize=" + writeBufferSize
                + ", readBufferSize=" + readBufferSize
                + ", keepaliveTime=" + keepaliveTime
                + ", keepaliveTimeout=" + keepaliveTimeout + "]";
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    /**
     * Mutable staging area for a {@link ClientConfig}, pre-populated with the
     * defaults.
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private LogLevel logLevel = LogLevel.INFO;
        private String token = "";
        private boolean useTls = true;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private int initialWindowSize = DEFAULT_WINDOW_SIZE;
        private int initialConnWindowSize = DEFAULT_WINDOW_SIZE;
        private int writeBufferSize = DEFAULT_BUFFER_SIZE;
        private int readBufferSize = DEFAULT_BUFFER_SIZE;
        private Duration keepaliveTime = DEFAULT_KEEPALIVE_TIME;
        private Duration keepaliveTimeout = DEFAULT_KEEPALIVE_TIMEOUT;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * @param logLevel the client's log level; null means {@link LogLevel#INFO}
         */
        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel == null ? LogLevel.INFO : logLevel;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder useTls(boolean useTls) {
            this.useTls = useTls;
            return this;
        }

        public Builder maxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder initialWindowSize(int initialWindowSize) {
            this.initialWindowSize = initialWindowSize;
            return this;
        }

        public Builder initialConnWindowSize(int initialConnWindowSize) {
            this.initialConnWindowSize = initialConnWindowSize;
            return this;
        }

        public Builder writeBufferSize(int writeBufferSize) {
            this.writeBufferSize = writeBufferSize;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder keepaliveTime(Duration keepaliveTime) {
            this.keepaliveTime = keepaliveTime;
            return this;
        }

        public Builder keepaliveTimeout(Duration keepaliveTimeout) {
            this.keepaliveTimeout = keepaliveTimeout;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(host, port, logLevel, token, useTls, maxMessageSize,
                    initialWindowSize, initialConnWindowSize, writeBufferSize, readBufferSize,
                    keepaliveTime, keepaliveTimeout);
        }
    }
}
