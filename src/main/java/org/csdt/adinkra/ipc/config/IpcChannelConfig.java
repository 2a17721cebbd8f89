package org.csdt.adinkra.ipc.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration for the request channel.
 *
 * @param host        address to bind the listening socket to
 * @param port        port to bind, 0-65535 (0 picks an ephemeral port)
 * @param backlog     maximum number of queued pending connections
 * @param logFile     log file to append to; {@code null} logs to standard output
 * @param readTimeout idle read timeout per connection; {@link Duration#ZERO}
 *                    waits forever
 * @param servingMode connection scheduling
 * @param maxLineLength longest accepted line in bytes, excluding CRLF
 */
public record IpcChannelConfig(
    String host,
    int port,
    int backlog,
    Path logFile,
    Duration readTimeout,
    ServingMode servingMode,
    int maxLineLength
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 65535;
    public static final int DEFAULT_BACKLOG = 5;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024 * 1024;

    public static final String HOST_KEY = "ipc.host";
    public static final String PORT_KEY = "ipc.port";
    public static final String BACKLOG_KEY = "ipc.backlog";
    public static final String LOG_FILE_KEY = "ipc.logFile";
    public static final String READ_TIMEOUT_KEY = "ipc.readTimeoutMillis";
    public static final String SERVING_MODE_KEY = "ipc.servingMode";
    public static final String MAX_LINE_LENGTH_KEY = "ipc.maxLineLength";

    public IpcChannelConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(servingMode, "servingMode");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be 0-65535");
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("Backlog must be at least 1");
        }
        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("Read timeout must not be negative");
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("Max line length must be at least 1");
        }
    }

    public static IpcChannelConfig defaults() {
        return builder().build();
    }

    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(host, port);
    }

    public Optional<Path> logFileOption() {
        return Optional.ofNullable(logFile);
    }

    public boolean hasReadTimeout() {
        return !readTimeout.isZero();
    }

    /**
     * Build a configuration from properties, falling back to the defaults for
     * missing keys.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static IpcChannelConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String host = trimmed(properties, HOST_KEY);
        if (host != null) {
            builder.withHost(host);
        }
        String port = trimmed(properties, PORT_KEY);
        if (port != null) {
            builder.withPort(parseInt(PORT_KEY, port));
        }
        String backlog = trimmed(properties, BACKLOG_KEY);
        if (backlog != null) {
            builder.withBacklog(parseInt(BACKLOG_KEY, backlog));
        }
        String logFile = trimmed(properties, LOG_FILE_KEY);
        if (logFile != null) {
            builder.withLogFile(Path.of(logFile));
        }
        String timeout = trimmed(properties, READ_TIMEOUT_KEY);
        if (timeout != null) {
            builder.withReadTimeout(Duration.ofMillis(parseInt(READ_TIMEOUT_KEY, timeout)));
        }
        String maxLine = trimmed(properties, MAX_LINE_LENGTH_KEY);
        if (maxLine != null) {
            builder.withMaxLineLength(parseInt(MAX_LINE_LENGTH_KEY, maxLine));
        }
        String mode = trimmed(properties, SERVING_MODE_KEY);
        if (mode != null) {
            try {
                builder.withServingMode(ServingMode.valueOf(mode.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + SERVING_MODE_KEY + ": " + mode, e);
            }
        }
        return builder.build();
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int backlog = DEFAULT_BACKLOG;
        private Path logFile;
        private Duration readTimeout = Duration.ZERO;
        private ServingMode servingMode = ServingMode.SEQUENTIAL;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder withLogFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withServingMode(ServingMode servingMode) {
            this.servingMode = servingMode;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public IpcChannelConfig build() {
            return new IpcChannelConfig(host, port, backlog, logFile, readTimeout, servingMode, maxLineLength);
        }
    }
}
