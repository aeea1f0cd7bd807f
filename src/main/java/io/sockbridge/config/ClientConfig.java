/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.sockbridge.config;

import io.sockbridge.client.ClientMode;
import io.sockbridge.client.Endpoint;
import io.sockbridge.exception.SockBridgeInvalidArgumentException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration of a {@link io.sockbridge.client.SocketClient}.
 *
 * <p>Example usage:
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .host("localhost")
 *     .port(3001)
 *     .mode(ClientMode.SYNC)
 *     .readTimeout(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * <p>The same values can be read from a {@code .properties} file, see {@link #fromProperties(Properties)}.
 * Every duration must be positive and at most {@link #MAX_DURATION}.
 */
public final class ClientConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 3001;

    /** Upper bound of every duration setting. */
    public static final Duration MAX_DURATION = Duration.ofMillis(Integer.MAX_VALUE);

    static final String HOST_KEY = "sockbridge.host";
    static final String PORT_KEY = "sockbridge.port";
    static final String MODE_KEY = "sockbridge.mode";
    static final String CONNECTION_TIMEOUT_KEY = "sockbridge.connection-timeout-ms";
    static final String READ_TIMEOUT_KEY = "sockbridge.read-timeout-ms";
    static final String IDLE_POLL_INTERVAL_KEY = "sockbridge.idle-poll-interval-ms";
    static final String SHUTDOWN_TIMEOUT_KEY = "sockbridge.shutdown-timeout-ms";

    private final Endpoint endpoint;
    private final ClientMode mode;
    private final Duration connectionTimeout;
    private final Optional<Duration> readTimeout;
    private final Duration idlePollInterval;
    private final Duration shutdownTimeout;

    private ClientConfig(
            Endpoint endpoint,
            ClientMode mode,
            Duration connectionTimeout,
            Duration readTimeout,
            Duration idlePollInterval,
            Duration shutdownTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.connectionTimeout = requireInRange(connectionTimeout, "connectionTimeout");
        this.readTimeout = Optional.ofNullable(readTimeout).map(timeout -> requireInRange(timeout, "readTimeout"));
        this.idlePollInterval = requireInRange(idlePollInterval, "idlePollInterval");
        this.shutdownTimeout = requireInRange(shutdownTimeout, "shutdownTimeout");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from properties. Missing keys take their defaults.
     *
     * <table>
     *   <caption>Recognised keys</caption>
     *   <tr><td>{@code sockbridge.host}</td><td>peer host, default {@code localhost}</td></tr>
     *   <tr><td>{@code sockbridge.port}</td><td>peer port, default {@code 3001}</td></tr>
     *   <tr><td>{@code sockbridge.mode}</td><td>{@code sync} or {@code async}, default {@code async}</td></tr>
     *   <tr><td>{@code sockbridge.connection-timeout-ms}</td><td>default 30000</td></tr>
     *   <tr><td>{@code sockbridge.read-timeout-ms}</td><td>blocking receive timeout, 0 or absent for none</td></tr>
     *   <tr><td>{@code sockbridge.idle-poll-interval-ms}</td><td>outbound worker back-off, default 10</td></tr>
     *   <tr><td>{@code sockbridge.shutdown-timeout-ms}</td><td>default 2000</td></tr>
     * </table>
     *
     * @param properties the source properties
     * @return the configuration
     * @throws SockBridgeInvalidArgumentException if a value cannot be parsed
     */
    public static ClientConfig fromProperties(Properties properties) {
        Builder builder = builder();
        readString(properties, HOST_KEY).ifPresent(builder::host);
        readLong(properties, PORT_KEY).ifPresent(port -> builder.port((int) Math.min(port, Integer.MAX_VALUE)));
        readString(properties, MODE_KEY).ifPresent(mode -> builder.mode(ClientMode.fromString(mode)));
        readLong(properties, CONNECTION_TIMEOUT_KEY)
                .ifPresent(millis -> builder.connectionTimeout(Duration.ofMillis(millis)));
        readLong(properties, READ_TIMEOUT_KEY)
                .ifPresent(millis -> builder.readTimeout(millis == 0 ? null : Duration.ofMillis(millis)));
        readLong(properties, IDLE_POLL_INTERVAL_KEY)
                .ifPresent(millis -> builder.idlePollInterval(Duration.ofMillis(millis)));
        readLong(properties, SHUTDOWN_TIMEOUT_KEY)
                .ifPresent(millis -> builder.shutdownTimeout(Duration.ofMillis(millis)));
        return builder.build();
    }

    /**
     * Reads a UTF-8 {@code .properties} file.
     *
     * @param file the file to read
     * @return the configuration
     * @throws IOException if the file cannot be read
     */
    public static ClientConfig load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public ClientMode getMode() {
        return mode;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    /**
     * Timeout of a blocking receive. Empty means a receive waits until data or end of stream arrives.
     *
     * @return the read timeout, if any
     */
    public Optional<Duration> getReadTimeout() {
        return readTimeout;
    }

    public Duration getIdlePollInterval() {
        return idlePollInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    private static Duration requireInRange(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new SockBridgeInvalidArgumentException(name + " must be a positive duration, got " + value);
        }
        // Netty takes the connect timeout as int milliseconds
        if (value.compareTo(MAX_DURATION) > 0) {
            throw new SockBridgeInvalidArgumentException(
                    name + " must not exceed " + MAX_DURATION.toMillis() + " ms, got " + value.toMillis() + " ms");
        }
        return value;
    }

    private static Optional<String> readString(Properties properties, String key) {
        String value = properties.getProperty(key);
        return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(value.trim());
    }

    private static Optional<Long> readLong(Properties properties, String key) {
        return readString(properties, key).map(value -> {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new SockBridgeInvalidArgumentException(key + " must not be negative, got " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new SockBridgeInvalidArgumentException(key + " is not a number: " + value, e);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ClientConfig that = (ClientConfig) o;

        return new EqualsBuilder()
                .append(endpoint, that.endpoint)
                .append(mode, that.mode)
                .append(connectionTimeout, that.connectionTimeout)
                .append(readTimeout, that.readTimeout)
                .append(idlePollInterval, that.idlePollInterval)
                .append(shutdownTimeout, that.shutdownTimeout)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(endpoint)
                .append(mode)
                .append(connectionTimeout)
                .append(readTimeout)
                .append(idlePollInterval)
                .append(shutdownTimeout)
                .toHashCode();
    }

    @Override
    public String toString() {
        return "ClientConfig{"
                + "endpoint=" + endpoint
                + ", mode=" + mode
                + ", connectionTimeout=" + connectionTimeout
                + ", readTimeout=" + readTimeout.map(Duration::toString).orElse("none")
                + ", idlePollInterval=" + idlePollInterval
                + ", shutdownTimeout=" + shutdownTimeout
                + '}';
    }

    /**
     * Builder for {@link ClientConfig}.
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private ClientMode mode = ClientMode.ASYNC;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration readTimeout;
        private Duration idlePollInterval = Duration.ofMillis(10);
        private Duration shutdownTimeout = Duration.ofSeconds(2);

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder mode(ClientMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        /**
         * Sets the blocking receive timeout; {@code null} waits without limit.
         *
         * @param readTimeout the timeout or {@code null}
         * @return this builder
         */
        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder idlePollInterval(Duration idlePollInterval) {
            this.idlePollInterval = idlePollInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Validates the values and builds the configuration.
         *
         * @return the configuration
         * @throws SockBridgeInvalidArgumentException if a value is out of range
         */
        public ClientConfig build() {
            return new ClientConfig(
                    new Endpoint(host, port),
                    mode,
                    connectionTimeout,
                    readTimeout,
                    idlePollInterval,
                    shutdownTimeout);
        }
    }
}
