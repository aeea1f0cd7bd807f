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

package io.sockbridge.client;

import io.sockbridge.config.ClientConfig;
import io.sockbridge.exception.SockBridgeConnectionException;
import io.sockbridge.exception.SockBridgeInvalidArgumentException;

import java.time.Duration;

/**
 * Builder for creating configured {@link SocketClient} instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Queue-backed client, started explicitly
 * var client = SocketClient.builder()
 *     .host("localhost")
 *     .port(3001)
 *     .build();
 * client.start();
 *
 * // Blocking client that fails fast when the peer is absent
 * var client = SocketClient.builder()
 *     .sync()
 *     .port(3001)
 *     .readTimeout(Duration.ofSeconds(2))
 *     .buildAndStart();
 * }</pre>
 *
 * @see SocketClient#builder()
 */
public final class SocketClientBuilder {
    private final ClientConfig.Builder config = ClientConfig.builder();

    SocketClientBuilder() {}

    /**
     * Sets the host address of the peer.
     *
     * @param host the host address
     * @return this builder
     */
    public SocketClientBuilder host(String host) {
        config.host(host);
        return this;
    }

    /**
     * Sets the port of the peer.
     *
     * @param port the port number
     * @return this builder
     */
    public SocketClientBuilder port(int port) {
        config.port(port);
        return this;
    }

    /**
     * Sets the transport mode.
     *
     * @param mode blocking or queue-backed
     * @return this builder
     */
    public SocketClientBuilder mode(ClientMode mode) {
        config.mode(mode);
        return this;
    }

    /**
     * Selects blocking mode.
     *
     * @return this builder
     */
    public SocketClientBuilder sync() {
        return mode(ClientMode.SYNC);
    }

    /**
     * Selects queue-backed mode.
     *
     * @return this builder
     */
    public SocketClientBuilder async() {
        return mode(ClientMode.ASYNC);
    }

    /**
     * Sets the connection timeout.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public SocketClientBuilder connectionTimeout(Duration connectionTimeout) {
        config.connectionTimeout(connectionTimeout);
        return this;
    }

    /**
     * Sets how long a blocking receive waits before reporting no data. Ignored in queue-backed mode.
     *
     * @param readTimeout the read timeout, or {@code null} to wait without limit
     * @return this builder
     */
    public SocketClientBuilder readTimeout(Duration readTimeout) {
        config.readTimeout(readTimeout);
        return this;
    }

    /**
     * Sets how long the outbound worker parks when its queue is empty.
     *
     * @param idlePollInterval the idle back-off
     * @return this builder
     */
    public SocketClientBuilder idlePollInterval(Duration idlePollInterval) {
        config.idlePollInterval(idlePollInterval);
        return this;
    }

    /**
     * Sets the longest time {@link SocketClient#close()} waits for the socket and workers.
     *
     * @param shutdownTimeout the shutdown timeout
     * @return this builder
     */
    public SocketClientBuilder shutdownTimeout(Duration shutdownTimeout) {
        config.shutdownTimeout(shutdownTimeout);
        return this;
    }

    /**
     * Builds the client. Note: you still need to call {@link SocketClient#start()}.
     *
     * @return a new, unstarted client
     * @throws SockBridgeInvalidArgumentException if the host is empty, the port is out of range or a
     *     duration is not positive
     */
    public SocketClient build() {
        return new SocketClient(config.build());
    }

    /**
     * Builds and starts the client.
     *
     * @return a connected client
     * @throws SockBridgeConnectionException if the peer cannot be reached
     * @throws SockBridgeInvalidArgumentException if the configuration is invalid
     */
    public SocketClient buildAndStart() {
        SocketClient client = build();
        if (!client.start()) {
            SockBridgeConnectionException error = client.connectionError().orElseThrow();
            client.close();
            throw error;
        }
        return client;
    }
}
