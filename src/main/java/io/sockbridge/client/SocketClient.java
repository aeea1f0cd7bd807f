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

import io.sockbridge.client.async.tcp.AsyncTcpTransport;
import io.sockbridge.client.blocking.tcp.BlockingTcpTransport;
import io.sockbridge.config.ClientConfig;
import io.sockbridge.exception.SockBridgeConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * TCP client for a line-oriented remote process, usable in blocking or queue-backed mode.
 *
 * <p>The mode is fixed at construction and only decides which {@link Transport} the client delegates to;
 * the methods behave the same from the caller's point of view:
 * <ul>
 *   <li>{@link #start()} connects, reporting failure through its return value</li>
 *   <li>{@link #send(byte[])} hands bytes to the peer</li>
 *   <li>{@link #receive()} returns the next chunk of text or empty for "no data"</li>
 *   <li>{@link #close()} stops the workers and closes the socket</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * try (var client = new SocketClient("localhost", 3001, ClientMode.SYNC)) {
 *     if (client.start()) {
 *         client.send("clear;".getBytes(StandardCharsets.UTF_8));
 *         client.receive().ifPresent(System.out::println);
 *     }
 * }
 * }</pre>
 *
 * @see SocketClientBuilder
 */
public class SocketClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SocketClient.class);

    private final ClientConfig config;
    private final Transport transport;
    private volatile SockBridgeConnectionException connectionError;

    /**
     * Creates an asynchronous client.
     *
     * @param host the peer host
     * @param port the peer port
     */
    public SocketClient(String host, int port) {
        this(host, port, ClientMode.ASYNC);
    }

    public SocketClient(String host, int port, ClientMode mode) {
        this(ClientConfig.builder().host(host).port(port).mode(mode).build());
    }

    public SocketClient(ClientConfig config) {
        this(config, createTransport(config));
    }

    SocketClient(ClientConfig config, Transport transport) {
        this.config = config;
        this.transport = transport;
    }

    /**
     * Creates a new builder for configuring a SocketClient.
     *
     * @return a new builder
     */
    public static SocketClientBuilder builder() {
        return new SocketClientBuilder();
    }

    private static Transport createTransport(ClientConfig config) {
        if (config.getMode() == ClientMode.SYNC) {
            return new BlockingTcpTransport(config);
        }
        return new AsyncTcpTransport(config);
    }

    /**
     * Connects to the peer and, in asynchronous mode, starts the outbound and inbound workers.
     *
     * <p>A failure is logged and kept in {@link #connectionError()}; the client stays unstarted and
     * {@link #isConnected()} returns {@code false}.
     *
     * @return {@code true} if the client is connected
     */
    public boolean start() {
        try {
            transport.connect();
        } catch (SockBridgeConnectionException e) {
            connectionError = e;
            log.error("Socket error: {}", e.getMessage());
            return false;
        }
        connectionError = null;
        log.info("Client started ({} mode, {})", config.getMode(), config.getEndpoint());
        return true;
    }

    /**
     * Returns why the last {@link #start()} failed.
     *
     * @return the connection failure, or empty if the last start succeeded or none was attempted
     */
    public Optional<SockBridgeConnectionException> connectionError() {
        return Optional.ofNullable(connectionError);
    }

    /**
     * Sends a payload.
     *
     * <p>Asynchronous mode queues the payload and returns at once; write failures are only logged.
     * Synchronous mode writes on the calling thread.
     *
     * @param payload the bytes to send
     * @throws io.sockbridge.exception.BrokenConnectionException in synchronous mode, if the peer has closed
     *     the connection
     * @throws io.sockbridge.exception.SockBridgeNotConnectedException in synchronous mode, before a
     *     successful start
     */
    public void send(byte[] payload) {
        transport.send(payload);
    }

    /**
     * Receives the next chunk of text.
     *
     * <p>Asynchronous mode never waits. Synchronous mode waits for one read, bounded by the configured read
     * timeout if there is one. Timeouts, invalid UTF-8, end of stream and an empty queue all yield empty.
     *
     * @return the received text, or empty for no data
     */
    public Optional<String> receive() {
        return transport.receive();
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public ConnectionState state() {
        return transport.state();
    }

    public ClientMode mode() {
        return config.getMode();
    }

    public Endpoint endpoint() {
        return config.getEndpoint();
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Closes the connection and stops the workers. Waits at most the configured shutdown timeout.
     */
    @Override
    public void close() {
        if (transport.state() == ConnectionState.CLOSED) {
            return;
        }
        transport.close();
        log.info("Client closed");
    }
}
