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

package io.sockbridge.client.blocking.tcp;

import io.netty.channel.ChannelOption;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.sockbridge.client.ConnectionState;
import io.sockbridge.client.Endpoint;
import io.sockbridge.client.Transport;
import io.sockbridge.config.ClientConfig;
import io.sockbridge.exception.BrokenConnectionException;
import io.sockbridge.exception.SockBridgeConnectionException;
import io.sockbridge.exception.SockBridgeNotConnectedException;
import io.sockbridge.serde.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking transport: every send and receive runs on the caller's thread.
 *
 * <p>A send blocks until the payload has been written. A receive blocks until one chunk of at most
 * {@value #READ_CHUNK_SIZE} bytes is available, the optional read timeout elapses, the peer closes the
 * connection, or the transport is closed. All of these outcomes except a chunk are reported the same way:
 * no data.
 *
 * <p>The event loop reads whatever the peer sends into an unbounded in-memory queue, whether or not the
 * caller is receiving. A peer that keeps writing to a caller that rarely calls {@link #receive()} grows
 * that queue without limit; the socket's own receive buffer applies no backpressure here.
 */
public final class BlockingTcpTransport implements Transport {

    static final int READ_CHUNK_SIZE = 8192;

    private static final Logger log = LoggerFactory.getLogger(BlockingTcpTransport.class);

    // identity marker queued once the inbound side has completed
    private static final byte[] END_OF_STREAM = new byte[0];

    private final Endpoint endpoint;
    private final TcpClient client;
    private final Duration connectionTimeout;
    private final Optional<Duration> readTimeout;
    private final Duration shutdownTimeout;
    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private volatile ConnectionState state = ConnectionState.UNCONNECTED;
    private volatile Connection connection;

    public BlockingTcpTransport(ClientConfig config) {
        this.endpoint = config.getEndpoint();
        this.connectionTimeout = config.getConnectionTimeout();
        this.readTimeout = config.getReadTimeout();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.client = TcpClient.create()
                .host(endpoint.host())
                .port(endpoint.port())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectionTimeout.toMillis()))
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(READ_CHUNK_SIZE));
    }

    @Override
    public synchronized void connect() {
        if (state == ConnectionState.CLOSED) {
            throw new IllegalStateException("Transport to " + endpoint + " is already closed");
        }
        if (state == ConnectionState.CONNECTED) {
            log.warn("Already connected to {}", endpoint);
            return;
        }
        Connection established;
        try {
            // the connect timeout option fails first; the extra second only guards the block() call
            established = client.connectNow(connectionTimeout.plusSeconds(1));
        } catch (RuntimeException e) {
            throw new SockBridgeConnectionException(endpoint, e);
        }
        established
                .inbound()
                .receive()
                .asByteArray()
                .subscribe(
                        chunk -> {
                            log.trace("Received {} byte(s) from {}", chunk.length, endpoint);
                            chunks.add(chunk);
                        },
                        error -> {
                            log.debug("Inbound stream from {} failed: {}", endpoint, error.getMessage());
                            chunks.add(END_OF_STREAM);
                        },
                        () -> {
                            log.debug("Peer {} closed the connection", endpoint);
                            chunks.add(END_OF_STREAM);
                        });
        connection = established;
        state = ConnectionState.CONNECTED;
    }

    /**
     * Writes the whole payload and waits for the write to finish.
     *
     * @param payload the bytes to write; an empty payload writes nothing
     * @throws SockBridgeNotConnectedException if {@link #connect()} has not succeeded
     * @throws BrokenConnectionException if the connection is gone or the write fails
     */
    @Override
    public void send(byte[] payload) {
        Connection current = requireConnection();
        if (payload.length == 0) {
            return;
        }
        if (state == ConnectionState.CLOSED || current.isDisposed()) {
            throw new BrokenConnectionException(endpoint);
        }
        try {
            current.outbound().sendByteArray(Mono.just(payload)).then().block();
        } catch (RuntimeException e) {
            throw new BrokenConnectionException(endpoint, e);
        }
        log.trace("Sent {} byte(s) to {}", payload.length, endpoint);
    }

    @Override
    public Optional<String> receive() {
        requireConnection();
        byte[] chunk;
        try {
            chunk = readTimeout.isPresent()
                    ? chunks.poll(readTimeout.get().toNanos(), TimeUnit.NANOSECONDS)
                    : chunks.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for data from {}", endpoint);
            return Optional.empty();
        }
        if (chunk == null) {
            log.debug("No data from {} within {}", endpoint, readTimeout.get());
            return Optional.empty();
        }
        if (chunk == END_OF_STREAM) {
            // keep the marker so later receives return at once
            chunks.add(END_OF_STREAM);
            return Optional.empty();
        }
        return PayloadCodec.decode(chunk);
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    @Override
    public synchronized void close() {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        state = ConnectionState.CLOSED;
        Connection current = connection;
        if (current != null && !current.isDisposed()) {
            try {
                current.disposeNow(shutdownTimeout);
            } catch (IllegalStateException e) {
                log.warn("Connection to {} did not close within {}", endpoint, shutdownTimeout, e);
            }
        }
        chunks.add(END_OF_STREAM);
    }

    private Connection requireConnection() {
        Connection current = connection;
        if (current == null) {
            throw new SockBridgeNotConnectedException(
                    "Client not connected to " + endpoint + ". Call start() first.");
        }
        return current;
    }
}
