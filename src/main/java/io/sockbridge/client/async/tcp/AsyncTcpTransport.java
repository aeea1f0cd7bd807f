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

package io.sockbridge.client.async.tcp;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.sockbridge.client.ConnectionState;
import io.sockbridge.client.Endpoint;
import io.sockbridge.client.ExitSignal;
import io.sockbridge.client.Transport;
import io.sockbridge.config.ClientConfig;
import io.sockbridge.exception.SockBridgeConnectionException;
import io.sockbridge.serde.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Queue-backed transport using Netty for the socket.
 *
 * <p>Callers only ever touch two unbounded FIFO queues: {@link #send(byte[])} appends to the outbound queue
 * and {@link #receive()} pops from the inbound queue, so neither blocks. Two workers do the I/O once the
 * connection is up:
 * <ul>
 *   <li>the outbound worker, a dedicated thread draining the outbound queue onto the socket</li>
 *   <li>the inbound worker, the single event-loop thread pushing chunks of at most
 *       {@value #READ_CHUNK_SIZE} bytes onto the inbound queue</li>
 * </ul>
 * Both stop when {@link #close()} sets the shared {@link ExitSignal} and closes the channel.
 */
public class AsyncTcpTransport implements Transport {

    static final int READ_CHUNK_SIZE = 1024;

    private static final Logger log = LoggerFactory.getLogger(AsyncTcpTransport.class);

    private final Endpoint endpoint;
    private final Duration idlePollInterval;
    private final Duration shutdownTimeout;
    private final BlockingQueue<byte[]> outbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final ExitSignal exitSignal = new ExitSignal();
    private final InboundChunkHandler inboundHandler;
    private final ThreadFactory outboundThreadFactory;
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private volatile ConnectionState state = ConnectionState.UNCONNECTED;
    private volatile Channel channel;
    private volatile OutboundWorker outboundWorker;
    private volatile Thread outboundThread;

    public AsyncTcpTransport(ClientConfig config) {
        this.endpoint = config.getEndpoint();
        this.idlePollInterval = config.getIdlePollInterval();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.inboundHandler = new InboundChunkHandler(inbound, exitSignal);
        this.outboundThreadFactory = new DefaultThreadFactory("sockbridge-outbound", true);
        this.eventLoopGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("sockbridge-inbound", true));
        this.bootstrap = new Bootstrap();
        configureBootstrap(config.getConnectionTimeout());
    }

    private void configureBootstrap(Duration connectionTimeout) {
        bootstrap
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectionTimeout.toMillis()))
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(READ_CHUNK_SIZE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast("inboundChunks", inboundHandler);
                    }
                });
    }

    /**
     * Connects and starts the outbound and inbound workers. Payloads sent before this call are kept and
     * written once the outbound worker runs.
     */
    @Override
    public synchronized void connect() {
        if (state == ConnectionState.CLOSED) {
            throw new IllegalStateException("Transport to " + endpoint + " is already closed");
        }
        if (state == ConnectionState.CONNECTED) {
            log.warn("Already connected to {}", endpoint);
            return;
        }
        ChannelFuture future =
                bootstrap.connect(endpoint.host(), endpoint.port()).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new SockBridgeConnectionException(endpoint, future.cause());
        }
        channel = future.channel();
        outboundWorker = new OutboundWorker(channel, outbound, exitSignal, idlePollInterval);
        outboundThread = outboundThreadFactory.newThread(outboundWorker);
        state = ConnectionState.CONNECTED;
        outboundThread.start();
    }

    /**
     * Queues a payload for the outbound worker. Never blocks and never reports write failures.
     * Payloads handed over after {@link #close()} are dropped.
     */
    @Override
    public void send(byte[] payload) {
        if (state == ConnectionState.CLOSED) {
            log.debug("Dropping {} byte(s) sent after close", payload.length);
            return;
        }
        outbound.add(payload);
    }

    /**
     * Pops the oldest received chunk without waiting.
     *
     * @return the chunk as text, or empty if nothing has arrived or the chunk is not valid UTF-8
     */
    @Override
    public Optional<String> receive() {
        byte[] chunk = inbound.poll();
        if (chunk == null) {
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
        exitSignal.signal();

        if (outboundThread != null) {
            outboundThread.interrupt();
        }
        Channel current = channel;
        if (current != null) {
            current.close().awaitUninterruptibly(shutdownTimeout.toMillis());
        }
        eventLoopGroup
                .shutdownGracefully(0, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(shutdownTimeout.toMillis());
        if (outboundThread != null) {
            try {
                outboundThread.join(shutdownTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (outboundThread.isAlive()) {
                log.warn("Outbound worker for {} did not stop within {}", endpoint, shutdownTimeout);
            }
        }
        int unsent = outbound.size();
        if (unsent > 0) {
            log.debug("Discarded {} unsent payload(s) for {}", unsent, endpoint);
        }
    }

    /**
     * Returns whether the outbound or inbound worker is still running.
     *
     * @return {@code true} while either worker is alive
     */
    boolean hasLiveWorkers() {
        boolean outboundAlive = outboundThread != null && outboundThread.isAlive();
        return outboundAlive || !eventLoopGroup.isTerminated();
    }

    /**
     * Returns whether the peer closed the connection.
     *
     * @return {@code true} once the inbound worker reached end of stream
     */
    public boolean isPeerClosed() {
        return inboundHandler.isEndOfStream();
    }

    /**
     * Returns whether the outbound worker stopped after a failed write.
     *
     * @return {@code true} after a fatal write failure
     */
    public boolean hasWriteFailed() {
        OutboundWorker worker = outboundWorker;
        return worker != null && worker.hasFailed();
    }
}
