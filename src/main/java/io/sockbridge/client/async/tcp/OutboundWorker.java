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

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.sockbridge.client.ExitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Outbound worker: drains the outbound queue onto the channel in FIFO order until the exit signal is set.
 *
 * <p>An empty queue parks the worker for at most one idle poll interval. A failed write is fatal for this
 * worker: it is logged and nothing further is written.
 */
final class OutboundWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OutboundWorker.class);

    private final Channel channel;
    private final BlockingQueue<byte[]> outbound;
    private final ExitSignal exitSignal;
    private final Duration idlePollInterval;
    private volatile boolean failed;

    OutboundWorker(Channel channel, BlockingQueue<byte[]> outbound, ExitSignal exitSignal, Duration idlePollInterval) {
        this.channel = channel;
        this.outbound = outbound;
        this.exitSignal = exitSignal;
        this.idlePollInterval = idlePollInterval;
    }

    @Override
    public void run() {
        log.debug("Outbound worker started for {}", channel.remoteAddress());
        while (!exitSignal.isSignalled()) {
            byte[] payload;
            try {
                payload = outbound.poll(idlePollInterval.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (payload == null || payload.length == 0) {
                continue;
            }
            if (exitSignal.isSignalled()) {
                break;
            }
            if (!write(payload)) {
                failed = true;
                break;
            }
        }
        log.debug("Outbound worker stopped for {}", channel.remoteAddress());
    }

    private boolean write(byte[] payload) {
        ChannelFuture write = channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).awaitUninterruptibly();
        if (!write.isSuccess()) {
            if (exitSignal.isSignalled()) {
                log.debug("Write of {} byte(s) interrupted by shutdown", payload.length);
            } else {
                log.error(
                        "Failed to write {} byte(s) to {}, no further payloads will be sent",
                        payload.length,
                        channel.remoteAddress(),
                        write.cause());
            }
            return false;
        }
        log.trace("Wrote {} byte(s) to {}", payload.length, channel.remoteAddress());
        return true;
    }

    /**
     * Returns whether a write failed and the worker gave up.
     *
     * @return {@code true} after a fatal write failure
     */
    boolean hasFailed() {
        return failed;
    }
}
