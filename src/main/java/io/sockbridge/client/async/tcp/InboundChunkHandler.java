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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.sockbridge.client.ExitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;

/**
 * Inbound worker: copies every chunk read from the socket onto the inbound queue, verbatim and in read
 * order. Runs on the transport's single event-loop thread.
 *
 * <p>One instance serves every connect attempt of a transport.
 */
@ChannelHandler.Sharable
final class InboundChunkHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(InboundChunkHandler.class);

    private final Queue<byte[]> inbound;
    private final ExitSignal exitSignal;
    private volatile boolean endOfStream;

    InboundChunkHandler(Queue<byte[]> inbound, ExitSignal exitSignal) {
        this.inbound = inbound;
        this.exitSignal = exitSignal;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        if (exitSignal.isSignalled()) {
            log.trace("Discarding {} byte(s) received after shutdown", msg.readableBytes());
            return;
        }
        if (!msg.isReadable()) {
            return;
        }
        byte[] chunk = ByteBufUtil.getBytes(msg);
        inbound.add(chunk);
        log.trace("Queued {} inbound byte(s) from {}", chunk.length, ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        endOfStream = true;
        if (!exitSignal.isSignalled()) {
            log.info("Peer {} closed the connection", ctx.channel().remoteAddress());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Read from {} failed, closing connection: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    /**
     * Returns whether the peer closed the stream or the read side failed.
     *
     * @return {@code true} once nothing more will be read
     */
    boolean isEndOfStream() {
        return endOfStream;
    }
}
