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

import java.util.Optional;

/**
 * A connection to one remote peer together with the way bytes are moved over it.
 *
 * <p>{@link SocketClient} picks one implementation per {@link ClientMode} when it is built, so callers
 * never branch on the mode themselves.
 *
 * @see io.sockbridge.client.blocking.tcp.BlockingTcpTransport
 * @see io.sockbridge.client.async.tcp.AsyncTcpTransport
 */
public interface Transport extends AutoCloseable {

    /**
     * Opens the connection.
     *
     * @throws io.sockbridge.exception.SockBridgeConnectionException if the peer cannot be reached
     * @throws IllegalStateException if the transport was already closed
     */
    void connect();

    /**
     * Hands a payload to the peer. The bytes are passed through untouched.
     *
     * @param payload the bytes to write
     */
    void send(byte[] payload);

    /**
     * Takes the next chunk received from the peer, decoded as UTF-8.
     *
     * @return the text, or empty when there is no data
     */
    Optional<String> receive();

    /**
     * Returns whether {@link #connect()} succeeded and {@link #close()} has not been called.
     *
     * @return {@code true} while connected
     */
    boolean isConnected();

    ConnectionState state();

    /**
     * Stops the workers, if any, and closes the connection. Safe to call more than once.
     */
    @Override
    void close();
}
