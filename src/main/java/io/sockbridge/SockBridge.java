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

package io.sockbridge;

import io.sockbridge.client.SocketClient;
import io.sockbridge.client.SocketClientBuilder;

/**
 * Main entry point for creating SockBridge clients.
 *
 * <pre>{@code
 * // Blocking client: every send and receive runs on the caller's thread
 * var client = SockBridge.tcpClientBuilder().sync()
 *     .host("localhost")
 *     .port(3001)
 *     .build();
 * client.start();
 *
 * // Queue-backed client: background workers move the bytes
 * var asyncClient = SockBridge.tcpClientBuilder().async()
 *     .port(3001)
 *     .buildAndStart();
 *
 * String version = SockBridge.version();
 * }</pre>
 *
 * @see SocketClient
 * @see SockBridgeVersion
 */
public final class SockBridge {

    private SockBridge() {}

    /**
     * Creates a builder for TCP clients.
     *
     * @return a TCP client builder, queue-backed unless {@code sync()} is selected
     */
    public static SocketClientBuilder tcpClientBuilder() {
        return SocketClient.builder();
    }

    /**
     * Returns the library version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public static String version() {
        return SockBridgeVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static SockBridgeVersion versionInfo() {
        return SockBridgeVersion.getInstance();
    }
}
