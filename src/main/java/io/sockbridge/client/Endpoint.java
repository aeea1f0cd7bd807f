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

import io.sockbridge.exception.SockBridgeInvalidArgumentException;
import org.apache.commons.lang3.StringUtils;

/**
 * Host and port of the remote peer.
 *
 * @param host the host name or address
 * @param port the TCP port, {@code 1..65535}
 */
public record Endpoint(String host, int port) {

    private static final int MAX_PORT = 65535;

    public Endpoint {
        if (StringUtils.isBlank(host)) {
            throw new SockBridgeInvalidArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > MAX_PORT) {
            throw new SockBridgeInvalidArgumentException("Port must be between 1 and " + MAX_PORT + ", got " + port);
        }
    }

    public static Endpoint of(String host, int port) {
        return new Endpoint(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
