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

package io.sockbridge.exception;

import io.sockbridge.client.Endpoint;

/**
 * Raised when the connection to the remote peer cannot be established.
 *
 * <p>The underlying OS-level reason (refused, unreachable, timed out, unknown host) is kept as the cause.
 * The client is never retried internally; the caller decides whether to build a new one.
 */
public class SockBridgeConnectionException extends SockBridgeException {

    private final Endpoint endpoint;

    public SockBridgeConnectionException(Endpoint endpoint, Throwable cause) {
        this("Failed to connect to " + endpoint + ": " + describe(cause), endpoint, cause);
    }

    protected SockBridgeConnectionException(String message, Endpoint endpoint) {
        super(message);
        this.endpoint = endpoint;
    }

    protected SockBridgeConnectionException(String message, Endpoint endpoint, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    /**
     * Returns the peer the client was talking to.
     *
     * @return the endpoint
     */
    public Endpoint getEndpoint() {
        return endpoint;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown reason";
        }
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null
                ? root.getMessage()
                : root.getClass().getSimpleName();
    }
}
