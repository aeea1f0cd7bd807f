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
 * How a {@link SocketClient} moves bytes. Fixed when the client is created.
 */
public enum ClientMode {
    /** Blocking writes and reads on the caller's thread. */
    SYNC,
    /** Queue-backed; a background outbound worker and inbound worker do the I/O. */
    ASYNC;

    /**
     * Parses a mode name, ignoring case and surrounding whitespace.
     *
     * @param value {@code "sync"} or {@code "async"}
     * @return the matching mode
     * @throws SockBridgeInvalidArgumentException if the value names no mode
     */
    public static ClientMode fromString(String value) {
        if (StringUtils.isBlank(value)) {
            throw new SockBridgeInvalidArgumentException("Client mode cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new SockBridgeInvalidArgumentException("Unknown client mode: " + value, e);
        }
    }
}
