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

package io.sockbridge.session;

import io.sockbridge.client.SocketClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates whatever the peer prints, one {@link #poll()} at a time.
 *
 * <p>Thread-safe; a UI may poll from a timer while another thread clears.
 */
public class ConsoleTranscript {

    private final SocketClient client;
    private final List<String> history = new ArrayList<>();

    public ConsoleTranscript(SocketClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    /**
     * Receives once if the client is connected and appends any non-empty text.
     *
     * @return the whole transcript so far, or empty if nothing has been collected
     */
    public synchronized Optional<String> poll() {
        if (!client.isConnected()) {
            return Optional.empty();
        }
        client.receive().filter(text -> !text.isEmpty()).ifPresent(history::add);
        return transcript();
    }

    /**
     * Returns the collected text without receiving.
     *
     * @return the whole transcript so far, or empty if nothing has been collected
     */
    public synchronized Optional<String> transcript() {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("", history));
    }

    public synchronized void clear() {
        history.clear();
    }
}
