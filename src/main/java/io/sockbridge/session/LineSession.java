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
import io.sockbridge.serde.PayloadCodec;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives a line-oriented peer: one send per line, one receive after each send.
 *
 * <p>The session does not interpret what it sends or receives. Replies are collected positionally and may
 * be missing or merged, since the transport is a byte stream; see {@link LineExchange}.
 *
 * <p>Each line is followed by {@link #DEFAULT_LINE_TERMINATOR} unless another terminator is given. Pass
 * {@code ""} to write lines back to back with no separator, relying on the peer's own {@code ;}
 * delimiters.
 *
 * <pre>{@code
 * var session = new LineSession(client);
 * session.reset();
 * LineExchange result = session.exchange("obj 10 10 osc~ 440;\nobj 10 50 dac~;");
 * log.info("Peer said: {}", result.joinedReplies());
 * }</pre>
 */
public class LineSession {

    public static final String DEFAULT_LINE_TERMINATOR = "\n";
    public static final String DEFAULT_RESET_COMMAND = "clear;";

    private static final Logger log = LoggerFactory.getLogger(LineSession.class);

    private final SocketClient client;
    private final String lineTerminator;
    private final String resetCommand;

    public LineSession(SocketClient client) {
        this(client, DEFAULT_LINE_TERMINATOR, DEFAULT_RESET_COMMAND);
    }

    public LineSession(SocketClient client, String lineTerminator, String resetCommand) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.lineTerminator = Objects.requireNonNull(lineTerminator, "lineTerminator must not be null");
        this.resetCommand = Objects.requireNonNull(resetCommand, "resetCommand must not be null");
    }

    /**
     * Sends every non-blank line of {@code text} and receives once after each.
     *
     * @param text one or more lines, separated by {@code \n}, {@code \r} or {@code \r\n}
     * @return the sent lines and their replies
     * @throws io.sockbridge.exception.BrokenConnectionException if a blocking client finds the peer gone;
     *     lines after the failing one are not sent
     */
    public LineExchange exchange(String text) {
        List<String> sent = new ArrayList<>();
        List<Optional<String>> replies = new ArrayList<>();
        text.lines().filter(StringUtils::isNotBlank).forEach(line -> {
            client.send(PayloadCodec.encode(line + lineTerminator));
            sent.add(line);
            replies.add(client.receive());
        });
        LineExchange exchange = new LineExchange(sent, replies);
        log.debug("Sent {} line(s), {} without reply", sent.size(), exchange.missingReplies());
        return exchange;
    }

    /**
     * Sends the reset command and consumes its reply.
     *
     * @return the reply to the reset command, empty if none came back
     */
    public Optional<String> reset() {
        client.send(PayloadCodec.encode(resetCommand + lineTerminator));
        return client.receive();
    }
}
