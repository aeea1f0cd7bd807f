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

package io.sockbridge.serde;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * UTF-8 conversion between caller text and wire payloads.
 *
 * <p>Payloads are opaque to the transports; only the client surface decodes them. Decoding is strict:
 * a chunk that is not valid UTF-8 yields no data rather than replacement characters.
 */
public final class PayloadCodec {

    private static final Logger log = LoggerFactory.getLogger(PayloadCodec.class);

    private PayloadCodec() {}

    public static byte[] encode(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes a received chunk.
     *
     * @param payload the raw bytes
     * @return the text, or empty if the bytes are not valid UTF-8
     */
    public static Optional<String> decode(byte[] payload) {
        CharsetDecoder decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return Optional.of(decoder.decode(ByteBuffer.wrap(payload)).toString());
        } catch (CharacterCodingException e) {
            log.debug("Dropping {} byte(s) that are not valid UTF-8", payload.length);
            return Optional.empty();
        }
    }
}
