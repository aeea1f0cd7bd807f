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
 * Raised by a blocking send when nothing could be written because the peer closed the connection.
 * The client should not be used any further once this is thrown.
 */
public class BrokenConnectionException extends SockBridgeConnectionException {

    public BrokenConnectionException(Endpoint endpoint) {
        super("Socket connection broken: " + endpoint, endpoint);
    }

    public BrokenConnectionException(Endpoint endpoint, Throwable cause) {
        super("Socket connection broken: " + endpoint, endpoint, cause);
    }
}
