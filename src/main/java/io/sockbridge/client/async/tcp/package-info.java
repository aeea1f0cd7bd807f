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

/**
 * Netty-based, queue-backed transport of the socket client.
 *
 * <p>Callers never touch the socket: sends go onto an outbound queue and receives pop from an inbound
 * queue. Two workers move the bytes.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.sockbridge.client.async.tcp.AsyncTcpTransport} owns the queues, the channel and the
 *       shutdown sequence</li>
 *   <li>{@link io.sockbridge.client.async.tcp.OutboundWorker} drains the outbound queue on its own
 *       thread</li>
 *   <li>{@link io.sockbridge.client.async.tcp.InboundChunkHandler} runs on the event loop and queues
 *       chunks of at most 1024 bytes</li>
 * </ul>
 *
 * <p>Write failures stop the outbound worker and are only logged; the peer closing the connection stops
 * the inbound worker. Neither is reported to the caller, who keeps seeing "no data".
 *
 * @see io.sockbridge.client.SocketClient
 */
package io.sockbridge.client.async.tcp;
