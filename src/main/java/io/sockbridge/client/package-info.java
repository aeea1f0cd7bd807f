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
 * Socket client for a line-oriented remote process.
 *
 * <p>{@link io.sockbridge.client.SocketClient} is the entry point. Its {@link io.sockbridge.client.ClientMode}
 * selects a {@link io.sockbridge.client.Transport}: blocking I/O on the caller's thread, or queue-backed I/O
 * done by background workers.
 *
 * @see io.sockbridge.client.SocketClientBuilder
 */
package io.sockbridge.client;
