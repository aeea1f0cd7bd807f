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

import io.sockbridge.config.ClientConfig;
import io.sockbridge.exception.BrokenConnectionException;
import io.sockbridge.exception.SockBridgeConnectionException;
import io.sockbridge.exception.SockBridgeNotConnectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocketClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private StubServer server;
    private SocketClient client;

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static Optional<String> pollReceive(SocketClient client) {
        AtomicReference<Optional<String>> reply = new AtomicReference<>(Optional.empty());
        StubServer.await(
                () -> {
                    reply.set(client.receive());
                    return reply.get().isPresent();
                },
                TIMEOUT);
        return reply.get();
    }

    @Nested
    class AsyncMode {

        @Test
        void shouldEchoThroughQueuesAndStopOnClose() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.ECHO);
            client = new SocketClient(server.host(), server.port());
            assertThat(client.mode()).isEqualTo(ClientMode.ASYNC);

            // when
            assertThat(client.start()).isTrue();
            client.send(bytes("hello"));
            Optional<String> reply = pollReceive(client);
            client.close();

            // then
            assertThat(reply).contains("hello");
            assertThat(client.isConnected()).isFalse();
            assertThat(client.state()).isEqualTo(ConnectionState.CLOSED);
            assertThatCode(() -> client.send(bytes("dropped"))).doesNotThrowAnyException();
        }

        @Test
        void shouldReturnNoDataImmediatelyWhenNothingArrived() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.SILENT);
            client = new SocketClient(server.host(), server.port(), ClientMode.ASYNC);
            client.start();

            // when
            long started = System.nanoTime();
            Optional<String> reply = client.receive();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            // then
            assertThat(reply).isEmpty();
            assertThat(elapsed).isLessThan(Duration.ofMillis(500));
        }

        @Test
        void shouldAcceptSendAndReceiveBeforeStart() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.ECHO);
            client = new SocketClient(server.host(), server.port(), ClientMode.ASYNC);

            // when
            assertThatCode(() -> client.send(bytes("early"))).doesNotThrowAnyException();
            Optional<String> beforeStart = client.receive();
            client.start();

            // then
            assertThat(beforeStart).isEmpty();
            assertThat(StubServer.await(() -> server.receivedText().equals("early"), TIMEOUT))
                    .isTrue();
        }
    }

    @Nested
    class SyncMode {

        @Test
        void shouldReceiveEchoRightAfterSend() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.ECHO);
            client = SocketClient.builder()
                    .sync()
                    .host(server.host())
                    .port(server.port())
                    .readTimeout(TIMEOUT)
                    .build();
            client.start();

            // when
            client.send(bytes("ping"));
            Optional<String> reply = client.receive();

            // then
            assertThat(reply).contains("ping");
        }

        @Test
        void shouldReportNoDataWhenReadTimesOut() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.SILENT);
            client = SocketClient.builder()
                    .sync()
                    .host(server.host())
                    .port(server.port())
                    .readTimeout(Duration.ofMillis(200))
                    .build();
            client.start();

            // when
            Optional<String> reply = client.receive();

            // then
            assertThat(reply).isEmpty();
        }

        @Test
        void shouldRaiseBrokenConnectionWhenPeerClosed() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.CLOSE_ON_ACCEPT);
            client = SocketClient.builder()
                    .sync()
                    .host(server.host())
                    .port(server.port())
                    .readTimeout(TIMEOUT)
                    .build();
            assertThat(client.start()).isTrue();

            // when: the blocking read observes the end of stream
            Optional<String> reply = client.receive();

            // then
            assertThat(reply).isEmpty();
            assertThatThrownBy(() -> client.send(bytes("ping"))).isInstanceOf(BrokenConnectionException.class);
        }

        @Test
        void shouldRaiseBrokenConnectionOnSendOnceAbandonedByPeer() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.CLOSE_ON_ACCEPT);
            client = SocketClient.builder()
                    .sync()
                    .host(server.host())
                    .port(server.port())
                    .build();
            assertThat(client.start()).isTrue();
            assertThat(server.awaitConnection(TIMEOUT)).isTrue();

            // when: keep sending until the closed connection is noticed
            AtomicReference<RuntimeException> failure = new AtomicReference<>();
            boolean failed = StubServer.await(
                    () -> {
                        try {
                            client.send(bytes("ping"));
                            return false;
                        } catch (RuntimeException e) {
                            failure.set(e);
                            return true;
                        }
                    },
                    TIMEOUT);

            // then
            assertThat(failed).isTrue();
            assertThat(failure.get()).isInstanceOf(BrokenConnectionException.class);
        }

        @Test
        void shouldRejectSendBeforeStart() {
            // given
            client = new SocketClient("127.0.0.1", 3001, ClientMode.SYNC);

            // when/then
            assertThatThrownBy(() -> client.send(bytes("ping"))).isInstanceOf(SockBridgeNotConnectedException.class);
        }

        @Test
        void shouldRaiseOnSendAfterClose() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.ECHO);
            client = new SocketClient(server.host(), server.port(), ClientMode.SYNC);
            client.start();

            // when
            client.close();

            // then
            assertThat(client.isConnected()).isFalse();
            assertThatThrownBy(() -> client.send(bytes("ping"))).isInstanceOf(BrokenConnectionException.class);
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldReportConnectionFailureWithoutThrowing() throws Exception {
            // given
            int port = StubServer.unusedPort();
            client = new SocketClient("127.0.0.1", port);

            // when
            boolean started = client.start();

            // then
            assertThat(started).isFalse();
            assertThat(client.isConnected()).isFalse();
            assertThat(client.state()).isEqualTo(ConnectionState.UNCONNECTED);
            assertThat(client.connectionError()).isPresent();
            SockBridgeConnectionException error = client.connectionError().get();
            assertThat(error.getEndpoint()).isEqualTo(Endpoint.of("127.0.0.1", port));
            assertThat(error.getCause()).isNotNull();
        }

        @Test
        void shouldCloseNeverStartedClient() {
            // given
            client = new SocketClient("127.0.0.1", 3001);

            // when/then
            assertThatCode(client::close).doesNotThrowAnyException();
            assertThat(client.state()).isEqualTo(ConnectionState.CLOSED);
        }

        @Test
        void shouldTolerateRepeatedClose() throws Exception {
            // given
            server = StubServer.start(StubServer.Behavior.SILENT);
            client = new SocketClient(server.host(), server.port());
            client.start();

            // when/then
            client.close();
            assertThatCode(client::close).doesNotThrowAnyException();
        }

        @Test
        void shouldExposeConfiguration() {
            // given
            ClientConfig config = ClientConfig.builder()
                    .host("127.0.0.1")
                    .port(4000)
                    .mode(ClientMode.SYNC)
                    .build();

            // when
            client = new SocketClient(config);

            // then
            assertThat(client.config()).isEqualTo(config);
            assertThat(client.endpoint()).isEqualTo(Endpoint.of("127.0.0.1", 4000));
            assertThat(client.mode()).isEqualTo(ClientMode.SYNC);
            assertThat(client.state()).isEqualTo(ConnectionState.UNCONNECTED);
        }
    }
}
