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

import io.sockbridge.SockBridge;
import io.sockbridge.exception.SockBridgeConnectionException;
import io.sockbridge.exception.SockBridgeInvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocketClientBuilderTest {

    @Test
    void shouldUseDefaultValues() {
        // given
        SocketClientBuilder builder = SocketClient.builder();

        // when
        SocketClient client = builder.build();

        // then
        assertThat(client.endpoint()).isEqualTo(Endpoint.of("localhost", 3001));
        assertThat(client.mode()).isEqualTo(ClientMode.ASYNC);
        assertThat(client.config().getReadTimeout()).isEmpty();
        client.close();
    }

    @Test
    void shouldHaveFluentApi() {
        SocketClientBuilder builder = SockBridge.tcpClientBuilder();

        assertThat(builder.host("localhost")).isSameAs(builder);
        assertThat(builder.port(3001)).isSameAs(builder);
        assertThat(builder.sync()).isSameAs(builder);
        assertThat(builder.async()).isSameAs(builder);
        assertThat(builder.readTimeout(Duration.ofSeconds(1))).isSameAs(builder);
        assertThat(builder.connectionTimeout(Duration.ofSeconds(1))).isSameAs(builder);
        assertThat(builder.idlePollInterval(Duration.ofMillis(5))).isSameAs(builder);
        assertThat(builder.shutdownTimeout(Duration.ofSeconds(1))).isSameAs(builder);
    }

    @Test
    void shouldSelectSyncMode() {
        // when
        SocketClient client = SocketClient.builder().sync().port(3001).build();

        // then
        assertThat(client.mode()).isEqualTo(ClientMode.SYNC);
        client.close();
    }

    @Test
    void shouldThrowExceptionForEmptyHost() {
        SocketClientBuilder builder = SocketClient.builder().host("");

        assertThatThrownBy(builder::build).isInstanceOf(SockBridgeInvalidArgumentException.class);
    }

    @Test
    void shouldThrowExceptionForNullHost() {
        SocketClientBuilder builder = SocketClient.builder().host(null);

        assertThatThrownBy(builder::build).isInstanceOf(SockBridgeInvalidArgumentException.class);
    }

    @Test
    void shouldThrowExceptionForZeroPort() {
        SocketClientBuilder builder = SocketClient.builder().port(0);

        assertThatThrownBy(builder::build).isInstanceOf(SockBridgeInvalidArgumentException.class);
    }

    @Test
    void shouldThrowExceptionForNegativeTimeout() {
        SocketClientBuilder builder = SocketClient.builder().connectionTimeout(Duration.ofSeconds(-1));

        assertThatThrownBy(builder::build).isInstanceOf(SockBridgeInvalidArgumentException.class);
    }

    @Test
    void shouldThrowConnectionErrorFromBuildAndStart() throws Exception {
        // given
        int port = StubServer.unusedPort();
        SocketClientBuilder builder = SocketClient.builder().host("127.0.0.1").port(port);

        // when/then
        assertThatThrownBy(builder::buildAndStart)
                .isInstanceOf(SockBridgeConnectionException.class)
                .hasMessageContaining("127.0.0.1:" + port);
    }

    @Test
    void shouldReturnConnectedClientFromBuildAndStart() throws Exception {
        try (StubServer server = StubServer.start(StubServer.Behavior.SILENT)) {
            // when
            SocketClient client = SocketClient.builder()
                    .sync()
                    .host(server.host())
                    .port(server.port())
                    .buildAndStart();

            // then
            assertThat(client.isConnected()).isTrue();
            client.close();
        }
    }
}
