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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * In-process peer for tests. Listens on an ephemeral loopback port and records every byte it receives.
 */
public final class StubServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StubServer.class);

    public enum Behavior {
        /** Writes every received byte straight back. */
        ECHO,
        /** Keeps the connection open and never replies. */
        SILENT,
        /** Closes each connection right after accepting it. */
        CLOSE_ON_ACCEPT
    }

    private final ServerSocket serverSocket;
    private final Behavior behavior;
    private final ByteArrayOutputStream received = new ByteArrayOutputStream();
    private final List<Socket> clients = new CopyOnWriteArrayList<>();
    private final CountDownLatch accepted = new CountDownLatch(1);
    private final Thread acceptThread;

    private StubServer(Behavior behavior) throws IOException {
        this.behavior = behavior;
        this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.acceptThread = new Thread(this::acceptLoop, "stub-server-accept");
        this.acceptThread.setDaemon(true);
    }

    public static StubServer start(Behavior behavior) throws IOException {
        StubServer server = new StubServer(behavior);
        server.acceptThread.start();
        return server;
    }

    /**
     * Returns a port on which nothing listens.
     *
     * @return a just-released ephemeral port
     * @throws IOException if no port can be probed
     */
    public static int unusedPort() throws IOException {
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return probe.getLocalPort();
        }
    }

    /**
     * Polls a condition until it holds or the timeout elapses.
     *
     * @param condition the condition to wait for
     * @param timeout the longest time to wait
     * @return whether the condition held in time
     */
    public static boolean await(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return condition.getAsBoolean();
    }

    public String host() {
        return serverSocket.getInetAddress().getHostAddress();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public boolean awaitConnection(Duration timeout) throws InterruptedException {
        return accepted.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String receivedText() {
        synchronized (received) {
            return received.toString(StandardCharsets.UTF_8);
        }
    }

    public int receivedByteCount() {
        synchronized (received) {
            return received.size();
        }
    }

    /**
     * Writes text to every connected client.
     *
     * @param text the text to push, UTF-8 encoded
     * @throws IOException if a write fails
     */
    public void push(String text) throws IOException {
        push(text.getBytes(StandardCharsets.UTF_8));
    }

    public void push(byte[] bytes) throws IOException {
        for (Socket client : clients) {
            OutputStream out = client.getOutputStream();
            out.write(bytes);
            out.flush();
        }
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!serverSocket.isClosed()) {
                    log.warn("Stub server accept failed", e);
                }
                return;
            }
            if (behavior == Behavior.CLOSE_ON_ACCEPT) {
                closeQuietly(socket);
                accepted.countDown();
                continue;
            }
            clients.add(socket);
            accepted.countDown();
            Thread reader = new Thread(() -> serve(socket), "stub-server-client");
            reader.setDaemon(true);
            reader.start();
        }
    }

    private void serve(Socket socket) {
        byte[] buffer = new byte[4096];
        try (InputStream in = socket.getInputStream()) {
            OutputStream out = socket.getOutputStream();
            int read;
            while ((read = in.read(buffer)) != -1) {
                synchronized (received) {
                    received.write(buffer, 0, read);
                }
                if (behavior == Behavior.ECHO) {
                    out.write(buffer, 0, read);
                    out.flush();
                }
            }
        } catch (SocketException e) {
            log.debug("Stub server connection ended: {}", e.getMessage());
        } catch (IOException e) {
            log.warn("Stub server connection failed", e);
        } finally {
            clients.remove(socket);
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        for (Socket client : clients) {
            closeQuietly(client);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Ignoring failure while closing stub socket", e);
        }
    }
}
