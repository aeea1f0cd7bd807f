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

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation shared by a transport and its workers.
 *
 * <p>The signal starts unset and is set at most once, by {@code close()}. Workers check
 * {@link #isSignalled()} between operations or park on {@link #await(Duration)}.
 */
public final class ExitSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Sets the signal. Calling it again has no effect.
     */
    public void signal() {
        latch.countDown();
    }

    public boolean isSignalled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits until the signal is set or the timeout elapses.
     *
     * @param timeout the longest time to wait
     * @return {@code true} if the signal is set
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
