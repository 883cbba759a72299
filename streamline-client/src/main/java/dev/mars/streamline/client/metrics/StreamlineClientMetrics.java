/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.streamline.client.metrics;

import dev.mars.streamline.client.connection.ConnectionState;
import dev.mars.streamline.client.connection.ConnectionStateListener;
import dev.mars.streamline.client.retry.RetryListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the Streamline client.
 *
 * <p>Registered as a {@link RetryListener} on the client's retry policies and as a
 * {@link ConnectionStateListener} on its connection manager. Events received before
 * {@link #bindTo(MeterRegistry)} only update the state gauge.
 *
 * <ul>
 *   <li>{@code streamline.connection.state}: ordinal of the current {@link ConnectionState}</li>
 *   <li>{@code streamline.connection.transitions}: state changes, tagged {@code state}</li>
 *   <li>{@code streamline.retry.attempts}: retried failures, tagged {@code policy}</li>
 *   <li>{@code streamline.retry.exhausted}: operations that used up their retries, tagged {@code policy}</li>
 * </ul>
 */
public class StreamlineClientMetrics implements MeterBinder, RetryListener, ConnectionStateListener {

    private static final Logger logger = LoggerFactory.getLogger(StreamlineClientMetrics.class);

    private final String clientId;
    private final AtomicInteger connectionState = new AtomicInteger(ConnectionState.DISCONNECTED.ordinal());
    private volatile MeterRegistry registry;

    public StreamlineClientMetrics(String clientId) {
        this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("streamline.connection.state", connectionState, AtomicInteger::get)
            .description("Current connection state (0=DISCONNECTED, 1=CONNECTED, 2=RECONNECTING)")
            .tag("client", clientId)
            .register(registry);
        this.registry = registry;
        logger.debug("Streamline client metrics bound for client {}", clientId);
    }

    @Override
    public void onStateChanged(ConnectionState newState) {
        connectionState.set(newState.ordinal());
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder("streamline.connection.transitions")
                .description("Number of connection state changes")
                .tag("client", clientId)
                .tag("state", newState.name())
                .register(current)
                .increment();
        }
    }

    @Override
    public void onRetry(String policyName, int attempt, Duration delay, Throwable error) {
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder("streamline.retry.attempts")
                .description("Number of failed attempts that were retried")
                .tag("client", clientId)
                .tag("policy", policyName)
                .register(current)
                .increment();
        }
    }

    @Override
    public void onGiveUp(String policyName, int attempts, Throwable error) {
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder("streamline.retry.exhausted")
                .description("Number of operations that failed after their final attempt")
                .tag("client", clientId)
                .tag("policy", policyName)
                .register(current)
                .increment();
        }
    }

    /** Returns the ordinal of the last observed connection state */
    public int getConnectionStateValue() {
        return connectionState.get();
    }
}
