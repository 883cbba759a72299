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

package dev.mars.streamline.client;

import dev.mars.streamline.client.concurrent.CancellationToken;
import dev.mars.streamline.client.concurrent.Cancellations;
import dev.mars.streamline.client.config.StreamlineOptions;
import dev.mars.streamline.client.connection.BrokerRequest;
import dev.mars.streamline.client.connection.ConnectionManager;
import dev.mars.streamline.client.exception.StreamlineConfigurationException;
import dev.mars.streamline.client.exception.StreamlineConnectionException;
import dev.mars.streamline.client.exception.StreamlineExceptions;
import dev.mars.streamline.client.exception.StreamlineSerializationException;
import dev.mars.streamline.client.metrics.StreamlineClientMetrics;
import dev.mars.streamline.client.retry.RetryPolicy;
import dev.mars.streamline.client.retry.RetryPolicyOptions;
import dev.mars.streamline.client.spi.RecordTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default {@link StreamlineClient} backed by a {@link ConnectionManager} for the control plane
 * and a {@link RecordTransport} for the data plane.
 *
 * <p>Produce calls are retried with a client-level {@link RetryPolicy} built from
 * {@link StreamlineOptions#getProduceRetries()} and
 * {@link StreamlineOptions#getProduceRetryBackoff()}. Connection failures are not retried at
 * this level because the connection manager has already retried them.
 */
public class DefaultStreamlineClient implements StreamlineClient {

    private static final Logger logger = LoggerFactory.getLogger(DefaultStreamlineClient.class);

    static final String INFO_PATH = "/info";
    static final String METRICS_PATH = "/metrics";

    private final StreamlineOptions options;
    private final ConnectionManager connectionManager;
    private final RetryPolicy retryPolicy;
    private final RecordTransport transport;
    private final AtomicReference<Future<Void>> closeFuture = new AtomicReference<>();

    private DefaultStreamlineClient(Vertx vertx, StreamlineOptions options, RecordTransport transport,
                                    MeterRegistry meterRegistry) {
        Objects.requireNonNull(vertx, "vertx must not be null");
        Objects.requireNonNull(options, "options must not be null");
        this.transport = transport;

        StreamlineClientMetrics metrics = null;
        StreamlineOptions effectiveOptions = options;
        if (meterRegistry != null) {
            metrics = new StreamlineClientMetrics(UUID.randomUUID().toString());
            metrics.bindTo(meterRegistry);
            effectiveOptions = options.toBuilder()
                .connectionRetry(options.getConnectionRetry().toBuilder().listener(metrics).build())
                .build();
        }
        this.options = effectiveOptions;

        this.retryPolicy = new RetryPolicy(vertx, produceRetryOptions(options, metrics));
        this.connectionManager = new ConnectionManager(vertx, effectiveOptions);
        if (metrics != null) {
            connectionManager.addStateListener(metrics);
        }

        logger.info("Streamline client initialized with bootstrap servers: {}", options.getBootstrapServers());
    }

    /**
     * Creates a client without a data plane transport. Produce calls fail with
     * {@link StreamlineConfigurationException}.
     *
     * @param vertx the Vert.x instance
     * @param options the client options
     * @return a new client instance
     */
    public static StreamlineClient create(Vertx vertx, StreamlineOptions options) {
        return new DefaultStreamlineClient(vertx, options, null, null);
    }

    /**
     * Creates a client.
     *
     * @param vertx the Vert.x instance
     * @param options the client options
     * @param transport the data plane transport used by produce
     * @return a new client instance
     */
    public static StreamlineClient create(Vertx vertx, StreamlineOptions options, RecordTransport transport) {
        return new DefaultStreamlineClient(vertx, options, transport, null);
    }

    /**
     * Creates a client that reports connection and retry metrics to the given registry.
     *
     * @param vertx the Vert.x instance
     * @param options the client options
     * @param transport the data plane transport used by produce, or null
     * @param meterRegistry the registry to bind client metrics to
     * @return a new client instance
     */
    public static StreamlineClient create(Vertx vertx, StreamlineOptions options, RecordTransport transport,
                                          MeterRegistry meterRegistry) {
        Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        return new DefaultStreamlineClient(vertx, options, transport, meterRegistry);
    }

    // ========================================================================
    // Connection
    // ========================================================================

    @Override
    public Future<Void> connect() {
        return connect(CancellationToken.NONE);
    }

    @Override
    public Future<Void> connect(CancellationToken token) {
        if (isClosed()) {
            return closedFailure();
        }
        return connectionManager.connect(token);
    }

    @Override
    public Future<Boolean> isHealthy() {
        return isHealthy(CancellationToken.NONE);
    }

    @Override
    public Future<Boolean> isHealthy(CancellationToken token) {
        if (isClosed()) {
            return Future.succeededFuture(false);
        }
        return connectionManager.checkHealth(token);
    }

    // ========================================================================
    // Produce
    // ========================================================================

    @Override
    public Future<RecordMetadata> produce(String topic, String key, String value) {
        return produce(topic, key, value, null, CancellationToken.NONE);
    }

    @Override
    public Future<RecordMetadata> produce(String topic, String key, String value, Headers headers) {
        return produce(topic, key, value, headers, CancellationToken.NONE);
    }

    @Override
    public Future<RecordMetadata> produce(String topic, String key, String value, Headers headers,
                                          CancellationToken token) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (isClosed()) {
            return closedFailure();
        }
        if (transport == null) {
            return Future.failedFuture(new StreamlineConfigurationException(
                "No record transport configured; create the client with a RecordTransport to produce"));
        }

        OutgoingRecord record = new OutgoingRecord(
            topic,
            key != null ? key.getBytes(StandardCharsets.UTF_8) : null,
            value.getBytes(StandardCharsets.UTF_8),
            headers);

        return retryPolicy.execute(() -> {
            logger.debug("Producing record to topic {}", topic);
            return Cancellations.withCancellation(transport.send(record), token);
        }, token);
    }

    // ========================================================================
    // Server information
    // ========================================================================

    @Override
    public Future<JsonObject> serverInfo() {
        return serverInfo(CancellationToken.NONE);
    }

    @Override
    public Future<JsonObject> serverInfo(CancellationToken token) {
        if (isClosed()) {
            return closedFailure();
        }
        return connectionManager.send(BrokerRequest.get(INFO_PATH), token)
            .compose(response -> checkStatus(response, INFO_PATH))
            .map(this::parseJson);
    }

    @Override
    public Future<String> serverMetrics() {
        return serverMetrics(CancellationToken.NONE);
    }

    @Override
    public Future<String> serverMetrics(CancellationToken token) {
        if (isClosed()) {
            return closedFailure();
        }
        return connectionManager.send(BrokerRequest.get(METRICS_PATH), token)
            .compose(response -> checkStatus(response, METRICS_PATH))
            .map(response -> {
                String body = response.bodyAsString();
                return body != null ? body : "";
            });
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    /** Returns the effective options of this client */
    public StreamlineOptions getOptions() {
        return options;
    }

    @Override
    public Future<Void> close() {
        Future<Void> existing = closeFuture.get();
        if (existing != null) {
            return existing;
        }
        Future<Void> closing = connectionManager.close()
            .onSuccess(v -> logger.info("Streamline client closed"));
        if (!closeFuture.compareAndSet(null, closing)) {
            return closeFuture.get();
        }
        return closing;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean isClosed() {
        return closeFuture.get() != null;
    }

    private static <T> Future<T> closedFailure() {
        return Future.failedFuture(new IllegalStateException("Streamline client is closed"));
    }

    private static Future<HttpResponse<Buffer>> checkStatus(HttpResponse<Buffer> response, String path) {
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            return Future.succeededFuture(response);
        }
        return Future.failedFuture(StreamlineExceptions.fromStatus(statusCode, path, response.bodyAsString()));
    }

    private JsonObject parseJson(HttpResponse<Buffer> response) {
        JsonObject json;
        try {
            json = response.bodyAsJsonObject();
        } catch (DecodeException e) {
            throw new StreamlineSerializationException("Failed to parse response from " + INFO_PATH, e);
        }
        if (json == null) {
            throw new StreamlineSerializationException("Empty response from " + INFO_PATH);
        }
        return json;
    }

    private static RetryPolicyOptions produceRetryOptions(StreamlineOptions options, StreamlineClientMetrics metrics) {
        Duration backoff = options.getProduceRetryBackoff();
        Duration maxDelay = backoff.compareTo(RetryPolicyOptions.DEFAULT_MAX_DELAY) > 0
            ? backoff
            : RetryPolicyOptions.DEFAULT_MAX_DELAY;
        return RetryPolicyOptions.builder()
            .name("produce")
            .maxRetries(options.getProduceRetries())
            .baseDelay(backoff)
            .maxDelay(maxDelay)
            .retryable(error -> !(error instanceof StreamlineConnectionException)
                && RetryPolicy.isRetryableByDefault(error))
            .listener(metrics)
            .build();
    }
}
