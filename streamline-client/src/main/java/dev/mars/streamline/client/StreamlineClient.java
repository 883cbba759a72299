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
import dev.mars.streamline.client.connection.ConnectionManager;
import dev.mars.streamline.client.retry.RetryPolicy;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Main interface of the Streamline client.
 *
 * <p>All operations are non-blocking and return a Vert.x {@link Future}. Once {@link #close()}
 * has been called, operations fail with {@link IllegalStateException} and
 * {@link #isHealthy()} reports false.
 *
 * <p>Example usage:
 * <pre>{@code
 * StreamlineClient client = DefaultStreamlineClient.create(vertx, StreamlineOptions.load(), transport);
 *
 * client.connect()
 *     .compose(v -> client.produce("orders", "order-42", "{\"total\": 12.5}"))
 *     .onSuccess(meta -> logger.info("Stored at {}-{}@{}", meta.topic(), meta.partition(), meta.offset()))
 *     .onFailure(err -> logger.error("Produce failed", err));
 * }</pre>
 *
 * @see DefaultStreamlineClient
 */
public interface StreamlineClient {

    // ========================================================================
    // Connection
    // ========================================================================

    /**
     * Connects to the control plane and starts background health checks.
     *
     * @return future completed once connected
     */
    Future<Void> connect();

    /**
     * Connects to the control plane and starts background health checks.
     *
     * @param token cancels the connect sequence
     * @return future completed once connected
     */
    Future<Void> connect(CancellationToken token);

    /**
     * Probes the server health. Reports false after {@link #close()}.
     *
     * @return future containing true if the server is healthy
     */
    Future<Boolean> isHealthy();

    /**
     * Probes the server health. Reports false after {@link #close()}.
     *
     * @param token cancels the probe
     * @return future containing true if the server is healthy
     */
    Future<Boolean> isHealthy(CancellationToken token);

    // ========================================================================
    // Produce
    // ========================================================================

    /**
     * Produces a record with a UTF-8 key and value.
     *
     * @param topic the topic
     * @param key the key, or null
     * @param value the value
     * @return future containing the metadata of the stored record
     */
    Future<RecordMetadata> produce(String topic, String key, String value);

    /**
     * Produces a record with a UTF-8 key, value and headers.
     *
     * @param topic the topic
     * @param key the key, or null
     * @param value the value
     * @param headers the headers, or null
     * @return future containing the metadata of the stored record
     */
    Future<RecordMetadata> produce(String topic, String key, String value, Headers headers);

    /**
     * Produces a record with a UTF-8 key, value and headers.
     *
     * @param topic the topic
     * @param key the key, or null
     * @param value the value
     * @param headers the headers, or null
     * @param token cancels the produce and pending retries
     * @return future containing the metadata of the stored record
     */
    Future<RecordMetadata> produce(String topic, String key, String value, Headers headers,
                                   CancellationToken token);

    // ========================================================================
    // Server information
    // ========================================================================

    /**
     * Fetches the server description from {@code /info}.
     *
     * @return future containing the server information
     */
    Future<JsonObject> serverInfo();

    /**
     * Fetches the server description from {@code /info}.
     *
     * @param token cancels the request
     * @return future containing the server information
     */
    Future<JsonObject> serverInfo(CancellationToken token);

    /**
     * Fetches the server metrics text from {@code /metrics}.
     *
     * @return future containing the metrics exposition
     */
    Future<String> serverMetrics();

    /**
     * Fetches the server metrics text from {@code /metrics}.
     *
     * @param token cancels the request
     * @return future containing the metrics exposition
     */
    Future<String> serverMetrics(CancellationToken token);

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /** Returns the retry policy applied to produce */
    RetryPolicy getRetryPolicy();

    /** Returns the connection manager of this client */
    ConnectionManager getConnectionManager();

    /**
     * Closes the client and its connection manager. Idempotent.
     *
     * @return future completed once resources are released
     */
    Future<Void> close();
}
