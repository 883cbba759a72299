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

import dev.mars.streamline.client.concurrent.CancellationSource;
import dev.mars.streamline.client.config.StreamlineOptions;
import dev.mars.streamline.client.exception.StreamlineAuthenticationException;
import dev.mars.streamline.client.exception.StreamlineConfigurationException;
import dev.mars.streamline.client.exception.StreamlineConnectionException;
import dev.mars.streamline.client.exception.StreamlineErrorCode;
import dev.mars.streamline.client.exception.StreamlineException;
import dev.mars.streamline.client.exception.StreamlineProducerException;
import dev.mars.streamline.client.exception.StreamlineSerializationException;
import dev.mars.streamline.client.exception.StreamlineTopicNotFoundException;
import dev.mars.streamline.client.retry.RetryPolicyOptions;
import dev.mars.streamline.client.spi.RecordTransport;
import dev.mars.streamline.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultStreamlineClient} against a mock control plane and a fake transport.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class DefaultStreamlineClientTest {

    private final AtomicInteger infoStatus = new AtomicInteger(200);
    private final AtomicInteger infoHits = new AtomicInteger();
    private final List<StreamlineClient> clients = new ArrayList<>();

    private Vertx vertx;
    private HttpServer mockServer;
    private int port;

    @BeforeEach
    void startMockServer(Vertx vertx) throws Exception {
        this.vertx = vertx;
        Router router = Router.router(vertx);
        router.get("/health").handler(ctx -> ctx.response().setStatusCode(200).end());
        router.get("/info").handler(ctx -> {
            infoHits.incrementAndGet();
            int status = infoStatus.get();
            if (status == 200) {
                ctx.response()
                    .putHeader("content-type", "application/json")
                    .end(new JsonObject().put("version", "0.2.0").put("brokerId", 1).encode());
            } else {
                ctx.response().setStatusCode(status).end("denied");
            }
        });
        router.get("/metrics").handler(ctx -> ctx.response()
            .putHeader("content-type", "text/plain")
            .end("streamline_messages_total 42\n"));

        mockServer = awaitResult(vertx.createHttpServer().requestHandler(router).listen(0));
        port = mockServer.actualPort();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (StreamlineClient client : clients) {
            awaitResult(client.close());
        }
        awaitResult(mockServer.close());
    }

    private StreamlineOptions.Builder options() {
        return StreamlineOptions.builder()
            .bootstrapServers("127.0.0.1:9092")
            .controlPort(port)
            .produceRetries(2)
            .produceRetryBackoff(Duration.ofMillis(1))
            .connectionRetry(RetryPolicyOptions.builder()
                .name("connection")
                .maxRetries(1)
                .baseDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .build());
    }

    private StreamlineClient newClient(RecordTransport transport) {
        StreamlineClient client = DefaultStreamlineClient.create(vertx, options().build(), transport);
        clients.add(client);
        return client;
    }

    private static <T> T awaitResult(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static Throwable awaitFailure(Future<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> awaitResult(future));
        return e.getCause();
    }

    private static RecordMetadata metadata(OutgoingRecord record) {
        return new RecordMetadata(record.topic(), 0, 7L, Instant.parse("2025-01-01T00:00:00Z"));
    }

    // ========================================================================
    // Produce
    // ========================================================================

    @Test
    @DisplayName("Produce encodes the record and returns transport metadata")
    void produceDelegatesToTransport() throws Exception {
        List<OutgoingRecord> sent = new CopyOnWriteArrayList<>();
        StreamlineClient client = newClient(record -> {
            sent.add(record);
            return Future.succeededFuture(metadata(record));
        });

        RecordMetadata meta = awaitResult(client.produce("orders", "order-42", "{\"total\":12.5}",
            new Headers().add("source", "test")));

        assertEquals("orders", meta.topic());
        assertEquals(7L, meta.offset());
        assertEquals(1, sent.size());
        OutgoingRecord record = sent.get(0);
        assertEquals("order-42", new String(record.key(), StandardCharsets.UTF_8));
        assertEquals("{\"total\":12.5}", new String(record.value(), StandardCharsets.UTF_8));
        assertEquals("test", record.headers().getString("source"));
    }

    @Test
    @DisplayName("Null key and headers are allowed")
    void produceWithoutKey() throws Exception {
        List<OutgoingRecord> sent = new CopyOnWriteArrayList<>();
        StreamlineClient client = newClient(record -> {
            sent.add(record);
            return Future.succeededFuture(metadata(record));
        });

        awaitResult(client.produce("orders", null, "value"));

        assertNull(sent.get(0).key());
        assertTrue(sent.get(0).headers().isEmpty());
    }

    @Test
    @DisplayName("Retryable transport failures are retried")
    void produceRetriesTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        StreamlineClient client = newClient(record -> {
            if (calls.incrementAndGet() < 3) {
                return Future.failedFuture(new StreamlineProducerException("leader not available"));
            }
            return Future.succeededFuture(metadata(record));
        });

        awaitResult(client.produce("orders", "k", "v"));

        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Non-retryable and connection failures are surfaced after one attempt")
    void produceDoesNotRetryPermanentFailures() {
        AtomicInteger calls = new AtomicInteger();
        StreamlineClient topicMissing = newClient(record -> {
            calls.incrementAndGet();
            return Future.failedFuture(new StreamlineTopicNotFoundException(record.topic()));
        });
        Throwable error = awaitFailure(topicMissing.produce("missing", "k", "v"));
        assertInstanceOf(StreamlineTopicNotFoundException.class, error);
        assertEquals(1, calls.get());

        calls.set(0);
        StreamlineClient unreachable = newClient(record -> {
            calls.incrementAndGet();
            return Future.failedFuture(new StreamlineConnectionException("already retried below"));
        });
        error = awaitFailure(unreachable.produce("orders", "k", "v"));
        assertInstanceOf(StreamlineConnectionException.class, error);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Produce without a transport is a configuration error")
    void produceWithoutTransport() {
        StreamlineClient client = DefaultStreamlineClient.create(vertx, options().build());
        clients.add(client);

        Throwable error = awaitFailure(client.produce("orders", "k", "v"));

        assertInstanceOf(StreamlineConfigurationException.class, error);
    }

    @Test
    @DisplayName("Invalid produce arguments are rejected")
    void produceArgumentValidation() {
        StreamlineClient client = newClient(record -> Future.succeededFuture(metadata(record)));

        assertThrows(NullPointerException.class, () -> client.produce(null, "k", "v"));
        assertThrows(NullPointerException.class, () -> client.produce("orders", "k", null));
        assertThrows(IllegalArgumentException.class, () -> client.produce(" ", "k", "v"));
    }

    @Test
    @DisplayName("Cancelled produce fails with CancellationException")
    void produceCancelled() {
        AtomicInteger calls = new AtomicInteger();
        StreamlineClient client = newClient(record -> {
            calls.incrementAndGet();
            return Future.succeededFuture(metadata(record));
        });
        CancellationSource source = new CancellationSource();
        source.cancel();

        Throwable error = awaitFailure(client.produce("orders", "k", "v", null, source.token()));

        assertInstanceOf(CancellationException.class, error);
        assertEquals(0, calls.get());
    }

    // ========================================================================
    // Server information
    // ========================================================================

    @Test
    @DisplayName("serverInfo returns the decoded JSON")
    void serverInfo() throws Exception {
        StreamlineClient client = newClient(null);
        awaitResult(client.connect());

        JsonObject info = awaitResult(client.serverInfo());

        assertEquals("0.2.0", info.getString("version"));
        assertEquals(1, info.getInteger("brokerId"));
    }

    @Test
    @DisplayName("serverInfo maps error statuses onto the exception taxonomy")
    void serverInfoErrorStatus() throws Exception {
        infoStatus.set(401);
        StreamlineClient client = newClient(null);
        awaitResult(client.connect());

        Throwable error = awaitFailure(client.serverInfo());

        assertInstanceOf(StreamlineAuthenticationException.class, error);
        assertTrue(error.getMessage().contains("HTTP 401 from /info"));
        assertEquals(1, infoHits.get());
    }

    @Test
    @DisplayName("serverInfo with an unknown error status is not retryable")
    void serverInfoServerError() throws Exception {
        infoStatus.set(500);
        StreamlineClient client = newClient(null);
        awaitResult(client.connect());

        Throwable error = awaitFailure(client.serverInfo());

        assertEquals(StreamlineErrorCode.UNKNOWN, ((StreamlineException) error).getErrorCode());
        assertFalse(((StreamlineException) error).isRetryable());
    }

    @Test
    @DisplayName("serverMetrics returns the exposition text")
    void serverMetrics() throws Exception {
        StreamlineClient client = newClient(null);
        awaitResult(client.connect());

        String metrics = awaitResult(client.serverMetrics());

        assertTrue(metrics.contains("streamline_messages_total 42"));
    }

    @Test
    @DisplayName("serverInfo before connect fails with a connection error")
    void serverInfoBeforeConnect() {
        StreamlineClient client = newClient(null);

        Throwable error = awaitFailure(client.serverInfo());

        assertInstanceOf(StreamlineConnectionException.class, error);
        assertEquals(0, infoHits.get());
    }

    @Test
    @DisplayName("Undecodable info bodies surface as serialization errors")
    void serverInfoInvalidJson() throws Exception {
        Router router = Router.router(vertx);
        router.get("/health").handler(ctx -> ctx.response().end());
        router.get("/info").handler(ctx -> ctx.response().end("not json"));
        HttpServer brokenServer = awaitResult(vertx.createHttpServer().requestHandler(router).listen(0));
        try {
            StreamlineClient client = DefaultStreamlineClient.create(vertx,
                options().controlPort(brokenServer.actualPort()).build());
            clients.add(client);
            awaitResult(client.connect());

            Throwable error = awaitFailure(client.serverInfo());

            assertInstanceOf(StreamlineSerializationException.class, error);
        } finally {
            awaitResult(brokenServer.close());
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Test
    @DisplayName("isHealthy reflects the server and reports false after close")
    void isHealthy() throws Exception {
        StreamlineClient client = newClient(null);

        assertTrue(awaitResult(client.isHealthy()));
        awaitResult(client.close());
        assertFalse(awaitResult(client.isHealthy()));
    }

    @Test
    @DisplayName("Operations on a closed client fail with IllegalStateException")
    void closedClient() throws Exception {
        StreamlineClient client = newClient(record -> Future.succeededFuture(metadata(record)));

        Future<Void> first = client.close();
        assertSame(first, client.close());
        awaitResult(first);

        assertInstanceOf(IllegalStateException.class, awaitFailure(client.connect()));
        assertInstanceOf(IllegalStateException.class, awaitFailure(client.produce("orders", "k", "v")));
        assertInstanceOf(IllegalStateException.class, awaitFailure(client.serverInfo()));
        assertInstanceOf(IllegalStateException.class, awaitFailure(client.serverMetrics()));
    }

    @Test
    @DisplayName("Produce policy is built from the produce options")
    void producePolicyOptions() {
        StreamlineClient client = newClient(null);

        RetryPolicyOptions policyOptions = client.getRetryPolicy().getOptions();
        assertEquals("produce", policyOptions.getName());
        assertEquals(2, policyOptions.getMaxRetries());
        assertEquals(Duration.ofMillis(1), policyOptions.getBaseDelay());
        assertNotNull(client.getConnectionManager());
    }

    @Test
    @DisplayName("Metrics registry receives connection and retry meters")
    void metricsWiring() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AtomicInteger calls = new AtomicInteger();
        StreamlineClient client = DefaultStreamlineClient.create(vertx, options().build(), record -> {
            if (calls.incrementAndGet() == 1) {
                return Future.failedFuture(new StreamlineProducerException("retry me"));
            }
            return Future.succeededFuture(metadata(record));
        }, registry);
        clients.add(client);

        awaitResult(client.connect());
        awaitResult(client.produce("orders", "k", "v"));

        assertEquals(1.0, registry.get("streamline.connection.state").gauge().value());
        assertEquals(1.0, registry.get("streamline.connection.transitions").tag("state", "CONNECTED").counter().count());
        assertEquals(1.0, registry.get("streamline.retry.attempts").tag("policy", "produce").counter().count());
    }

    @Test
    @DisplayName("Non-retryable produce failures are not counted as exhausted retries")
    void metricsIgnoreNonRetryableFailures() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StreamlineClient client = DefaultStreamlineClient.create(vertx, options().build(),
            record -> Future.failedFuture(new StreamlineTopicNotFoundException(record.topic())), registry);
        clients.add(client);

        awaitFailure(client.produce("missing", "k", "v"));

        assertNull(registry.find("streamline.retry.exhausted").counter());
        assertNull(registry.find("streamline.retry.attempts").counter());
    }

    @Test
    @DisplayName("Produce failures that use up the retry budget are counted as exhausted")
    void metricsCountExhaustedRetries() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StreamlineClient client = DefaultStreamlineClient.create(vertx, options().build(),
            record -> Future.failedFuture(new StreamlineProducerException("leader not available")), registry);
        clients.add(client);

        awaitFailure(client.produce("orders", "k", "v"));

        assertEquals(2.0, registry.get("streamline.retry.attempts").tag("policy", "produce").counter().count());
        assertEquals(1.0, registry.get("streamline.retry.exhausted").tag("policy", "produce").counter().count());
    }
}
