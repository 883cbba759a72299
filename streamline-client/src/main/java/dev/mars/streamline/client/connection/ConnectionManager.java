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

package dev.mars.streamline.client.connection;

import dev.mars.streamline.client.concurrent.CancellationSource;
import dev.mars.streamline.client.concurrent.CancellationToken;
import dev.mars.streamline.client.concurrent.Cancellations;
import dev.mars.streamline.client.concurrent.Registration;
import dev.mars.streamline.client.config.StreamlineOptions;
import dev.mars.streamline.client.exception.StreamlineConnectionException;
import dev.mars.streamline.client.retry.RetryPolicy;
import dev.mars.streamline.client.retry.TransportErrors;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.PoolOptions;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manages the HTTP connection to the Streamline control plane.
 *
 * <p>The manager tracks a {@link ConnectionState}, probes the health endpoint, and after the
 * first successful {@link #connect()} runs a background loop that re-probes every
 * {@link #getHealthCheckInterval()} and reconnects when the server becomes unreachable.
 * Requests issued through {@link #send(BrokerRequest)} are retried with the manager's
 * {@link RetryPolicy}.
 *
 * <p>The {@link WebClient} is either created by the manager, in which case {@link #close()}
 * closes it, or supplied by the caller and left open.
 *
 * <p>Example usage:
 * <pre>{@code
 * ConnectionManager manager = new ConnectionManager(vertx, StreamlineOptions.load());
 * manager.addStateListener(state -> logger.info("Now {}", state));
 *
 * manager.connect()
 *     .compose(v -> manager.send(BrokerRequest.get("/info")))
 *     .onSuccess(response -> logger.info("Server: {}", response.bodyAsString()))
 *     .onComplete(ar -> manager.close());
 * }</pre>
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private static final Duration MIN_HEALTH_CHECK_INTERVAL = Duration.ofMillis(1);

    private final Vertx vertx;
    private final StreamlineOptions options;
    private final ControlEndpoint controlEndpoint;
    private final WebClient webClient;
    private final HttpClient httpClient;
    private final boolean ownsWebClient;
    private final RetryPolicy retryPolicy;

    private final Object stateLock = new Object();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final CancellationSource shutdown = new CancellationSource();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final Promise<Void> loopCompletion = Promise.promise();
    private final AtomicReference<Future<Void>> closeFuture = new AtomicReference<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Duration healthCheckInterval;

    /**
     * Creates a connection manager that owns its {@link WebClient}. The client is configured
     * from the options (pool size, connect timeout, control endpoint) and closed by
     * {@link #close()}.
     *
     * @param vertx the Vert.x instance
     * @param options the client options
     */
    public ConnectionManager(Vertx vertx, StreamlineOptions options) {
        this(vertx, options, createHttpClient(vertx, options));
    }

    /**
     * Creates a connection manager over a caller-supplied {@link WebClient}. The client is not
     * closed by {@link #close()}.
     *
     * @param vertx the Vert.x instance
     * @param options the client options
     * @param webClient the web client to send requests with
     */
    public ConnectionManager(Vertx vertx, StreamlineOptions options, WebClient webClient) {
        this(vertx, options, webClient, null, false);
    }

    private ConnectionManager(Vertx vertx, StreamlineOptions options, HttpClient httpClient) {
        this(vertx, options, WebClient.wrap(httpClient, new WebClientOptions(httpClientOptions(options))),
            httpClient, true);
    }

    private ConnectionManager(Vertx vertx, StreamlineOptions options, WebClient webClient,
                              HttpClient httpClient, boolean ownsWebClient) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.httpClient = httpClient;
        this.ownsWebClient = ownsWebClient;
        this.controlEndpoint = ControlEndpoint.fromBootstrapServers(
            options.getBootstrapServers(), options.getControlPort());
        this.retryPolicy = new RetryPolicy(vertx, options.getConnectionRetry());
        this.healthCheckInterval = options.getHealthCheckInterval();

        logger.info("Connection manager created for {} (poolSize: {}, ownsWebClient: {})",
            controlEndpoint, options.getConnectionPoolSize(), ownsWebClient);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    /** Returns the current connection state */
    public ConnectionState getState() {
        return state;
    }

    /** Returns the control plane endpoint derived from the bootstrap servers */
    public ControlEndpoint getControlEndpoint() {
        return controlEndpoint;
    }

    /** Returns the interval between background health probes */
    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    /**
     * Sets the interval between background health probes. Takes effect from the next probe.
     *
     * @param interval the interval, at least one millisecond
     */
    public void setHealthCheckInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.compareTo(MIN_HEALTH_CHECK_INTERVAL) < 0) {
            throw new IllegalArgumentException("Health check interval must be at least 1ms, was " + interval);
        }
        this.healthCheckInterval = interval;
    }

    /** Returns true if {@link #close()} releases the web client */
    public boolean ownsWebClient() {
        return ownsWebClient;
    }

    /** Returns the web client requests are sent with */
    WebClient webClient() {
        return webClient;
    }

    /** Returns true while the background health check loop is active */
    public boolean isHealthCheckLoopRunning() {
        return loopStarted.get() && !loopCompletion.future().isComplete();
    }

    /** Returns the retry policy applied to connect and send */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener
     * @return a handle that removes the listener when closed
     */
    public Registration addStateListener(ConnectionStateListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ========================================================================
    // Operations
    // ========================================================================

    /**
     * Connects without cancellation.
     *
     * @see #connect(CancellationToken)
     */
    public Future<Void> connect() {
        return connect(CancellationToken.NONE);
    }

    /**
     * Establishes the connection and starts the background health check loop.
     *
     * <p>Does nothing if the manager is already connected. Otherwise probes the health endpoint,
     * retrying with the manager's retry policy until a probe succeeds.
     *
     * <p>The connect sequence is also cancelled by {@link #close()}.
     *
     * @param token cancels the connect sequence
     * @return a future completed once connected. Fails with {@link StreamlineConnectionException}
     *         when every probe failed or the manager is closed, and with
     *         {@link CancellationException} when cancelled or closed mid-sequence.
     */
    public Future<Void> connect(CancellationToken token) {
        Objects.requireNonNull(token, "token must not be null");
        if (closeFuture.get() != null) {
            return Future.failedFuture(new StreamlineConnectionException("Connection manager is closed"));
        }
        if (state == ConnectionState.CONNECTED) {
            startHealthCheckLoop();
            return Future.succeededFuture();
        }
        CancellationSource connectScope = new CancellationSource();
        Registration callerLink = token.register(connectScope::cancel);
        Registration shutdownLink = shutdown.token().register(connectScope::cancel);
        return establish(connectScope.token())
            .onComplete(ar -> {
                callerLink.close();
                shutdownLink.close();
                connectScope.close();
            })
            .onSuccess(v -> startHealthCheckLoop());
    }

    /**
     * Sends a request without cancellation.
     *
     * @see #send(BrokerRequest, CancellationToken)
     */
    public Future<HttpResponse<Buffer>> send(BrokerRequest request) {
        return send(request, CancellationToken.NONE);
    }

    /**
     * Sends a request to the control plane with retries.
     *
     * <p>Fails fast with a non-retryable {@link StreamlineConnectionException} while the manager
     * is {@link ConnectionState#DISCONNECTED}, without touching the transport. A connectivity failure moves the manager to
     * {@link ConnectionState#RECONNECTING} and is re-raised as a
     * {@link StreamlineConnectionException}. Other failures pass through unchanged. Non-2xx
     * responses are returned, not failed.
     *
     * @param request the request
     * @param token cancels the request and pending retries
     * @return the response
     */
    public Future<HttpResponse<Buffer>> send(BrokerRequest request, CancellationToken token) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (closeFuture.get() != null) {
            return Future.failedFuture(new IllegalStateException("Connection manager is closed"));
        }
        return retryPolicy.execute(() -> sendOnce(request, token), token);
    }

    /**
     * Checks health without cancellation.
     *
     * @see #checkHealth(CancellationToken)
     */
    public Future<Boolean> checkHealth() {
        return checkHealth(CancellationToken.NONE);
    }

    /**
     * Probes the health endpoint once and updates the state: {@link ConnectionState#CONNECTED}
     * on a 2xx response, {@link ConnectionState#DISCONNECTED} otherwise.
     *
     * @param token cancels the probe
     * @return true if the server is healthy. Only fails with {@link CancellationException}.
     */
    public Future<Boolean> checkHealth(CancellationToken token) {
        Objects.requireNonNull(token, "token must not be null");
        if (token.isCancellationRequested()) {
            return Future.failedFuture(new CancellationException("Health check cancelled"));
        }

        Future<HttpResponse<Buffer>> probe;
        try {
            probe = newRequest(HttpMethod.GET, options.getHealthPath()).send();
        } catch (RuntimeException e) {
            probe = Future.failedFuture(e);
        }

        return Cancellations.withCancellation(probe, token)
            .map(response -> {
                int statusCode = response.statusCode();
                boolean healthy = statusCode >= 200 && statusCode < 300;
                if (!healthy) {
                    logger.warn("Health check against {} returned HTTP {}", controlEndpoint, statusCode);
                }
                transitionState(healthy ? ConnectionState.CONNECTED : ConnectionState.DISCONNECTED);
                return healthy;
            })
            .recover(error -> {
                if (error instanceof CancellationException) {
                    return Future.failedFuture(error);
                }
                logger.warn("Health check against {} failed: {}", controlEndpoint, error.getMessage());
                logger.debug("Health check failure detail", error);
                transitionState(ConnectionState.DISCONNECTED);
                return Future.succeededFuture(false);
            });
    }

    /**
     * Stops the health check loop and releases owned resources.
     *
     * <p>Idempotent: later calls return the future of the first call. A borrowed web client is
     * left open.
     *
     * @return a future completed once the loop has stopped and the owned client is closed
     */
    public Future<Void> close() {
        Promise<Void> promise = Promise.promise();
        if (!closeFuture.compareAndSet(null, promise.future())) {
            return closeFuture.get();
        }

        shutdown.cancel();
        Future<Void> loopDone = loopStarted.get() ? loopCompletion.future() : Future.succeededFuture();

        loopDone
            .compose(v -> ownsWebClient ? closeTransport() : Future.<Void>succeededFuture())
            .onComplete(ar -> {
                shutdown.close();
                if (ar.failed()) {
                    logger.warn("Failed to close HTTP client for {}: {}", controlEndpoint, ar.cause().getMessage());
                } else {
                    logger.info("Connection manager closed");
                }
                promise.handle(ar);
            });
        return promise.future();
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private Future<HttpResponse<Buffer>> sendOnce(BrokerRequest request, CancellationToken token) {
        if (state == ConnectionState.DISCONNECTED) {
            return Future.failedFuture(new StreamlineConnectionException(
                "Not connected to Streamline server. Call connect() first.", false));
        }

        Future<HttpResponse<Buffer>> response;
        try {
            HttpRequest<Buffer> httpRequest = newRequest(request.method(), request.path());
            request.headers().forEach(httpRequest::putHeader);
            response = request.body() != null ? httpRequest.sendBuffer(request.body()) : httpRequest.send();
        } catch (RuntimeException e) {
            response = Future.failedFuture(e);
        }
        logger.debug("Sent {} {} to {}", request.method(), request.path(), controlEndpoint);

        return Cancellations.withCancellation(response, token)
            .recover(error -> {
                if (TransportErrors.isConnectivityError(error)) {
                    transitionState(ConnectionState.RECONNECTING);
                    return Future.failedFuture(new StreamlineConnectionException(
                        "Request failed: " + error.getMessage(), error));
                }
                return Future.failedFuture(error);
            });
    }

    private HttpRequest<Buffer> newRequest(HttpMethod method, String path) {
        return webClient.request(method, controlEndpoint.port(), controlEndpoint.host(), path)
            .timeout(options.getRequestTimeout().toMillis());
    }

    private Future<Void> establish(CancellationToken token) {
        return checkHealth(token).compose(healthy -> {
            if (healthy) {
                return Future.succeededFuture();
            }
            return retryPolicy.executeVoid(() -> checkHealth(token).compose(ok -> ok
                ? Future.<Void>succeededFuture()
                : Future.<Void>failedFuture(new StreamlineConnectionException("Health check failed during connect"))),
                token);
        });
    }

    private void startHealthCheckLoop() {
        if (shutdown.isCancellationRequested() || !loopStarted.compareAndSet(false, true)) {
            return;
        }
        logger.info("Starting health check loop for {} (interval: {}ms)",
            controlEndpoint, healthCheckInterval.toMillis());
        scheduleNextProbe();
    }

    private void scheduleNextProbe() {
        CancellationToken token = shutdown.token();
        Cancellations.delay(vertx, healthCheckInterval, token)
            .compose(v -> checkHealth(token))
            .compose(healthy -> {
                if (state == ConnectionState.DISCONNECTED) {
                    transitionState(ConnectionState.RECONNECTING);
                    return establish(token);
                }
                return Future.<Void>succeededFuture();
            })
            .onComplete(ar -> {
                if (token.isCancellationRequested()) {
                    logger.debug("Health check loop for {} stopped", controlEndpoint);
                    loopCompletion.tryComplete();
                    return;
                }
                if (ar.failed()) {
                    logger.warn("Health check loop encountered an error: {}", ar.cause().getMessage());
                }
                scheduleNextProbe();
            });
    }

    private void transitionState(ConnectionState newState) {
        ConnectionState oldState;
        synchronized (stateLock) {
            if (state == newState) {
                return;
            }
            oldState = state;
            state = newState;
        }

        logger.info("Connection state changed: {} -> {}", oldState, newState);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(newState);
            } catch (RuntimeException e) {
                logger.warn("Connection state listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private Future<Void> closeTransport() {
        webClient.close();
        return httpClient.close();
    }

    private static HttpClientOptions httpClientOptions(StreamlineOptions options) {
        ControlEndpoint endpoint = ControlEndpoint.fromBootstrapServers(
            options.getBootstrapServers(), options.getControlPort());
        return new HttpClientOptions()
            .setDefaultHost(endpoint.host())
            .setDefaultPort(endpoint.port())
            .setConnectTimeout((int) options.getConnectTimeout().toMillis());
    }

    private static HttpClient createHttpClient(Vertx vertx, StreamlineOptions options) {
        Objects.requireNonNull(vertx, "vertx must not be null");
        Objects.requireNonNull(options, "options must not be null");
        PoolOptions poolOptions = new PoolOptions()
            .setHttp1MaxSize(options.getConnectionPoolSize());
        return vertx.createHttpClient(httpClientOptions(options), poolOptions);
    }
}
