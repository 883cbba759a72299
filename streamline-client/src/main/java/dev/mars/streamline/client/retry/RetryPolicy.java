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

package dev.mars.streamline.client.retry;

import dev.mars.streamline.client.concurrent.CancellationToken;
import dev.mars.streamline.client.concurrent.Cancellations;
import dev.mars.streamline.client.exception.StreamlineException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries asynchronous operations with exponential backoff and jitter.
 *
 * <p>An operation is attempted until it succeeds, fails with an error the retry predicate
 * rejects, exhausts {@link RetryPolicyOptions#getMaxRetries()} retries, or the cancellation token
 * fires. On permanent failure the original error is surfaced unchanged, so callers can branch on
 * its type.
 *
 * <p>The policy holds no per-operation state and can be shared between callers and connection
 * managers. Backoff delays are Vert.x timers; no thread is blocked while waiting.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(vertx, RetryPolicyOptions.builder()
 *     .maxRetries(3)
 *     .baseDelay(Duration.ofMillis(100))
 *     .build());
 *
 * policy.execute(() -> webClient.get("/health").send())
 *     .onSuccess(response -> logger.info("Status {}", response.statusCode()))
 *     .onFailure(err -> logger.error("Gave up", err));
 * }</pre>
 */
public final class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private static final double JITTER_MIN = 0.75;
    private static final double JITTER_RANGE = 0.5;

    private final Vertx vertx;
    private final RetryPolicyOptions options;
    private final Predicate<Throwable> retryable;
    private final RetryListener listener;
    private final Random random;

    /**
     * Creates a retry policy with default options.
     *
     * @param vertx the Vert.x instance used for backoff timers
     */
    public RetryPolicy(Vertx vertx) {
        this(vertx, RetryPolicyOptions.defaults());
    }

    /**
     * Creates a retry policy.
     *
     * @param vertx the Vert.x instance used for backoff timers
     * @param options the retry options
     */
    public RetryPolicy(Vertx vertx, RetryPolicyOptions options) {
        this(vertx, options, new Random());
    }

    /**
     * Creates a retry policy with an explicit jitter source, for deterministic delays.
     *
     * @param vertx the Vert.x instance used for backoff timers
     * @param options the retry options
     * @param random the jitter source
     */
    public RetryPolicy(Vertx vertx, RetryPolicyOptions options, Random random) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.retryable = options.getRetryable().orElse(RetryPolicy::isRetryableByDefault);
        this.listener = options.getListener().orElse(null);
    }

    /** Returns the options of this policy */
    public RetryPolicyOptions getOptions() {
        return options;
    }

    /**
     * Executes an operation with retries and no cancellation.
     *
     * @see #execute(Supplier, CancellationToken)
     */
    public <T> Future<T> execute(Supplier<Future<T>> operation) {
        return execute(operation, CancellationToken.NONE);
    }

    /**
     * Executes an operation with retries.
     *
     * @param operation supplies a new attempt each time it is called
     * @param token cancels the attempt loop and any pending backoff delay
     * @param <T> the result type
     * @return the result of the first successful attempt, or the last error. Fails with
     *         {@link CancellationException} when the token is cancelled.
     * @throws NullPointerException if {@code operation} or {@code token} is null
     */
    public <T> Future<T> execute(Supplier<Future<T>> operation, CancellationToken token) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(token, "token must not be null");

        Promise<T> promise = Promise.promise();
        attempt(operation, token, 0, promise);
        return promise.future();
    }

    /**
     * Executes an operation whose result is not needed, with retries and no cancellation.
     *
     * @see #executeVoid(Supplier, CancellationToken)
     */
    public Future<Void> executeVoid(Supplier<? extends Future<?>> operation) {
        return executeVoid(operation, CancellationToken.NONE);
    }

    /**
     * Executes an operation whose result is not needed, with retries.
     *
     * @param operation supplies a new attempt each time it is called
     * @param token cancels the attempt loop and any pending backoff delay
     * @return a future completed when an attempt succeeds
     * @throws NullPointerException if {@code operation} or {@code token} is null
     */
    public Future<Void> executeVoid(Supplier<? extends Future<?>> operation, CancellationToken token) {
        Objects.requireNonNull(operation, "operation must not be null");
        Supplier<Future<Void>> adapted = () -> {
            Future<?> future = operation.get();
            return future == null ? null : future.mapEmpty();
        };
        return execute(adapted, token);
    }

    /**
     * Computes the jittered backoff delay before retrying after the given failed attempt.
     *
     * <p>{@code min(baseDelay * multiplier^(attempt-1), maxDelay) * uniform(0.75, 1.25)}, never
     * negative.
     *
     * @param attempt the 1-based number of the attempt that failed
     * @return the delay before the next attempt
     */
    public Duration computeDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        double exponentialNanos = options.getBaseDelay().toNanos()
            * Math.pow(options.getMultiplier(), attempt - 1);
        double cappedNanos = Math.min(exponentialNanos, (double) options.getMaxDelay().toNanos());
        double jitterFactor = JITTER_MIN + random.nextDouble() * JITTER_RANGE;
        double delayNanos = Math.max(0.0, cappedNanos * jitterFactor);
        return Duration.ofNanos((long) delayNanos);
    }

    /**
     * Default retry classification.
     *
     * <ul>
     *   <li>{@link CancellationException}: never retried</li>
     *   <li>{@link StreamlineException}: retried when {@link StreamlineException#isRetryable()}</li>
     *   <li>transport connectivity failures and {@link TimeoutException}: retried</li>
     *   <li>anything else: not retried</li>
     * </ul>
     */
    public static boolean isRetryableByDefault(Throwable error) {
        if (error instanceof CancellationException) {
            return false;
        }
        if (error instanceof StreamlineException) {
            return ((StreamlineException) error).isRetryable();
        }
        return TransportErrors.isConnectivityError(error) || TransportErrors.isTimeout(error);
    }

    private <T> void attempt(Supplier<Future<T>> operation, CancellationToken token,
                             int failedAttempts, Promise<T> promise) {
        if (token.isCancellationRequested()) {
            promise.fail(new CancellationException("Retry loop '" + options.getName() + "' cancelled"));
            return;
        }

        Future<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            future = Future.failedFuture(e);
        }
        if (future == null) {
            future = Future.failedFuture(new NullPointerException("operation returned a null future"));
        }

        future.onComplete(ar -> {
            if (ar.succeeded()) {
                promise.complete(ar.result());
                return;
            }
            Throwable error = ar.cause();
            if (error instanceof CancellationException) {
                promise.fail(error);
                return;
            }

            int attempt = failedAttempts + 1;
            if (!retryable.test(error)) {
                logger.warn("Operation '{}' failed on attempt {} with a non-retryable error: {}",
                    options.getName(), attempt, error.getMessage());
                promise.fail(error);
                return;
            }
            if (attempt > options.getMaxRetries()) {
                logger.warn("Operation '{}' failed after {} attempt(s), not retrying: {}",
                    options.getName(), attempt, error.getMessage());
                if (listener != null) {
                    listener.onGiveUp(options.getName(), attempt, error);
                }
                promise.fail(error);
                return;
            }

            Duration delay = computeDelay(attempt);
            logger.warn("Operation '{}' failed on attempt {}/{}, retrying in {}ms: {}",
                options.getName(), attempt, options.getMaxRetries() + 1, delay.toMillis(), error.getMessage());
            if (listener != null) {
                listener.onRetry(options.getName(), attempt, delay, error);
            }

            Cancellations.delay(vertx, delay, token).onComplete(slept -> {
                if (slept.failed()) {
                    promise.fail(slept.cause());
                } else {
                    attempt(operation, token, attempt, promise);
                }
            });
        });
    }
}
