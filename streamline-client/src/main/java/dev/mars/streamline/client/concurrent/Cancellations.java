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

package dev.mars.streamline.client.concurrent;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Cancellation-aware helpers over Vert.x futures and timers.
 */
public final class Cancellations {

    private Cancellations() {
    }

    /**
     * Completes after the given delay, or fails with {@link CancellationException} as soon as the
     * token is cancelled. Delays below one millisecond complete on a later turn of the Vert.x
     * context instead of a timer, so callers chaining on the result never recurse inline.
     *
     * @param vertx the Vert.x instance owning the timer
     * @param delay the delay
     * @param token the cancellation token
     * @return a future completed when the delay has elapsed
     */
    public static Future<Void> delay(Vertx vertx, Duration delay, CancellationToken token) {
        Objects.requireNonNull(vertx, "vertx must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(token, "token must not be null");

        if (token.isCancellationRequested()) {
            return Future.failedFuture(new CancellationException("Delay cancelled"));
        }
        long millis = delay.toMillis();
        Promise<Void> promise = Promise.promise();
        if (millis < 1) {
            vertx.runOnContext(v -> {
                if (token.isCancellationRequested()) {
                    promise.tryFail(new CancellationException("Delay cancelled"));
                } else {
                    promise.tryComplete();
                }
            });
            return promise.future();
        }

        long timerId = vertx.setTimer(millis, id -> promise.tryComplete());
        Registration registration = token.register(() -> {
            vertx.cancelTimer(timerId);
            promise.tryFail(new CancellationException("Delay cancelled"));
        });
        return promise.future().onComplete(ar -> registration.close());
    }

    /**
     * Mirrors the outcome of a future unless the token is cancelled first, in which case the
     * returned future fails with {@link CancellationException}. The underlying operation is not
     * interrupted; its late result is discarded.
     *
     * @param future the future to observe
     * @param token the cancellation token
     * @param <T> the result type
     * @return a future racing the operation against cancellation
     */
    public static <T> Future<T> withCancellation(Future<T> future, CancellationToken token) {
        Objects.requireNonNull(future, "future must not be null");
        Objects.requireNonNull(token, "token must not be null");

        if (!token.canBeCancelled()) {
            return future;
        }
        if (token.isCancellationRequested()) {
            return Future.failedFuture(new CancellationException("Operation cancelled"));
        }

        Promise<T> promise = Promise.promise();
        Registration registration = token.register(
            () -> promise.tryFail(new CancellationException("Operation cancelled")));
        future.onComplete(ar -> {
            registration.close();
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }
}
