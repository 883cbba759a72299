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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Signal observed by asynchronous operations to stop early.
 *
 * <p>Tokens are obtained from a {@link CancellationSource}. Once cancellation has been requested
 * it cannot be withdrawn. Callbacks registered with {@link #register(Runnable)} run exactly once,
 * either on the thread that calls {@link CancellationSource#cancel()} or immediately on the
 * registering thread if cancellation was already requested.
 *
 * <p>{@link #NONE} is a token that is never cancelled.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /** A token that can never be cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /** Returns true once cancellation has been requested */
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /** Returns true if this token can ever be cancelled */
    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * Throws a {@link CancellationException} if cancellation has been requested.
     *
     * @param message the message of the thrown exception
     */
    public void throwIfCancellationRequested(String message) {
        if (cancelled.get()) {
            throw new CancellationException(message);
        }
    }

    /**
     * Registers a callback to run when cancellation is requested.
     *
     * @param callback the callback
     * @return a handle that unregisters the callback
     */
    public Registration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        if (!cancellable) {
            return Registration.NOOP;
        }
        callbacks.add(callback);
        // cancel() may have run between the add and this check; remove() decides who runs it
        if (cancelled.get() && callbacks.remove(callback)) {
            invoke(callback);
            return Registration.NOOP;
        }
        return () -> callbacks.remove(callback);
    }

    boolean cancel() {
        if (!cancellable || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                invoke(callback);
            }
        }
        return true;
    }

    void clearCallbacks() {
        callbacks.clear();
    }

    int callbackCount() {
        return callbacks.size();
    }

    private static void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancellable=" + cancellable + ", cancelled=" + cancelled.get() + '}';
    }
}
