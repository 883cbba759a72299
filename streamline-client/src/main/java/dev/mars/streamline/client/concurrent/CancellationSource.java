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

/**
 * Owns a {@link CancellationToken} and decides when it is cancelled.
 *
 * <p>Example usage:
 * <pre>{@code
 * CancellationSource source = new CancellationSource();
 * client.produce("orders", "key", "value", source.token());
 * source.cancel();
 * }</pre>
 */
public final class CancellationSource implements AutoCloseable {

    private final CancellationToken token = new CancellationToken(true);
    private volatile boolean closed;

    /** Returns the token controlled by this source */
    public CancellationToken token() {
        return token;
    }

    /**
     * Requests cancellation and runs the registered callbacks.
     *
     * @return true if this call performed the cancellation, false if it had already happened
     */
    public boolean cancel() {
        return token.cancel();
    }

    /** Returns true once {@link #cancel()} has been called */
    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }

    /** Returns true once {@link #close()} has been called */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases callbacks that are still registered. Does not cancel the token.
     */
    @Override
    public void close() {
        closed = true;
        token.clearCallbacks();
    }
}
