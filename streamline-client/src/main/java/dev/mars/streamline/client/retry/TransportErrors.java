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

import io.vertx.core.http.HttpClosedException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies transport failures raised by Vert.x HTTP clients.
 */
public final class TransportErrors {

    private static final int MAX_CAUSE_DEPTH = 16;

    private TransportErrors() {
    }

    /**
     * Returns true if the error, or one of its causes, is a connectivity-level failure:
     * refused or reset connections, DNS failures, closed channels and connections closed by the
     * peer. Cancellation and timeouts are not connectivity failures.
     *
     * @param error the error to classify (may be null)
     * @return true for connectivity failures
     */
    public static boolean isConnectivityError(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CancellationException || current instanceof TimeoutException) {
                return false;
            }
            if (current instanceof IOException || current instanceof HttpClosedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns true if the error, or one of its causes, is a {@link TimeoutException}.
     *
     * @param error the error to classify (may be null)
     * @return true for timeouts
     */
    public static boolean isTimeout(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
