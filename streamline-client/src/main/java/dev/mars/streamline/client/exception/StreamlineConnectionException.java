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

package dev.mars.streamline.client.exception;

/**
 * Thrown when the Streamline server cannot be reached or a health probe fails.
 */
public class StreamlineConnectionException extends StreamlineException {

    public StreamlineConnectionException(String message) {
        this(message, null);
    }

    public StreamlineConnectionException(String message, Throwable cause) {
        this(message, true, cause);
    }

    /**
     * Creates a connection exception with explicit retryability. Used for failures that retrying
     * cannot fix, such as a request made before {@code connect()}.
     */
    public StreamlineConnectionException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    private StreamlineConnectionException(String message, boolean retryable, Throwable cause) {
        super(message, StreamlineErrorCode.CONNECTION, retryable, "Check that the Streamline server is running and accessible", cause);
    }
}
