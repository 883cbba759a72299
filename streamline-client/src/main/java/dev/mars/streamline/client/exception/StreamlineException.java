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

import java.util.Objects;

/**
 * Base exception for all Streamline client errors.
 *
 * <p>Every instance carries:
 * <ul>
 *   <li>an {@link StreamlineErrorCode} describing the kind of failure</li>
 *   <li>a retryable flag that the default retry predicate honours</li>
 *   <li>an optional hint for resolving the error</li>
 * </ul>
 */
public class StreamlineException extends RuntimeException {

    private final StreamlineErrorCode errorCode;
    private final boolean retryable;
    private final String hint;

    /**
     * Creates a new exception.
     *
     * @param message the error message
     * @param errorCode the error code
     * @param retryable whether the failed operation may be retried
     * @param hint a hint for resolving the error (may be null)
     * @param cause the underlying cause (may be null)
     */
    public StreamlineException(String message, StreamlineErrorCode errorCode, boolean retryable,
                               String hint, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.retryable = retryable;
        this.hint = hint;
    }

    /**
     * Creates a new exception without a hint or cause.
     *
     * @param message the error message
     * @param errorCode the error code
     * @param retryable whether the failed operation may be retried
     */
    public StreamlineException(String message, StreamlineErrorCode errorCode, boolean retryable) {
        this(message, errorCode, retryable, null, null);
    }

    /**
     * Creates a non-retryable exception with {@link StreamlineErrorCode#UNKNOWN}.
     *
     * @param message the error message
     */
    public StreamlineException(String message) {
        this(message, StreamlineErrorCode.UNKNOWN, false);
    }

    /** Returns the error code */
    public StreamlineErrorCode getErrorCode() { return errorCode; }

    /** Returns true if the operation that caused this error can be retried */
    public boolean isRetryable() { return retryable; }

    /** Returns a hint for resolving the error, or null if none */
    public String getHint() { return hint; }
}
