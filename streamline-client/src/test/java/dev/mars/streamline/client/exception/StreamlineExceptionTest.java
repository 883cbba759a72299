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

import dev.mars.streamline.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Streamline exception taxonomy and HTTP status mapping.
 */
@Tag(TestCategories.CORE)
class StreamlineExceptionTest {

    @Test
    @DisplayName("Base exception defaults to UNKNOWN and not retryable")
    void baseExceptionDefaults() {
        StreamlineException e = new StreamlineException("boom");

        assertEquals("boom", e.getMessage());
        assertEquals(StreamlineErrorCode.UNKNOWN, e.getErrorCode());
        assertFalse(e.isRetryable());
        assertNull(e.getHint());
        assertNull(e.getCause());
    }

    @Test
    @DisplayName("Connection errors are retryable and carry a hint and cause")
    void connectionException() {
        IOException cause = new IOException("refused");
        StreamlineConnectionException e = new StreamlineConnectionException("cannot connect", cause);

        assertEquals(StreamlineErrorCode.CONNECTION, e.getErrorCode());
        assertTrue(e.isRetryable());
        assertNotNull(e.getHint());
        assertSame(cause, e.getCause());
    }

    @Test
    @DisplayName("Connection exceptions can be raised as non-retryable")
    void nonRetryableConnectionException() {
        StreamlineConnectionException e = new StreamlineConnectionException("not connected", false);

        assertEquals(StreamlineErrorCode.CONNECTION, e.getErrorCode());
        assertFalse(e.isRetryable());
        assertNull(e.getCause());
    }

    @Test
    @DisplayName("Each subclass carries its code and retryability")
    void subclassClassification() {
        assertClassified(new StreamlineAuthenticationException("x"), StreamlineErrorCode.AUTHENTICATION, false);
        assertClassified(new StreamlineAuthorizationException("x"), StreamlineErrorCode.AUTHORIZATION, false);
        assertClassified(new StreamlineTimeoutException("x"), StreamlineErrorCode.TIMEOUT, true);
        assertClassified(new StreamlineProducerException("x"), StreamlineErrorCode.PRODUCER, true);
        assertClassified(new StreamlineConsumerException("x"), StreamlineErrorCode.CONSUMER, true);
        assertClassified(new StreamlineSerializationException("x"), StreamlineErrorCode.SERIALIZATION, false);
        assertClassified(new StreamlineConfigurationException("x"), StreamlineErrorCode.CONFIGURATION, false);
    }

    @Test
    @DisplayName("Topic not found names the topic and suggests creating it")
    void topicNotFound() {
        StreamlineTopicNotFoundException e = new StreamlineTopicNotFoundException("orders");

        assertEquals("orders", e.getTopic());
        assertEquals(StreamlineErrorCode.TOPIC_NOT_FOUND, e.getErrorCode());
        assertFalse(e.isRetryable());
        assertTrue(e.getMessage().contains("orders"));
        assertTrue(e.getHint().contains("streamline-cli topics create orders"));
    }

    @Test
    @DisplayName("All exceptions are unchecked")
    void exceptionsAreUnchecked() {
        assertInstanceOf(RuntimeException.class, new StreamlineTimeoutException("x"));
    }

    // ========================================================================
    // Status mapping
    // ========================================================================

    @Test
    @DisplayName("HTTP statuses map onto the taxonomy")
    void fromStatusMapping() {
        assertInstanceOf(StreamlineAuthenticationException.class, StreamlineExceptions.fromStatus(401, "/info", ""));
        assertInstanceOf(StreamlineAuthorizationException.class, StreamlineExceptions.fromStatus(403, "/info", ""));
        assertInstanceOf(StreamlineTimeoutException.class, StreamlineExceptions.fromStatus(408, "/info", ""));
        assertInstanceOf(StreamlineTimeoutException.class, StreamlineExceptions.fromStatus(504, "/info", ""));
        assertInstanceOf(StreamlineConnectionException.class, StreamlineExceptions.fromStatus(503, "/info", ""));

        StreamlineException notFound = StreamlineExceptions.fromStatus(404, "/info", "");
        assertEquals(StreamlineException.class, notFound.getClass());
        assertEquals(StreamlineErrorCode.UNKNOWN, notFound.getErrorCode());
        assertFalse(notFound.isRetryable());

        StreamlineException serverError = StreamlineExceptions.fromStatus(500, "/info", "");
        assertEquals(StreamlineErrorCode.UNKNOWN, serverError.getErrorCode());
        assertFalse(serverError.isRetryable());
    }

    @Test
    @DisplayName("Status message includes status, path and trimmed body")
    void fromStatusMessage() {
        StreamlineException e = StreamlineExceptions.fromStatus(500, "/metrics", "  internal failure \n");
        assertEquals("HTTP 500 from /metrics: internal failure", e.getMessage());

        StreamlineException noBody = StreamlineExceptions.fromStatus(502, null, null);
        assertEquals("HTTP 502", noBody.getMessage());
    }

    private static void assertClassified(StreamlineException e, StreamlineErrorCode code, boolean retryable) {
        assertEquals(code, e.getErrorCode(), e.getClass().getSimpleName());
        assertEquals(retryable, e.isRetryable(), e.getClass().getSimpleName());
    }
}
