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


package dev.mars.streamline.client.config;

import dev.mars.streamline.client.exception.StreamlineConfigurationException;
import dev.mars.streamline.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StreamlineOptions} defaults, validation and layered loading.
 */
@Tag(TestCategories.CORE)
class StreamlineOptionsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        StreamlineOptions options = StreamlineOptions.defaults();

        assertEquals("localhost:9092", options.getBootstrapServers());
        assertEquals(9094, options.getControlPort());
        assertEquals("/health", options.getHealthPath());
        assertEquals(4, options.getConnectionPoolSize());
        assertEquals(Duration.ofSeconds(30), options.getConnectTimeout());
        assertEquals(Duration.ofSeconds(30), options.getRequestTimeout());
        assertEquals(Duration.ofSeconds(30), options.getHealthCheckInterval());
        assertEquals(3, options.getProduceRetries());
        assertEquals(Duration.ofMillis(100), options.getProduceRetryBackoff());

        assertEquals("connection", options.getConnectionRetry().getName());
        assertEquals(3, options.getConnectionRetry().getMaxRetries());
        assertEquals(Duration.ofMillis(500), options.getConnectionRetry().getBaseDelay());
        assertEquals(Duration.ofSeconds(5), options.getConnectionRetry().getMaxDelay());
        assertEquals(2.0, options.getConnectionRetry().getMultiplier());
    }

    @Test
    @DisplayName("Builder values and toBuilder round trip")
    void builderAndToBuilder() {
        StreamlineOptions options = StreamlineOptions.builder()
            .bootstrapServers("broker1:9092,broker2:9092")
            .connectionPoolSize(8)
            .requestTimeout(Duration.ofSeconds(5))
            .produceRetries(5)
            .build();

        StreamlineOptions copy = options.toBuilder().controlPort(19094).build();

        assertEquals("broker1:9092,broker2:9092", copy.getBootstrapServers());
        assertEquals(8, copy.getConnectionPoolSize());
        assertEquals(Duration.ofSeconds(5), copy.getRequestTimeout());
        assertEquals(5, copy.getProduceRetries());
        assertEquals(19094, copy.getControlPort());
        assertEquals(9094, options.getControlPort());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void validation() {
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().bootstrapServers(" ").build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().controlPort(0).build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().healthPath("health").build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().connectionPoolSize(0).build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().requestTimeout(Duration.ZERO).build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().healthCheckInterval(Duration.ofSeconds(-1)).build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().produceRetries(-1).build());
        assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.builder().connectionRetry(null).build());
    }

    @Test
    @DisplayName("fromProperties parses every key")
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(StreamlineOptions.BOOTSTRAP_SERVERS, " stream-1:9092 ");
        props.setProperty(StreamlineOptions.CONTROL_PORT, "19094");
        props.setProperty(StreamlineOptions.HEALTH_PATH, "/ready");
        props.setProperty(StreamlineOptions.CONNECTION_POOL_SIZE, "2");
        props.setProperty(StreamlineOptions.CONNECT_TIMEOUT_MS, "1500");
        props.setProperty(StreamlineOptions.REQUEST_TIMEOUT_MS, "2500");
        props.setProperty(StreamlineOptions.HEALTH_CHECK_INTERVAL_MS, "1000");
        props.setProperty(StreamlineOptions.CONNECTION_RETRY_MAX, "6");
        props.setProperty(StreamlineOptions.CONNECTION_RETRY_BASE_DELAY_MS, "50");
        props.setProperty(StreamlineOptions.CONNECTION_RETRY_MAX_DELAY_MS, "800");
        props.setProperty(StreamlineOptions.CONNECTION_RETRY_MULTIPLIER, "1.5");
        props.setProperty(StreamlineOptions.PRODUCE_RETRIES, "0");
        props.setProperty(StreamlineOptions.PRODUCE_RETRY_BACKOFF_MS, "20");

        StreamlineOptions options = StreamlineOptions.fromProperties(props);

        assertEquals("stream-1:9092", options.getBootstrapServers());
        assertEquals(19094, options.getControlPort());
        assertEquals("/ready", options.getHealthPath());
        assertEquals(2, options.getConnectionPoolSize());
        assertEquals(Duration.ofMillis(1500), options.getConnectTimeout());
        assertEquals(Duration.ofMillis(2500), options.getRequestTimeout());
        assertEquals(Duration.ofSeconds(1), options.getHealthCheckInterval());
        assertEquals(6, options.getConnectionRetry().getMaxRetries());
        assertEquals(Duration.ofMillis(50), options.getConnectionRetry().getBaseDelay());
        assertEquals(Duration.ofMillis(800), options.getConnectionRetry().getMaxDelay());
        assertEquals(1.5, options.getConnectionRetry().getMultiplier());
        assertEquals(0, options.getProduceRetries());
        assertEquals(Duration.ofMillis(20), options.getProduceRetryBackoff());
    }

    @Test
    @DisplayName("Unparseable values fail with a configuration error naming the key")
    void unparseableValue() {
        Properties props = new Properties();
        props.setProperty(StreamlineOptions.CONTROL_PORT, "not-a-port");

        StreamlineConfigurationException e = assertThrows(StreamlineConfigurationException.class,
            () -> StreamlineOptions.fromProperties(props));
        assertTrue(e.getMessage().contains(StreamlineOptions.CONTROL_PORT));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    @DisplayName("Classpath file, then environment, then system properties")
    void layeredLoading() {
        // streamline-client.properties on the test classpath sets pool size 6 and produce retries 5
        Map<String, String> environment = Map.of(
            "STREAMLINE_CONNECTION_POOL_SIZE", "7",
            "STREAMLINE_BOOTSTRAP_SERVERS", "env-host:9092",
            "PATH", "/usr/bin");
        Properties system = new Properties();
        system.setProperty("streamline.bootstrap.servers", "sys-host:9092");
        system.setProperty("java.version", "17");

        StreamlineOptions options = StreamlineOptions.load(environment, system);

        assertEquals("sys-host:9092", options.getBootstrapServers());
        assertEquals(7, options.getConnectionPoolSize());
        assertEquals(5, options.getProduceRetries());
    }

    @Test
    @DisplayName("Classpath file alone is applied over the defaults")
    void classpathOnly() {
        StreamlineOptions options = StreamlineOptions.load(Map.of(), new Properties());

        assertEquals(6, options.getConnectionPoolSize());
        assertEquals(5, options.getProduceRetries());
        assertEquals("localhost:9092", options.getBootstrapServers());
    }
}
