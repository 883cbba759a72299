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
import dev.mars.streamline.client.retry.RetryPolicyOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the Streamline client.
 *
 * <p>Instances are immutable and created through the {@link Builder}, or loaded from layered
 * property sources with {@link #load()}:
 * <ol>
 *   <li>{@code /streamline-client.properties} on the classpath (optional)</li>
 *   <li>{@code STREAMLINE_*} environment variables, lower-cased with {@code _} mapped to {@code .}</li>
 *   <li>{@code streamline.*} system properties</li>
 * </ol>
 * Later sources override earlier ones.
 *
 * <p>Example usage:
 * <pre>{@code
 * StreamlineOptions options = StreamlineOptions.builder()
 *     .bootstrapServers("broker1:9092,broker2:9092")
 *     .connectionPoolSize(8)
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public final class StreamlineOptions {

    private static final Logger logger = LoggerFactory.getLogger(StreamlineOptions.class);

    /** Classpath resource read by {@link #load()} */
    public static final String PROPERTIES_RESOURCE = "/streamline-client.properties";

    public static final String BOOTSTRAP_SERVERS = "streamline.bootstrap.servers";
    public static final String CONTROL_PORT = "streamline.control.port";
    public static final String HEALTH_PATH = "streamline.health.path";
    public static final String CONNECTION_POOL_SIZE = "streamline.connection.pool.size";
    public static final String CONNECT_TIMEOUT_MS = "streamline.connect.timeout.ms";
    public static final String REQUEST_TIMEOUT_MS = "streamline.request.timeout.ms";
    public static final String HEALTH_CHECK_INTERVAL_MS = "streamline.health.check.interval.ms";
    public static final String CONNECTION_RETRY_MAX = "streamline.connection.retry.max";
    public static final String CONNECTION_RETRY_BASE_DELAY_MS = "streamline.connection.retry.base.delay.ms";
    public static final String CONNECTION_RETRY_MAX_DELAY_MS = "streamline.connection.retry.max.delay.ms";
    public static final String CONNECTION_RETRY_MULTIPLIER = "streamline.connection.retry.multiplier";
    public static final String PRODUCE_RETRIES = "streamline.produce.retries";
    public static final String PRODUCE_RETRY_BACKOFF_MS = "streamline.produce.retry.backoff.ms";

    /** Default bootstrap servers */
    public static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";

    /** Default port of the HTTP control plane */
    public static final int DEFAULT_CONTROL_PORT = 9094;

    /** Default health probe path */
    public static final String DEFAULT_HEALTH_PATH = "/health";

    /** Default maximum number of pooled HTTP connections */
    public static final int DEFAULT_CONNECTION_POOL_SIZE = 4;

    /** Default connect timeout */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    /** Default request timeout */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /** Default interval between background health probes */
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

    /** Default number of produce retries */
    public static final int DEFAULT_PRODUCE_RETRIES = 3;

    /** Default base backoff between produce retries */
    public static final Duration DEFAULT_PRODUCE_RETRY_BACKOFF = Duration.ofMillis(100);

    /** Default retry settings of the connection manager */
    public static final RetryPolicyOptions DEFAULT_CONNECTION_RETRY = RetryPolicyOptions.builder()
        .name("connection")
        .maxRetries(3)
        .baseDelay(Duration.ofMillis(500))
        .maxDelay(Duration.ofSeconds(5))
        .multiplier(2.0)
        .build();

    private final String bootstrapServers;
    private final int controlPort;
    private final String healthPath;
    private final int connectionPoolSize;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final Duration healthCheckInterval;
    private final RetryPolicyOptions connectionRetry;
    private final int produceRetries;
    private final Duration produceRetryBackoff;

    private StreamlineOptions(Builder builder) {
        this.bootstrapServers = builder.bootstrapServers;
        this.controlPort = builder.controlPort;
        this.healthPath = builder.healthPath;
        this.connectionPoolSize = builder.connectionPoolSize;
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.connectionRetry = builder.connectionRetry;
        this.produceRetries = builder.produceRetries;
        this.produceRetryBackoff = builder.produceRetryBackoff;
    }

    /** Returns the comma-separated list of bootstrap servers */
    public String getBootstrapServers() { return bootstrapServers; }

    /** Returns the port of the HTTP control plane */
    public int getControlPort() { return controlPort; }

    /** Returns the path probed by health checks */
    public String getHealthPath() { return healthPath; }

    /** Returns the maximum number of pooled HTTP connections */
    public int getConnectionPoolSize() { return connectionPoolSize; }

    /** Returns the connect timeout */
    public Duration getConnectTimeout() { return connectTimeout; }

    /** Returns the request timeout */
    public Duration getRequestTimeout() { return requestTimeout; }

    /** Returns the initial interval between background health probes */
    public Duration getHealthCheckInterval() { return healthCheckInterval; }

    /** Returns the retry settings used by the connection manager */
    public RetryPolicyOptions getConnectionRetry() { return connectionRetry; }

    /** Returns the number of produce retries */
    public int getProduceRetries() { return produceRetries; }

    /** Returns the base backoff between produce retries */
    public Duration getProduceRetryBackoff() { return produceRetryBackoff; }

    /** Creates a new builder with default settings */
    public static Builder builder() {
        return new Builder();
    }

    /** Creates default options */
    public static StreamlineOptions defaults() {
        return builder().build();
    }

    /** Creates a builder initialised with the values of this instance */
    public Builder toBuilder() {
        return new Builder()
            .bootstrapServers(bootstrapServers)
            .controlPort(controlPort)
            .healthPath(healthPath)
            .connectionPoolSize(connectionPoolSize)
            .connectTimeout(connectTimeout)
            .requestTimeout(requestTimeout)
            .healthCheckInterval(healthCheckInterval)
            .connectionRetry(connectionRetry)
            .produceRetries(produceRetries)
            .produceRetryBackoff(produceRetryBackoff);
    }

    /**
     * Loads options from the classpath resource, environment variables and system properties.
     *
     * @throws StreamlineConfigurationException if a value cannot be parsed or is invalid
     */
    public static StreamlineOptions load() {
        return load(System.getenv(), System.getProperties());
    }

    static StreamlineOptions load(Map<String, String> environment, Properties systemProperties) {
        Properties props = new Properties();
        loadPropertiesFromResource(props, PROPERTIES_RESOURCE);

        environment.forEach((key, value) -> {
            if (key.startsWith("STREAMLINE_")) {
                props.setProperty(key.toLowerCase(Locale.ROOT).replace('_', '.'), value);
            }
        });

        // system properties win over the environment so tests can override with -D
        systemProperties.forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("streamline.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return fromProperties(props);
    }

    /**
     * Builds options from {@code streamline.*} properties. Missing keys keep their defaults.
     *
     * @param props the properties to read
     * @return the parsed options
     * @throws StreamlineConfigurationException if a value cannot be parsed or is invalid
     */
    public static StreamlineOptions fromProperties(Properties props) {
        Builder builder = builder();

        String servers = props.getProperty(BOOTSTRAP_SERVERS);
        if (servers != null) {
            builder.bootstrapServers(servers.trim());
        }
        String healthPath = props.getProperty(HEALTH_PATH);
        if (healthPath != null) {
            builder.healthPath(healthPath.trim());
        }
        builder.controlPort(intValue(props, CONTROL_PORT, DEFAULT_CONTROL_PORT));
        builder.connectionPoolSize(intValue(props, CONNECTION_POOL_SIZE, DEFAULT_CONNECTION_POOL_SIZE));
        builder.connectTimeout(millisValue(props, CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT));
        builder.requestTimeout(millisValue(props, REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT));
        builder.healthCheckInterval(millisValue(props, HEALTH_CHECK_INTERVAL_MS, DEFAULT_HEALTH_CHECK_INTERVAL));
        builder.produceRetries(intValue(props, PRODUCE_RETRIES, DEFAULT_PRODUCE_RETRIES));
        builder.produceRetryBackoff(millisValue(props, PRODUCE_RETRY_BACKOFF_MS, DEFAULT_PRODUCE_RETRY_BACKOFF));

        builder.connectionRetry(DEFAULT_CONNECTION_RETRY.toBuilder()
            .maxRetries(intValue(props, CONNECTION_RETRY_MAX, DEFAULT_CONNECTION_RETRY.getMaxRetries()))
            .baseDelay(millisValue(props, CONNECTION_RETRY_BASE_DELAY_MS, DEFAULT_CONNECTION_RETRY.getBaseDelay()))
            .maxDelay(millisValue(props, CONNECTION_RETRY_MAX_DELAY_MS, DEFAULT_CONNECTION_RETRY.getMaxDelay()))
            .multiplier(doubleValue(props, CONNECTION_RETRY_MULTIPLIER, DEFAULT_CONNECTION_RETRY.getMultiplier()))
            .build());

        return builder.build();
    }

    private static void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = StreamlineOptions.class.getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            throw new StreamlineConfigurationException("Failed to load properties from " + resourcePath, e);
        }
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new StreamlineConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new StreamlineConfigurationException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }

    private static Duration millisValue(Properties props, String key, Duration defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new StreamlineConfigurationException("Invalid milliseconds for " + key + ": '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "StreamlineOptions{" +
                "bootstrapServers='" + bootstrapServers + '\'' +
                ", controlPort=" + controlPort +
                ", healthPath='" + healthPath + '\'' +
                ", connectionPoolSize=" + connectionPoolSize +
                ", connectTimeout=" + connectTimeout +
                ", requestTimeout=" + requestTimeout +
                ", healthCheckInterval=" + healthCheckInterval +
                ", connectionRetry=" + connectionRetry +
                ", produceRetries=" + produceRetries +
                ", produceRetryBackoff=" + produceRetryBackoff +
                '}';
    }

    /** Builder for creating StreamlineOptions instances */
    public static final class Builder {
        private String bootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
        private int controlPort = DEFAULT_CONTROL_PORT;
        private String healthPath = DEFAULT_HEALTH_PATH;
        private int connectionPoolSize = DEFAULT_CONNECTION_POOL_SIZE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
        private RetryPolicyOptions connectionRetry = DEFAULT_CONNECTION_RETRY;
        private int produceRetries = DEFAULT_PRODUCE_RETRIES;
        private Duration produceRetryBackoff = DEFAULT_PRODUCE_RETRY_BACKOFF;

        private Builder() {}

        /** Sets the comma-separated list of bootstrap servers ({@code host:port}) */
        public Builder bootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
            return this;
        }

        /** Sets the port of the HTTP control plane */
        public Builder controlPort(int controlPort) {
            this.controlPort = controlPort;
            return this;
        }

        /** Sets the path probed by health checks */
        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        /** Sets the maximum number of pooled HTTP connections */
        public Builder connectionPoolSize(int connectionPoolSize) {
            this.connectionPoolSize = connectionPoolSize;
            return this;
        }

        /** Sets the connect timeout */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /** Sets the request timeout */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /** Sets the initial interval between background health probes */
        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        /** Sets the retry settings used by the connection manager */
        public Builder connectionRetry(RetryPolicyOptions connectionRetry) {
            this.connectionRetry = connectionRetry;
            return this;
        }

        /** Sets the number of produce retries */
        public Builder produceRetries(int produceRetries) {
            this.produceRetries = produceRetries;
            return this;
        }

        /** Sets the base backoff between produce retries */
        public Builder produceRetryBackoff(Duration produceRetryBackoff) {
            this.produceRetryBackoff = produceRetryBackoff;
            return this;
        }

        /**
         * Builds the options.
         *
         * @throws StreamlineConfigurationException if a setting is missing or out of range
         */
        public StreamlineOptions build() {
            if (bootstrapServers == null || bootstrapServers.isBlank()) {
                throw new StreamlineConfigurationException("bootstrapServers must not be blank");
            }
            if (controlPort < 1 || controlPort > 65535) {
                throw new StreamlineConfigurationException("controlPort must be in 1..65535, was " + controlPort);
            }
            if (healthPath == null || !healthPath.startsWith("/")) {
                throw new StreamlineConfigurationException("healthPath must start with '/', was " + healthPath);
            }
            if (connectionPoolSize < 1) {
                throw new StreamlineConfigurationException(
                    "connectionPoolSize must be positive, was " + connectionPoolSize);
            }
            requirePositive("connectTimeout", connectTimeout);
            requirePositive("requestTimeout", requestTimeout);
            requirePositive("healthCheckInterval", healthCheckInterval);
            if (connectionRetry == null) {
                throw new StreamlineConfigurationException("connectionRetry must not be null");
            }
            if (produceRetries < 0) {
                throw new StreamlineConfigurationException("produceRetries must be >= 0, was " + produceRetries);
            }
            if (produceRetryBackoff == null || produceRetryBackoff.isNegative()) {
                throw new StreamlineConfigurationException(
                    "produceRetryBackoff must be non-negative, was " + produceRetryBackoff);
            }
            return new StreamlineOptions(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new StreamlineConfigurationException(name + " must be positive, was " + value);
            }
        }
    }
}
