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

import dev.mars.streamline.client.exception.StreamlineConfigurationException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable configuration for {@link RetryPolicy}.
 *
 * <p>Use the {@link Builder} to create instances. Invalid combinations are rejected by
 * {@link Builder#build()} with a {@link StreamlineConfigurationException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryPolicyOptions options = RetryPolicyOptions.builder()
 *     .maxRetries(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public final class RetryPolicyOptions {

    /** Default policy name used in logs and metrics */
    public static final String DEFAULT_NAME = "default";

    /** Default maximum number of retries after the first attempt */
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Default base delay */
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);

    /** Default maximum delay */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    /** Default backoff multiplier */
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final String name;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final Predicate<Throwable> retryable;
    private final RetryListener listener;

    private RetryPolicyOptions(Builder builder) {
        this.name = builder.name;
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.retryable = builder.retryable;
        this.listener = builder.listener;
    }

    /** Returns the policy name used in logs and metrics */
    public String getName() { return name; }

    /** Returns the maximum number of retries after the first attempt */
    public int getMaxRetries() { return maxRetries; }

    /** Returns the delay before the first retry */
    public Duration getBaseDelay() { return baseDelay; }

    /** Returns the upper bound of the un-jittered delay */
    public Duration getMaxDelay() { return maxDelay; }

    /** Returns the backoff growth factor */
    public double getMultiplier() { return multiplier; }

    /** Returns the custom retryability predicate, if one was configured */
    public Optional<Predicate<Throwable>> getRetryable() { return Optional.ofNullable(retryable); }

    /** Returns the retry listener, if one was configured */
    public Optional<RetryListener> getListener() { return Optional.ofNullable(listener); }

    /** Creates a new builder with default settings */
    public static Builder builder() {
        return new Builder();
    }

    /** Creates default options */
    public static RetryPolicyOptions defaults() {
        return builder().build();
    }

    /** Creates a builder initialised with the values of this instance */
    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .maxRetries(maxRetries)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .multiplier(multiplier)
            .retryable(retryable)
            .listener(listener);
    }

    @Override
    public String toString() {
        return "RetryPolicyOptions{" +
                "name='" + name + '\'' +
                ", maxRetries=" + maxRetries +
                ", baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                ", customPredicate=" + (retryable != null) +
                '}';
    }

    /** Builder for creating RetryPolicyOptions instances */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double multiplier = DEFAULT_MULTIPLIER;
        private Predicate<Throwable> retryable;
        private RetryListener listener;

        private Builder() {}

        /** Sets the policy name used in logs and metrics */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Sets the maximum number of retries after the first attempt */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /** Sets the delay before the first retry */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        /** Sets the upper bound of the un-jittered delay */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /** Sets the backoff growth factor */
        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        /** Sets the retryability predicate; null restores the default classification */
        public Builder retryable(Predicate<Throwable> retryable) {
            this.retryable = retryable;
            return this;
        }

        /** Sets the listener notified of retries; null removes it */
        public Builder listener(RetryListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Builds the options.
         *
         * @throws StreamlineConfigurationException if the settings are inconsistent
         */
        public RetryPolicyOptions build() {
            if (name == null || name.isBlank()) {
                throw new StreamlineConfigurationException("name must not be blank");
            }
            if (maxRetries < 0) {
                throw new StreamlineConfigurationException("maxRetries must be >= 0, was " + maxRetries);
            }
            if (baseDelay == null || baseDelay.isNegative()) {
                throw new StreamlineConfigurationException("baseDelay must be non-negative, was " + baseDelay);
            }
            if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
                throw new StreamlineConfigurationException(
                    "maxDelay must be >= baseDelay, was " + maxDelay + " < " + baseDelay);
            }
            if (Double.isNaN(multiplier) || multiplier < 1.0) {
                throw new StreamlineConfigurationException("multiplier must be >= 1.0, was " + multiplier);
            }
            return new RetryPolicyOptions(this);
        }
    }
}
