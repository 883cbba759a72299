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

import java.time.Duration;

/**
 * Observer of {@link RetryPolicy} attempts.
 *
 * <p>Callbacks run synchronously on the thread that completed the failed attempt and must not
 * block.
 */
public interface RetryListener {

    /**
     * Called after a failed attempt that will be retried, before the backoff delay starts.
     *
     * @param policyName the name of the retry policy
     * @param attempt the number of the failed attempt (1-based)
     * @param delay the backoff delay before the next attempt
     * @param error the failure
     */
    void onRetry(String policyName, int attempt, Duration delay, Throwable error);

    /**
     * Called when the last allowed attempt has failed with a retryable error. Errors rejected by
     * the retry predicate are surfaced without this callback.
     *
     * @param policyName the name of the retry policy
     * @param attempts the total number of attempts made
     * @param error the error surfaced to the caller
     */
    default void onGiveUp(String policyName, int attempts, Throwable error) {
    }
}
