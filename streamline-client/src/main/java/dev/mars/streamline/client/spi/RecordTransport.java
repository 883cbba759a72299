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


package dev.mars.streamline.client.spi;

import dev.mars.streamline.client.OutgoingRecord;
import dev.mars.streamline.client.RecordMetadata;
import io.vertx.core.Future;

/**
 * Delivers records to the broker over the data plane.
 *
 * <p>Implementations own the wire protocol. {@link dev.mars.streamline.client.StreamlineClient}
 * retries failed sends according to the error's retryability, so implementations should fail
 * with a {@link dev.mars.streamline.client.exception.StreamlineException} carrying the right
 * {@code isRetryable()} flag.
 */
@FunctionalInterface
public interface RecordTransport {

    /**
     * Sends a single record.
     *
     * @param record the record
     * @return the metadata of the stored record
     */
    Future<RecordMetadata> send(OutgoingRecord record);
}
