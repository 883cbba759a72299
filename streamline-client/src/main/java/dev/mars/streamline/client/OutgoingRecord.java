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


package dev.mars.streamline.client;

import java.util.Objects;

/**
 * A record handed to the {@link dev.mars.streamline.client.spi.RecordTransport} for delivery.
 *
 * @param topic the destination topic
 * @param key the encoded key, or null
 * @param value the encoded value
 * @param headers the record headers, possibly empty
 */
public record OutgoingRecord(String topic, byte[] key, byte[] value, Headers headers) {

    public OutgoingRecord {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (headers == null) {
            headers = new Headers();
        }
    }
}
