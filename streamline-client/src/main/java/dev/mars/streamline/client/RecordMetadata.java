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

import java.time.Instant;

/**
 * Where a produced record was stored.
 *
 * @param topic the topic
 * @param partition the partition
 * @param offset the offset within the partition
 * @param timestamp the broker timestamp of the record
 */
public record RecordMetadata(String topic, int partition, long offset, Instant timestamp) {
}
