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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record headers in insertion order.
 *
 * <p>Values are raw bytes; the string overloads encode and decode UTF-8. Adding a header with an
 * existing key replaces its value and keeps its position. Not thread-safe.
 */
public final class Headers implements Iterable<Map.Entry<String, byte[]>> {

    private final Map<String, byte[]> headers = new LinkedHashMap<>();

    /** Adds a header, replacing any value with the same key */
    public Headers add(String key, byte[] value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        headers.put(key, value.clone());
        return this;
    }

    /** Adds a UTF-8 encoded header, replacing any value with the same key */
    public Headers add(String key, String value) {
        Objects.requireNonNull(value, "value must not be null");
        return add(key, value.getBytes(StandardCharsets.UTF_8));
    }

    /** Returns a copy of the value for the key, or null if absent */
    public byte[] get(String key) {
        byte[] value = headers.get(key);
        return value != null ? value.clone() : null;
    }

    /** Returns the value for the key decoded as UTF-8, or null if absent */
    public String getString(String key) {
        byte[] value = headers.get(key);
        return value != null ? new String(value, StandardCharsets.UTF_8) : null;
    }

    public boolean containsKey(String key) {
        return headers.containsKey(key);
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    public int size() {
        return headers.size();
    }

    @Override
    public Iterator<Map.Entry<String, byte[]>> iterator() {
        return Collections.unmodifiableMap(headers).entrySet().iterator();
    }

    @Override
    public String toString() {
        return "Headers" + headers.keySet();
    }
}
