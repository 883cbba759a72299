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


package dev.mars.streamline.client.connection;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request forwarded to the control plane by {@link ConnectionManager#send(BrokerRequest)}.
 *
 * <p>The body is sent as-is; the manager does not inspect or encode it.
 *
 * @param method the HTTP method
 * @param path the request path, starting with {@code /}
 * @param body the request body, or null for none
 * @param headers request headers in insertion order
 */
public record BrokerRequest(HttpMethod method, String path, Buffer body, Map<String, String> headers) {

    public BrokerRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/', was " + path);
        }
        headers = headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /** Creates a GET request without a body */
    public static BrokerRequest get(String path) {
        return new BrokerRequest(HttpMethod.GET, path, null, null);
    }

    /** Creates a POST request with the given body */
    public static BrokerRequest post(String path, Buffer body) {
        return new BrokerRequest(HttpMethod.POST, path, body, null);
    }

    /**
     * Returns a copy of this request with an additional header. An existing header with the same
     * name is replaced.
     */
    public BrokerRequest withHeader(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new BrokerRequest(method, path, body, copy);
    }
}
