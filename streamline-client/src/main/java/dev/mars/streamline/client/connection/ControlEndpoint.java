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

import dev.mars.streamline.client.exception.StreamlineConfigurationException;

/**
 * Host and port of the Streamline HTTP control plane.
 *
 * @param host the control plane host
 * @param port the control plane port
 */
public record ControlEndpoint(String host, int port) {

    public ControlEndpoint {
        if (host == null || host.isBlank()) {
            throw new StreamlineConfigurationException("Control endpoint host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new StreamlineConfigurationException("Control endpoint port must be in 1..65535, was " + port);
        }
    }

    /**
     * Derives the control endpoint from a bootstrap server list.
     *
     * <p>Only the first comma-separated entry is used. Its host is the part before the last
     * {@code ':'}, or the whole entry when it has no port. Brackets around IPv6 literals are
     * removed.
     *
     * @param bootstrapServers comma-separated {@code host:port} entries
     * @param controlPort the control plane port
     * @return the control endpoint
     * @throws StreamlineConfigurationException if no host can be derived
     */
    public static ControlEndpoint fromBootstrapServers(String bootstrapServers, int controlPort) {
        if (bootstrapServers == null) {
            throw new StreamlineConfigurationException("bootstrapServers must not be null");
        }
        String server = bootstrapServers.split(",", -1)[0].trim();
        int colon = server.lastIndexOf(':');
        String host = colon >= 0 ? server.substring(0, colon) : server;
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isBlank()) {
            throw new StreamlineConfigurationException("No host in bootstrap servers '" + bootstrapServers + "'");
        }
        return new ControlEndpoint(host, controlPort);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
