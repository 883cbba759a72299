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

package dev.mars.streamline.client.exception;

/**
 * Maps control plane HTTP responses onto the Streamline exception taxonomy.
 */
public final class StreamlineExceptions {

    private StreamlineExceptions() {
    }

    /**
     * Creates the exception matching a non-2xx control plane response.
     *
     * @param statusCode the HTTP status code
     * @param path the request path (may be null)
     * @param body the response body (may be null or empty)
     * @return the exception to fail the request with
     */
    public static StreamlineException fromStatus(int statusCode, String path, String body) {
        String message = formatMessage(statusCode, path, body);
        switch (statusCode) {
            case 401:
                return new StreamlineAuthenticationException(message);
            case 403:
                return new StreamlineAuthorizationException(message);
            case 408:
            case 504:
                return new StreamlineTimeoutException(message);
            case 503:
                return new StreamlineConnectionException(message);
            default:
                return new StreamlineException(message, StreamlineErrorCode.UNKNOWN, false);
        }
    }

    private static String formatMessage(int statusCode, String path, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("HTTP ").append(statusCode);
        if (path != null) {
            sb.append(" from ").append(path);
        }
        if (body != null && !body.isBlank()) {
            sb.append(": ").append(body.strip());
        }
        return sb.toString();
    }
}
