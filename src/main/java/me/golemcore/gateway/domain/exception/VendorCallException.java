/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.domain.exception;

/**
 * A backend call failed (network, authentication, rate limit or a malformed
 * reply). Never retried inside the gateway.
 */
public class VendorCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String provider;
    private final int statusCode;

    public VendorCallException(String provider, String message) {
        this(provider, -1, message, null);
    }

    public VendorCallException(String provider, String message, Throwable cause) {
        this(provider, -1, message, cause);
    }

    public VendorCallException(String provider, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * HTTP status returned by the backend, or -1 when the call never got one.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
