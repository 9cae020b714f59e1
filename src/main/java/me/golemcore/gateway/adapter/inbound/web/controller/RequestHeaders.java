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

package me.golemcore.gateway.adapter.inbound.web.controller;

/**
 * Caller identity headers set by the fronting web application.
 */
final class RequestHeaders {

    static final String USER_ID = "X-User-Id";
    static final String USER_TIER = "X-User-Tier";
    static final String ANONYMOUS = "anonymous";
    static final String DEFAULT_TIER = "free";

    private RequestHeaders() {
    }
}
