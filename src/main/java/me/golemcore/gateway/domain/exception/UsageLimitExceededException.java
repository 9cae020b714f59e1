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

import me.golemcore.gateway.domain.model.LimitCheck;

/**
 * The user has used up the daily allowance of their tier.
 */
public class UsageLimitExceededException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient LimitCheck limitCheck;

    public UsageLimitExceededException(LimitCheck limitCheck) {
        super("Daily usage limit reached for tier " + limitCheck.getTier());
        this.limitCheck = limitCheck;
    }

    public LimitCheck getLimitCheck() {
        return limitCheck;
    }
}
