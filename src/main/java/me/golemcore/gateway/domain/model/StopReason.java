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

package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the backend stopped generating. Every vendor value is folded into one of
 * these four.
 */
public enum StopReason {

    END_TURN("end_turn"), TOOL_USE("tool_use"), MAX_TOKENS("max_tokens"), STOP_SEQUENCE("stop_sequence");

    private final String wireName;

    StopReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Parses the persisted name; unknown or missing values mean a normal end of
     * turn.
     */
    @JsonCreator
    public static StopReason fromWire(String value) {
        if (value == null) {
            return END_TURN;
        }
        for (StopReason reason : values()) {
            if (reason.wireName.equals(value)) {
                return reason;
            }
        }
        return END_TURN;
    }
}
