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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token counts of one backend call, already mapped from the vendor's field
 * names ({@code prompt_tokens}, {@code input_tokens}, {@code eval_count}, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    @JsonProperty("input")
    private int inputTokens;

    @JsonProperty("output")
    private int outputTokens;

    @JsonIgnore
    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return new LlmUsage(inputTokens, outputTokens);
    }

    public static LlmUsage empty() {
        return new LlmUsage(0, 0);
    }
}
