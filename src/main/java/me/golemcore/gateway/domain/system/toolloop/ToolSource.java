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

package me.golemcore.gateway.domain.system.toolloop;

import me.golemcore.gateway.domain.component.ToolComponent;

/**
 * Where a tool name resolves to. Every name resolves to exactly one kind;
 * {@code local} is only set for {@link Kind#LOCAL}.
 */
public record ToolSource(Kind kind, String toolName, ToolComponent local) {

    public enum Kind {
        LOCAL, PEER, UNKNOWN
    }

    public static ToolSource local(ToolComponent component) {
        return new ToolSource(Kind.LOCAL, component.getToolName(), component);
    }

    public static ToolSource peer(String toolName) {
        return new ToolSource(Kind.PEER, toolName, null);
    }

    public static ToolSource unknown(String toolName) {
        return new ToolSource(Kind.UNKNOWN, toolName, null);
    }

    public boolean isResolved() {
        return kind != Kind.UNKNOWN;
    }
}
