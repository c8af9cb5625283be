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

package me.golemcore.context.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval channel that produced a context item.
 */
public enum ContextSource {

    RESOLVED_ENTITY("resolved_entity"),
    SEMANTIC_SEARCH("semantic_search"),
    TEXT_SEARCH("text_search"),
    CONVERSATION("conversation"),
    RELATED_ENTITY("related_entity"),
    RECENT_INTERACTION("recent_interaction"),
    TIME_BASED("time_based");

    private final String value;

    ContextSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value such as {@code semantic_search}.
     *
     * @throws IllegalArgumentException
     *             for unknown values
     */
    public static ContextSource fromValue(String value) {
        for (ContextSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown context source: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
