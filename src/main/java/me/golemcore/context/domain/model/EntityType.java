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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of personal-data entities the engine can retrieve. Each constant knows
 * its wire value and the model class that carries it.
 */
public enum EntityType {

    PERSON("person", Person.class),
    PLACE("place", Place.class),
    EVENT("event", Event.class),
    TASK("task", Task.class),
    DEADLINE("deadline", Deadline.class),
    ROUTINE("routine", Routine.class),
    OPEN_LOOP("open_loop", OpenLoop.class),
    PROJECT("project", Project.class),
    NOTE("note", Note.class),
    OPPORTUNITY("opportunity", Opportunity.class);

    private final String value;
    private final Class<? extends ContextEntity> entityClass;

    EntityType(String value, Class<? extends ContextEntity> entityClass) {
        this.value = value;
        this.entityClass = entityClass;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends ContextEntity> getEntityClass() {
        return entityClass;
    }

    /**
     * Resolves a wire value such as {@code open_loop}. Returns {@code null} for
     * values that are not entity kinds (dates, times, references).
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
