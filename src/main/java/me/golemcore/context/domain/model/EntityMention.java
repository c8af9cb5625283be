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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A span of the user's message the classifier recognised as an entity. The
 * type is free-form: besides entity kinds it can be {@code date}, {@code time}
 * or the generic {@code reference}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntityMention {

    public static final String REFERENCE_TYPE = "reference";

    private String type;
    private String text;
    private double confidence;
    private boolean needsResolution;

    @JsonIgnore
    public EntityType getEntityType() {
        return EntityType.fromValue(type);
    }

    @JsonIgnore
    public boolean isReference() {
        return REFERENCE_TYPE.equalsIgnoreCase(type);
    }
}
