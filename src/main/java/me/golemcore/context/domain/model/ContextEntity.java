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

import java.time.Instant;

/**
 * A personal-data record that can be retrieved as context. Implementations are
 * plain data holders, one per {@link EntityType}.
 */
public interface ContextEntity {

    String getId();

    Instant getDeletedAt();

    @JsonIgnore
    EntityType getKind();

    @JsonIgnore
    default boolean isDeleted() {
        return getDeletedAt() != null;
    }
}
