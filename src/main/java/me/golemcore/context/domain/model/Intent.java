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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured interpretation of the user's message produced upstream. Treated
 * as read-only input by the retrieval engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Intent {

    @Builder.Default
    private IntentCategory category = IntentCategory.UNKNOWN;

    private String summary;
    private double confidence;

    @Builder.Default
    private List<EntityMention> entities = new ArrayList<>();

    @Builder.Default
    private List<Assumption> assumptions = new ArrayList<>();

    /**
     * Whether the message explicitly mentions something of the given kind, or
     * contains a generic reference that could point at it.
     */
    public boolean mentions(EntityType entityType) {
        if (entities == null || entities.isEmpty()) {
            return false;
        }
        for (EntityMention mention : entities) {
            if (mention == null) {
                continue;
            }
            if (mention.isReference() || entityType == mention.getEntityType()) {
                return true;
            }
        }
        return false;
    }
}
