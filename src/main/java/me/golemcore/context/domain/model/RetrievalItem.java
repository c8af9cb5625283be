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

/**
 * A raw retrieval hit: one entity as seen through one channel, with the
 * channel's own relevance estimate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrievalItem {

    private EntityType entityType;
    private String entityId;
    private ContextEntity entity;
    private double relevance;
    private ContextSource source;
    private String relevanceReason;

    public static RetrievalItem of(ContextEntity entity, double relevance, ContextSource source, String reason) {
        return RetrievalItem.builder()
                .entityType(entity.getKind())
                .entityId(entity.getId())
                .entity(entity)
                .relevance(relevance)
                .source(source)
                .relevanceReason(reason)
                .build();
    }

    /**
     * Dedup key: the same real-world record seen through different channels
     * shares this key.
     */
    public String identityKey() {
        return identityKey(entityType, entityId);
    }

    public static String identityKey(EntityType entityType, String entityId) {
        return entityType + ":" + entityId;
    }
}
