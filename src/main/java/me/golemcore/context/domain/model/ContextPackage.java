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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one retrieval produced, before ranking. Unmodifiable once built so
 * it can be cached and re-ranked against another intent.
 */
@Getter
public final class ContextPackage {

    private final Map<EntityType, List<RetrievalItem>> itemsByType;
    private final List<ConversationMessage> conversation;
    private final List<SemanticMatch> semanticMatches;
    private final List<Interaction> recentInteractions;
    private final RetrievalStats stats;

    private ContextPackage(Builder builder) {
        Map<EntityType, List<RetrievalItem>> items = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            List<RetrievalItem> typed = builder.itemsByType.get(type);
            items.put(type, typed != null ? List.copyOf(typed) : List.of());
        }
        this.itemsByType = Collections.unmodifiableMap(items);
        this.conversation = List.copyOf(builder.conversation);
        this.semanticMatches = List.copyOf(builder.semanticMatches);
        this.recentInteractions = List.copyOf(builder.recentInteractions);
        this.stats = builder.stats != null ? builder.stats : new RetrievalStats();
    }

    public List<RetrievalItem> getItems(EntityType type) {
        return itemsByType.get(type);
    }

    /**
     * All entity-bearing items, grouped in {@link EntityType} declaration order.
     */
    public List<RetrievalItem> allItems() {
        List<RetrievalItem> all = new ArrayList<>();
        for (EntityType type : EntityType.values()) {
            all.addAll(itemsByType.get(type));
        }
        return all;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ContextPackage empty() {
        return builder().build();
    }

    public static final class Builder {

        private final Map<EntityType, List<RetrievalItem>> itemsByType = new EnumMap<>(EntityType.class);
        private List<ConversationMessage> conversation = List.of();
        private List<SemanticMatch> semanticMatches = List.of();
        private List<Interaction> recentInteractions = List.of();
        private RetrievalStats stats;

        private Builder() {
        }

        public Builder items(EntityType type, List<RetrievalItem> items) {
            itemsByType.put(type, items != null ? items : List.of());
            return this;
        }

        public Builder conversation(List<ConversationMessage> conversation) {
            this.conversation = conversation != null ? conversation : List.of();
            return this;
        }

        public Builder semanticMatches(List<SemanticMatch> semanticMatches) {
            this.semanticMatches = semanticMatches != null ? semanticMatches : List.of();
            return this;
        }

        public Builder recentInteractions(List<Interaction> recentInteractions) {
            this.recentInteractions = recentInteractions != null ? recentInteractions : List.of();
            return this;
        }

        public Builder stats(RetrievalStats stats) {
            this.stats = stats;
            return this;
        }

        public ContextPackage build() {
            return new ContextPackage(this);
        }
    }
}
