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

package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextSource;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.IntentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable weight tables used by {@link RelevanceScorer}: how much each
 * retrieval channel is trusted, how strongly each intent favours each entity
 * kind, and the boost applied when the message mentions a kind.
 */
public final class RelevanceWeights {

    public static final double DEFAULT_MENTION_BOOST = 1.2;

    private final Map<ContextSource, Double> sourceWeights;
    private final Map<IntentCategory, Map<EntityType, Double>> intentWeights;
    private final double mentionBoost;

    private RelevanceWeights(Map<ContextSource, Double> sourceWeights,
            Map<IntentCategory, Map<EntityType, Double>> intentWeights, double mentionBoost) {
        Map<ContextSource, Double> sources = new EnumMap<>(ContextSource.class);
        sources.putAll(sourceWeights);
        this.sourceWeights = Collections.unmodifiableMap(sources);
        Map<IntentCategory, Map<EntityType, Double>> copy = new EnumMap<>(IntentCategory.class);
        intentWeights.forEach((category, weights) -> copy.put(category, Collections.unmodifiableMap(copyOf(weights))));
        this.intentWeights = Collections.unmodifiableMap(copy);
        this.mentionBoost = mentionBoost;
    }

    public static RelevanceWeights defaults() {
        Map<ContextSource, Double> sources = new EnumMap<>(ContextSource.class);
        sources.put(ContextSource.RESOLVED_ENTITY, 1.0);
        sources.put(ContextSource.SEMANTIC_SEARCH, 0.8);
        sources.put(ContextSource.TEXT_SEARCH, 0.7);
        sources.put(ContextSource.CONVERSATION, 0.6);
        sources.put(ContextSource.RELATED_ENTITY, 0.5);
        sources.put(ContextSource.RECENT_INTERACTION, 0.4);
        sources.put(ContextSource.TIME_BASED, 0.3);

        Map<IntentCategory, Map<EntityType, Double>> intents = new EnumMap<>(IntentCategory.class);
        intents.put(IntentCategory.SCHEDULE, Map.of(
                EntityType.EVENT, 1.2,
                EntityType.PERSON, 1.1,
                EntityType.PLACE, 1.0));
        intents.put(IntentCategory.TASK, Map.of(
                EntityType.TASK, 1.3,
                EntityType.DEADLINE, 1.2,
                EntityType.PROJECT, 1.1));
        intents.put(IntentCategory.COMMUNICATE, Map.of(
                EntityType.PERSON, 1.2));
        intents.put(IntentCategory.REMIND, Map.of(
                EntityType.TASK, 1.2,
                EntityType.DEADLINE, 1.2,
                EntityType.ROUTINE, 1.1));
        intents.put(IntentCategory.SUMMARIZE, Map.of(
                EntityType.PROJECT, 1.1,
                EntityType.NOTE, 1.1));

        return new RelevanceWeights(sources, intents, DEFAULT_MENTION_BOOST);
    }

    /**
     * Returns a copy with individual entries replaced. Keys are wire values
     * ({@code semantic_search}, {@code schedule}, {@code event}).
     *
     * @throws IllegalArgumentException
     *             when a key names an unknown source, intent or entity kind
     */
    public RelevanceWeights withOverrides(Map<String, Double> sourceOverrides,
            Map<String, Map<String, Double>> intentOverrides, double mentionBoost) {
        Map<ContextSource, Double> sources = new EnumMap<>(ContextSource.class);
        sources.putAll(sourceWeights);
        if (sourceOverrides != null) {
            sourceOverrides.forEach((key, weight) -> sources.put(ContextSource.fromValue(key), weight));
        }

        Map<IntentCategory, Map<EntityType, Double>> intents = new EnumMap<>(IntentCategory.class);
        intentWeights.forEach((category, weights) -> intents.put(category, copyOf(weights)));
        if (intentOverrides != null) {
            intentOverrides.forEach((categoryKey, weights) -> {
                IntentCategory category = IntentCategory.fromValue(categoryKey);
                if (category == IntentCategory.UNKNOWN && !"unknown".equalsIgnoreCase(categoryKey)) {
                    throw new IllegalArgumentException("Unknown intent category: " + categoryKey);
                }
                Map<EntityType, Double> target = intents.computeIfAbsent(category,
                        c -> new EnumMap<>(EntityType.class));
                weights.forEach((typeKey, weight) -> {
                    EntityType type = EntityType.fromValue(typeKey);
                    if (type == null) {
                        throw new IllegalArgumentException("Unknown entity type: " + typeKey);
                    }
                    target.put(type, weight);
                });
            });
        }

        return new RelevanceWeights(sources, intents, mentionBoost);
    }

    public double sourceWeight(ContextSource source) {
        return sourceWeights.getOrDefault(source, 1.0);
    }

    /**
     * Multiplier for an entity kind under an intent; 1.0 for unmapped pairs.
     */
    public double intentWeight(IntentCategory category, EntityType entityType) {
        if (category == null || entityType == null) {
            return 1.0;
        }
        Map<EntityType, Double> weights = intentWeights.get(category);
        if (weights == null) {
            return 1.0;
        }
        return weights.getOrDefault(entityType, 1.0);
    }

    public double getMentionBoost() {
        return mentionBoost;
    }

    private static Map<EntityType, Double> copyOf(Map<EntityType, Double> weights) {
        Map<EntityType, Double> copy = new EnumMap<>(EntityType.class);
        copy.putAll(weights);
        return copy;
    }
}
