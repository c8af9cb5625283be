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
import me.golemcore.context.domain.model.Intent;
import me.golemcore.context.domain.model.IntentCategory;
import me.golemcore.context.domain.model.SemanticMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores retrieval hits against the current intent.
 *
 * <p>
 * Final score is {@code raw x sourceWeight x intentWeight x mentionBoost},
 * clamped to [0, 1]. The boost applies when the intent mentions the entity's
 * kind or carries a generic reference.
 */
@Service
@RequiredArgsConstructor
public class RelevanceScorer {

    private static final double MAX_SCORE = 1.0;
    private static final double MIN_SCORE = 0.0;

    private final RelevanceWeights weights;

    public double score(double rawRelevance, ContextSource source, EntityType entityType, Intent intent) {
        double score = rawRelevance;
        score *= weights.sourceWeight(source);
        score *= weights.intentWeight(categoryOf(intent), entityType);
        if (intent != null && intent.mentions(entityType)) {
            score *= weights.getMentionBoost();
        }
        return clamp(score);
    }

    /**
     * Re-weights semantic similarities by the intent's entity preferences and
     * sorts them best first. Ties keep their input order.
     */
    public List<SemanticMatch> rankSemanticMatches(List<SemanticMatch> matches, Intent intent) {
        if (matches == null || matches.isEmpty()) {
            return List.of();
        }
        IntentCategory category = categoryOf(intent);
        List<SemanticMatch> ranked = new ArrayList<>(matches.size());
        for (SemanticMatch match : matches) {
            double boost = weights.intentWeight(category, match.getEntityType());
            ranked.add(match.toBuilder()
                    .similarity(Math.min(MAX_SCORE, match.getSimilarity() * boost))
                    .build());
        }
        ranked.sort(Comparator.comparingDouble(SemanticMatch::getSimilarity).reversed());
        return ranked;
    }

    /**
     * Proximity of a point in time to the reference, in either direction.
     */
    public double timeRelevance(Instant when, Instant reference) {
        double days = Math.abs(Duration.between(reference, when).toMillis()) / (double) Duration.ofDays(1).toMillis();
        if (days <= 1) {
            return 1.0;
        }
        if (days <= 7) {
            return 0.8;
        }
        if (days <= 30) {
            return 0.6;
        }
        if (days <= 90) {
            return 0.4;
        }
        return 0.2;
    }

    /**
     * Recency of a past interaction, bucketed by hours: within the hour, day,
     * week or month.
     */
    public double recencyRelevance(Instant when, Instant reference) {
        double hours = Math.abs(Duration.between(when, reference).toMillis())
                / (double) Duration.ofHours(1).toMillis();
        if (hours <= 1) {
            return 1.0;
        }
        if (hours <= 24) {
            return 0.8;
        }
        if (hours <= 168) {
            return 0.6;
        }
        if (hours <= 720) {
            return 0.4;
        }
        return 0.2;
    }

    private IntentCategory categoryOf(Intent intent) {
        return intent != null ? intent.getCategory() : IntentCategory.UNKNOWN;
    }

    private double clamp(double value) {
        if (Double.isNaN(value)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
