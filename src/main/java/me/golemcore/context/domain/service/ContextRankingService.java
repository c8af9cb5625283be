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

import me.golemcore.context.domain.model.ContextEntity;
import me.golemcore.context.domain.model.ContextPackage;
import me.golemcore.context.domain.model.ContextSummary;
import me.golemcore.context.domain.model.Intent;
import me.golemcore.context.domain.model.RankedContext;
import me.golemcore.context.domain.model.RankedItem;
import me.golemcore.context.domain.model.RetrievalItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges retrieval hits that point at the same record and orders the result by
 * final relevance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextRankingService {

    private final RelevanceScorer relevanceScorer;
    private final EntitySummarizer entitySummarizer;
    private final ContextSummaryBuilder summaryBuilder;

    /**
     * Groups hits by identity in first-seen order, keeps the best score of each
     * group and unions its sources and reasons. Items with equal relevance keep
     * their first-seen order.
     */
    public List<RankedItem> mergeAndRank(List<RetrievalItem> items, Intent intent) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, RankedItem> grouped = new LinkedHashMap<>();
        for (RetrievalItem item : items) {
            if (item == null || item.getEntity() == null) {
                continue;
            }
            double score = relevanceScorer.score(item.getRelevance(), item.getSource(), item.getEntityType(),
                    intent);
            RankedItem existing = grouped.get(item.identityKey());
            if (existing == null) {
                grouped.put(item.identityKey(), toRankedItem(item, score));
                continue;
            }
            if (!existing.getSources().contains(item.getSource())) {
                existing.getSources().add(item.getSource());
            }
            addReason(existing, item.getRelevanceReason());
            existing.setRelevance(Math.max(existing.getRelevance(), score));
        }

        List<RankedItem> ranked = new ArrayList<>(grouped.values());
        ranked.sort(Comparator.comparingDouble(RankedItem::getRelevance).reversed());
        return ranked;
    }

    /**
     * Ranks every entity in the package and renders the prompt digest with the
     * configured budget.
     */
    public RankedContext rankContext(ContextPackage contextPackage, Intent intent) {
        List<RankedItem> ranked = mergeAndRank(contextPackage.allItems(), intent);
        ContextSummary summary = summaryBuilder.buildSummary(ranked, contextPackage.getConversation(),
                contextPackage.getRecentInteractions());
        log.debug("[ContextRanking] Ranked {} items, summary ~{} tokens", ranked.size(),
                summary.estimatedTokens());
        return RankedContext.builder()
                .topItems(ranked)
                .contextSummary(summary.text())
                .estimatedTokens(summary.estimatedTokens())
                .build();
    }

    private RankedItem toRankedItem(RetrievalItem item, double score) {
        ContextEntity entity = item.getEntity();
        RankedItem ranked = RankedItem.builder()
                .entityType(item.getEntityType())
                .entityId(item.getEntityId())
                .displayName(entitySummarizer.displayName(entity))
                .relevance(score)
                .summary(entitySummarizer.summarize(entity))
                .entity(entity)
                .build();
        ranked.getSources().add(item.getSource());
        addReason(ranked, item.getRelevanceReason());
        return ranked;
    }

    private void addReason(RankedItem ranked, String reason) {
        if (reason != null && !reason.isBlank() && !ranked.getRelevanceReasons().contains(reason)) {
            ranked.getRelevanceReasons().add(reason);
        }
    }
}
