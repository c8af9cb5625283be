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

package me.golemcore.context.adapter.outbound.search;

import me.golemcore.context.domain.model.ContextEntity;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.RetrievalItem;
import me.golemcore.context.domain.model.SemanticSearchHit;
import me.golemcore.context.domain.service.EntitySummarizer;
import me.golemcore.context.port.outbound.EmbeddingPort;
import me.golemcore.context.port.outbound.EntityStorePort;
import me.golemcore.context.port.outbound.SemanticSearchPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Semantic search over the user's records using text embeddings.
 *
 * <p>
 * Each record is embedded through its one-line summary. Embeddings are cached
 * in memory keyed by user and record identity, next to the summary they were
 * computed from: an edited record is re-embedded and replaces its old vector,
 * and records no longer listed for a searched kind are evicted. Only missing or
 * stale embeddings are computed, in one batch per search.
 *
 * <p>
 * Thread-safe implementation using {@link ConcurrentHashMap}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingSemanticSearchAdapter implements SemanticSearchPort {

    private final EmbeddingPort embeddingPort;
    private final EntityStorePort entityStorePort;
    private final EntitySummarizer entitySummarizer;

    private final Map<String, CachedEmbedding> embeddingCache = new ConcurrentHashMap<>();

    @Override
    public List<SemanticSearchHit> search(String userId, String query, List<EntityType> entityTypes, int limit,
            double minSimilarity) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        if (!embeddingPort.isAvailable()) {
            throw new IllegalStateException("Embedding service not available");
        }

        List<EntityType> types = entityTypes == null || entityTypes.isEmpty()
                ? Arrays.asList(EntityType.values())
                : entityTypes;
        List<Candidate> candidates = new ArrayList<>();
        for (EntityType type : types) {
            for (ContextEntity entity : entityStorePort.listAll(userId, type)) {
                String text = entitySummarizer.summarize(entity);
                candidates.add(new Candidate(entity, text, cacheKey(userId, entity)));
            }
        }
        evictUnlisted(userId, types, candidates);
        if (candidates.isEmpty()) {
            return List.of();
        }

        float[] queryEmbedding = await(embeddingPort.embed(query));
        indexMissing(candidates);

        List<SemanticSearchHit> hits = new ArrayList<>();
        for (Candidate candidate : candidates) {
            CachedEmbedding cached = embeddingCache.get(candidate.cacheKey());
            if (cached == null) {
                continue;
            }
            double similarity = embeddingPort.cosineSimilarity(queryEmbedding, cached.vector());
            if (similarity >= minSimilarity) {
                hits.add(SemanticSearchHit.builder()
                        .entityType(candidate.entity().getKind())
                        .entityId(candidate.entity().getId())
                        .score(similarity)
                        .snippet(candidate.text())
                        .entity(candidate.entity())
                        .build());
            }
        }

        List<SemanticSearchHit> result = hits.stream()
                .sorted(Comparator.comparingDouble(SemanticSearchHit::getScore).reversed())
                .limit(limit)
                .toList();
        log.debug("[SemanticSearch] {} of {} candidates above {} for user {}", result.size(), candidates.size(),
                minSimilarity, userId);
        return result;
    }

    /**
     * Drops every cached embedding.
     */
    public void clear() {
        embeddingCache.clear();
        log.info("[SemanticSearch] Embedding cache cleared");
    }

    int cachedEmbeddings() {
        return embeddingCache.size();
    }

    private void indexMissing(List<Candidate> candidates) {
        List<Candidate> missing = candidates.stream()
                .filter(candidate -> !isFresh(embeddingCache.get(candidate.cacheKey()), candidate.text()))
                .toList();
        if (missing.isEmpty()) {
            return;
        }

        List<float[]> embeddings = await(embeddingPort.embedBatch(missing.stream().map(Candidate::text).toList()));
        if (embeddings.size() != missing.size()) {
            throw new IllegalStateException("Embedding batch returned " + embeddings.size() + " vectors for "
                    + missing.size() + " texts");
        }
        for (int i = 0; i < missing.size(); i++) {
            Candidate candidate = missing.get(i);
            embeddingCache.put(candidate.cacheKey(),
                    new CachedEmbedding(candidate.entity().getKind(), candidate.text(), embeddings.get(i)));
        }
        log.debug("[SemanticSearch] Indexed {} records", missing.size());
    }

    /**
     * Drops cached vectors of this user's records that are gone from the kinds
     * just listed, such as deleted records.
     */
    private void evictUnlisted(String userId, List<EntityType> types, List<Candidate> candidates) {
        String prefix = userPrefix(userId);
        Set<String> listed = new HashSet<>();
        candidates.forEach(candidate -> listed.add(candidate.cacheKey()));
        boolean evicted = embeddingCache.entrySet().removeIf(entry -> entry.getKey().startsWith(prefix)
                && types.contains(entry.getValue().type())
                && !listed.contains(entry.getKey()));
        if (evicted) {
            log.debug("[SemanticSearch] Evicted embeddings of removed records for user {}", userId);
        }
    }

    private boolean isFresh(CachedEmbedding cached, String text) {
        return cached != null && cached.text().equals(text);
    }

    private String cacheKey(String userId, ContextEntity entity) {
        return userPrefix(userId) + RetrievalItem.identityKey(entity.getKind(), entity.getId());
    }

    private String userPrefix(String userId) {
        return userId + "/";
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Embedding request failed", cause);
        }
    }

    private record Candidate(ContextEntity entity, String text, String cacheKey) {
    }

    private record CachedEmbedding(EntityType type, String text, float[] vector) {
    }
}
