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
import me.golemcore.context.domain.model.ContextSource;
import me.golemcore.context.domain.model.ConversationMessage;
import me.golemcore.context.domain.model.Deadline;
import me.golemcore.context.domain.model.EntityMention;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.Event;
import me.golemcore.context.domain.model.Intent;
import me.golemcore.context.domain.model.IntentCategory;
import me.golemcore.context.domain.model.Interaction;
import me.golemcore.context.domain.model.Person;
import me.golemcore.context.domain.model.RankedContext;
import me.golemcore.context.domain.model.ResolutionResult;
import me.golemcore.context.domain.model.ResolvedEntity;
import me.golemcore.context.domain.model.RetrievalItem;
import me.golemcore.context.domain.model.RetrievalOptions;
import me.golemcore.context.domain.model.RetrievalStats;
import me.golemcore.context.domain.model.SemanticFilters;
import me.golemcore.context.domain.model.SemanticMatch;
import me.golemcore.context.domain.model.SemanticSearchHit;
import me.golemcore.context.domain.model.Task;
import me.golemcore.context.infrastructure.config.AutoConfiguration;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.port.outbound.ConversationPort;
import me.golemcore.context.port.outbound.EntityStorePort;
import me.golemcore.context.port.outbound.InteractionLogPort;
import me.golemcore.context.port.outbound.SemanticSearchPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Gathers context for one user turn.
 *
 * <p>
 * {@link #retrieve} fans out to five sources in parallel on the retrieval
 * executor:
 * <ul>
 * <li>records named in the message
 * <li>semantic search over the intent summary (optional, degrades to empty)
 * <li>time-based lookups driven by the intent category
 * <li>recent conversation messages
 * <li>recent user actions
 * </ul>
 * The first failure of a required source, the overall deadline, or a
 * saturated executor aborts the call with {@link ContextRetrievalException};
 * sub-retrievals still running are then interrupted. Results are deduplicated per
 * entity kind and returned as an unmodifiable {@link ContextPackage}.
 */
@Service
@Slf4j
public class ContextRetrievalService {

    private static final double MENTION_RELEVANCE = 0.9;
    private static final double RELATED_RELEVANCE = 0.6;
    private static final double UNDATED_TASK_RELEVANCE = 0.5;
    private static final int DEFAULT_SEMANTIC_LIMIT = 10;
    private static final double DEFAULT_MIN_SIMILARITY = 0.5;

    private static final String REASON_MENTIONED = "Mentioned in message";
    private static final String REASON_RESOLVED = "Directly resolved from message";
    private static final String REASON_RELATED = "Related to mentioned person";
    private static final String REASON_SEMANTIC = "Semantically similar";
    private static final String REASON_UPCOMING_EVENT = "Upcoming event";
    private static final String REASON_UPCOMING_TASK = "Upcoming task";
    private static final String REASON_UPCOMING_DEADLINE = "Upcoming deadline";

    private final EntityStorePort entityStorePort;
    private final SemanticSearchPort semanticSearchPort;
    private final ConversationPort conversationPort;
    private final InteractionLogPort interactionLogPort;
    private final RelevanceScorer relevanceScorer;
    private final ContextRankingService rankingService;
    private final ContextEngineProperties properties;
    private final Clock clock;
    private final AsyncTaskExecutor executor;

    public ContextRetrievalService(EntityStorePort entityStorePort, SemanticSearchPort semanticSearchPort,
            ConversationPort conversationPort, InteractionLogPort interactionLogPort,
            RelevanceScorer relevanceScorer, ContextRankingService rankingService,
            ContextEngineProperties properties, Clock clock,
            @Qualifier(AutoConfiguration.RETRIEVAL_EXECUTOR) AsyncTaskExecutor executor) {
        this.entityStorePort = entityStorePort;
        this.semanticSearchPort = semanticSearchPort;
        this.conversationPort = conversationPort;
        this.interactionLogPort = interactionLogPort;
        this.relevanceScorer = relevanceScorer;
        this.rankingService = rankingService;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    public ContextPackage retrieve(String userId, Intent intent, RetrievalOptions options) {
        RetrievalOptions opts = options != null ? options : RetrievalOptions.defaults();
        Intent safeIntent = intent != null ? intent : new Intent();
        IntentCategory category = safeIntent.getCategory();
        long startNanos = System.nanoTime();
        Instant now = clock.instant();

        log.debug("[ContextRetrieval] Retrieving for user {}: category={}, mentions={}", userId, category,
                safeIntent.getEntities() != null ? safeIntent.getEntities().size() : 0);

        List<RetrievalTask<?>> tasks = new ArrayList<>();
        CompletableFuture<List<RetrievalItem>> resolutionFuture;
        CompletableFuture<List<SemanticMatch>> semanticFuture;
        CompletableFuture<List<RetrievalItem>> timeBasedFuture;
        CompletableFuture<List<ConversationMessage>> conversationFuture;
        CompletableFuture<List<Interaction>> interactionsFuture;
        try {
            resolutionFuture = submit(tasks, () -> retrieveMentioned(userId, safeIntent, opts));
            semanticFuture = submitSemantic(tasks, userId, safeIntent, opts);
            timeBasedFuture = submit(tasks, () -> retrieveTimeBased(userId, category, opts, now));
            conversationFuture = submit(tasks, () -> retrieveConversation(opts));
            interactionsFuture = submit(tasks, () -> retrieveInteractions(userId, opts));
        } catch (RejectedExecutionException e) {
            cancelAll(tasks);
            log.error("[ContextRetrieval] Retrieval executor saturated for user {}: {}", userId, e.getMessage());
            throw new ContextRetrievalException(ContextRetrievalException.Code.RETRIEVAL_FAILED,
                    "Failed to retrieve context: retrieval executor rejected the request", userId, category, e);
        }

        List<CompletableFuture<?>> futures = List.of(resolutionFuture, semanticFuture, timeBasedFuture,
                conversationFuture, interactionsFuture);
        awaitAll(futures, tasks, resolveTimeout(opts), userId, category);

        List<RetrievalItem> resolved = resolutionFuture.join();
        List<SemanticMatch> semanticMatches = semanticFuture.join();
        List<RetrievalItem> timeBased = timeBasedFuture.join();
        List<ConversationMessage> conversation = conversationFuture.join();
        List<Interaction> interactions = interactionsFuture.join();

        List<RetrievalItem> semanticItems = toSemanticItems(semanticMatches);
        List<RetrievalItem> combined = new ArrayList<>(resolved.size() + semanticItems.size() + timeBased.size());
        combined.addAll(resolved);
        combined.addAll(semanticItems);
        combined.addAll(timeBased);

        RetrievalStats stats = RetrievalStats.builder()
                .fromResolution(resolved.size())
                .fromSemanticSearch(semanticMatches.size())
                .fromTimeBased(timeBased.size())
                .fromConversation(conversation.size())
                .fromRecentInteractions(interactions.size())
                .build();
        stats.setTotalItems(stats.getFromResolution() + stats.getFromSemanticSearch() + stats.getFromTimeBased()
                + stats.getFromConversation() + stats.getFromRecentInteractions());
        stats.setDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));

        ContextPackage.Builder builder = ContextPackage.builder()
                .conversation(conversation)
                .semanticMatches(semanticMatches)
                .recentInteractions(interactions)
                .stats(stats);
        mergeByType(combined).forEach(builder::items);

        log.info("[ContextRetrieval] Retrieved {} items for user {} in {}ms", stats.getTotalItems(), userId,
                stats.getDurationMs());
        return builder.build();
    }

    /**
     * Builds a package from an upstream resolver's output. With
     * {@code includeRelated}, upcoming events mentioning a resolved person are
     * added as related items.
     */
    public ContextPackage retrieveFromResolution(String userId, ResolutionResult resolution,
            RetrievalOptions options) {
        RetrievalOptions opts = options != null ? options : RetrievalOptions.defaults();
        long startNanos = System.nanoTime();

        try {
            Map<EntityType, List<RetrievalItem>> byType = new EnumMap<>(EntityType.class);
            int fromResolution = 0;
            List<ResolvedEntity> resolvedEntities = resolution != null && resolution.getResolved() != null
                    ? resolution.getResolved()
                    : List.of();
            for (ResolvedEntity resolved : resolvedEntities) {
                ContextEntity match = resolved.getMatch();
                if (match == null) {
                    continue;
                }
                byType.computeIfAbsent(match.getKind(), t -> new ArrayList<>())
                        .add(RetrievalItem.of(match, resolved.getConfidence(), ContextSource.RESOLVED_ENTITY,
                                REASON_RESOLVED));
                fromResolution++;
            }

            int fromRelated = 0;
            if (opts.isIncludeRelated()) {
                fromRelated = addRelatedEvents(userId, byType, opts);
            }

            RetrievalStats stats = RetrievalStats.builder()
                    .fromResolution(fromResolution)
                    .fromRelated(fromRelated)
                    .totalItems(fromResolution + fromRelated)
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                    .build();

            ContextPackage.Builder builder = ContextPackage.builder().stats(stats);
            byType.forEach(builder::items);
            log.debug("[ContextRetrieval] Built package from resolution for user {}: {} resolved, {} related",
                    userId, fromResolution, fromRelated);
            return builder.build();
        } catch (RuntimeException e) {
            log.error("[ContextRetrieval] Resolution retrieval failed for user {}: {}", userId, e.getMessage());
            throw new ContextRetrievalException(ContextRetrievalException.Code.RETRIEVAL_FAILED,
                    "Failed to retrieve context: " + e.getMessage(), userId, null, e);
        }
    }

    /**
     * Standalone semantic search. Never fails: an unavailable backend yields an
     * empty list.
     */
    public List<SemanticMatch> searchSemantic(String userId, String query, SemanticFilters filters) {
        SemanticFilters safeFilters = filters != null ? filters : new SemanticFilters();
        int limit = safeFilters.getLimit() != null && safeFilters.getLimit() > 0
                ? safeFilters.getLimit()
                : DEFAULT_SEMANTIC_LIMIT;
        double minSimilarity = safeFilters.getMinSimilarity() != null && safeFilters.getMinSimilarity() > 0
                ? safeFilters.getMinSimilarity()
                : DEFAULT_MIN_SIMILARITY;
        try {
            return toMatches(semanticSearchPort.search(userId, query, safeFilters.getEntityTypes(), limit,
                    minSimilarity));
        } catch (RuntimeException e) {
            log.warn("[ContextRetrieval] Semantic search failed for user {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Last {@code maxMessages} messages of a conversation, oldest first. Empty
     * when no conversation is given.
     */
    public List<ConversationMessage> getConversationContext(String conversationId, int maxMessages) {
        if (conversationId == null || conversationId.isBlank() || maxMessages <= 0) {
            return List.of();
        }
        return conversationPort.listMessages(conversationId, maxMessages);
    }

    public List<Interaction> getRecentInteractions(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return interactionLogPort.recentActions(userId, limit);
    }

    public RankedContext rankContext(ContextPackage contextPackage, Intent intent) {
        return rankingService.rankContext(contextPackage, intent);
    }

    private List<RetrievalItem> retrieveMentioned(String userId, Intent intent, RetrievalOptions opts) {
        if (intent.getEntities() == null || intent.getEntities().isEmpty()) {
            return List.of();
        }

        Map<EntityType, List<String>> namesByType = new EnumMap<>(EntityType.class);
        for (EntityMention mention : intent.getEntities()) {
            EntityType type = mention != null ? mention.getEntityType() : null;
            if (type == null || mention.getText() == null || mention.getText().isBlank()) {
                continue;
            }
            namesByType.computeIfAbsent(type, t -> new ArrayList<>()).add(mention.getText());
        }

        List<RetrievalItem> items = new ArrayList<>();
        namesByType.forEach((type, names) -> {
            for (ContextEntity entity : entityStorePort.findByNames(userId, names, type, opts.limitFor(type))) {
                items.add(RetrievalItem.of(entity, MENTION_RELEVANCE, ContextSource.RESOLVED_ENTITY,
                        REASON_MENTIONED));
            }
        });
        return items;
    }

    /**
     * Semantic search never fails the retrieval: rejection, errors and the
     * per-source timeout all yield an empty list. A timed-out search is
     * interrupted.
     */
    private CompletableFuture<List<SemanticMatch>> submitSemantic(List<RetrievalTask<?>> tasks, String userId,
            Intent intent, RetrievalOptions opts) {
        String query = intent.getSummary();
        if (!opts.isUseSemanticSearch() || query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }

        RetrievalTask<List<SemanticMatch>> task;
        try {
            task = start(() -> relevanceScorer.rankSemanticMatches(searchSemanticStrict(userId, query, opts),
                    intent));
        } catch (RejectedExecutionException e) {
            log.warn("[ContextRetrieval] Semantic search rejected by executor for user {}, continuing without it",
                    userId);
            return CompletableFuture.completedFuture(List.of());
        }
        tasks.add(task);

        Duration semanticTimeout = properties.getRetrieval().getSemanticTimeout();
        return task.result()
                .orTimeout(semanticTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    task.cancel();
                    log.warn("[ContextRetrieval] Semantic search unavailable for user {}, continuing without it: {}",
                            userId, unwrap(e).toString());
                    return List.of();
                });
    }

    private List<SemanticMatch> searchSemanticStrict(String userId, String query, RetrievalOptions opts) {
        return toMatches(semanticSearchPort.search(userId, query, opts.getFocusEntityTypes(),
                opts.getMaxSemanticMatches(), opts.getMinSimilarity()));
    }

    private List<SemanticMatch> toMatches(List<SemanticSearchHit> hits) {
        List<SemanticMatch> matches = new ArrayList<>(hits.size());
        for (SemanticSearchHit hit : hits) {
            matches.add(SemanticMatch.builder()
                    .entityType(hit.getEntityType())
                    .entityId(hit.getEntityId())
                    .similarity(hit.getScore())
                    .content(hit.getSnippet() != null ? hit.getSnippet() : "")
                    .entity(hit.getEntity())
                    .build());
        }
        return matches;
    }

    private List<RetrievalItem> toSemanticItems(List<SemanticMatch> matches) {
        List<RetrievalItem> items = new ArrayList<>();
        for (SemanticMatch match : matches) {
            if (match.getEntity() != null) {
                items.add(RetrievalItem.of(match.getEntity(), match.getSimilarity(), ContextSource.SEMANTIC_SEARCH,
                        REASON_SEMANTIC));
            }
        }
        return items;
    }

    private List<RetrievalItem> retrieveTimeBased(String userId, IntentCategory category, RetrievalOptions opts,
            Instant now) {
        List<RetrievalItem> items = new ArrayList<>();

        if (category == IntentCategory.SCHEDULE) {
            Instant windowEnd = now.plus(Duration.ofDays(properties.getRetrieval().getUpcomingEventDays()));
            for (ContextEntity entity : entityStorePort.findUpcoming(userId, EntityType.EVENT, now, windowEnd,
                    opts.getMaxEvents())) {
                Event event = (Event) entity;
                items.add(RetrievalItem.of(event, relevanceScorer.timeRelevance(event.getStartsAt(), now),
                        ContextSource.TIME_BASED, REASON_UPCOMING_EVENT));
            }
        }

        if (category == IntentCategory.TASK || category == IntentCategory.REMIND) {
            for (ContextEntity entity : entityStorePort.findUpcoming(userId, EntityType.TASK, now, null,
                    opts.getMaxTasks())) {
                Task task = (Task) entity;
                double relevance = task.getDueDate() != null
                        ? relevanceScorer.timeRelevance(task.getDueDate(), now)
                        : UNDATED_TASK_RELEVANCE;
                items.add(RetrievalItem.of(task, relevance, ContextSource.TIME_BASED, REASON_UPCOMING_TASK));
            }
            for (ContextEntity entity : entityStorePort.findUpcoming(userId, EntityType.DEADLINE, now, null,
                    opts.getMaxDeadlines())) {
                Deadline deadline = (Deadline) entity;
                items.add(RetrievalItem.of(deadline, relevanceScorer.timeRelevance(deadline.getDueAt(), now),
                        ContextSource.TIME_BASED, REASON_UPCOMING_DEADLINE));
            }
        }

        return items;
    }

    private List<ConversationMessage> retrieveConversation(RetrievalOptions opts) {
        return getConversationContext(opts.getConversationId(), opts.getMaxConversationMessages());
    }

    private List<Interaction> retrieveInteractions(String userId, RetrievalOptions opts) {
        return getRecentInteractions(userId, opts.getMaxRecentInteractions());
    }

    private int addRelatedEvents(String userId, Map<EntityType, List<RetrievalItem>> byType,
            RetrievalOptions opts) {
        List<RetrievalItem> people = byType.getOrDefault(EntityType.PERSON, List.of());
        List<String> names = new ArrayList<>();
        for (RetrievalItem item : people) {
            String name = ((Person) item.getEntity()).getName();
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            return 0;
        }

        List<RetrievalItem> events = byType.computeIfAbsent(EntityType.EVENT, t -> new ArrayList<>());
        Set<String> present = new LinkedHashSet<>();
        events.forEach(item -> present.add(item.getEntityId()));

        int added = 0;
        for (Event event : entityStorePort.findEventsMentioning(userId, names, clock.instant(),
                opts.getMaxEvents())) {
            if (present.add(event.getId())) {
                events.add(RetrievalItem.of(event, RELATED_RELEVANCE, ContextSource.RELATED_ENTITY,
                        REASON_RELATED));
                added++;
            }
        }
        return added;
    }

    /**
     * Per kind, keeps the highest-relevance hit of each record (first seen wins
     * ties) and orders the survivors by relevance.
     */
    private Map<EntityType, List<RetrievalItem>> mergeByType(List<RetrievalItem> items) {
        Map<EntityType, Map<String, RetrievalItem>> best = new EnumMap<>(EntityType.class);
        for (RetrievalItem item : items) {
            Map<String, RetrievalItem> typed = best.computeIfAbsent(item.getEntityType(),
                    t -> new LinkedHashMap<>());
            RetrievalItem existing = typed.get(item.getEntityId());
            if (existing == null || item.getRelevance() > existing.getRelevance()) {
                typed.put(item.getEntityId(), item);
            }
        }

        Map<EntityType, List<RetrievalItem>> merged = new EnumMap<>(EntityType.class);
        best.forEach((type, typed) -> {
            List<RetrievalItem> sorted = new ArrayList<>(typed.values());
            sorted.sort(Comparator.comparingDouble(RetrievalItem::getRelevance).reversed());
            merged.put(type, sorted);
        });
        return merged;
    }

    private void awaitAll(List<CompletableFuture<?>> futures, List<RetrievalTask<?>> tasks, Duration timeout,
            String userId, IntentCategory category) {
        CompletableFuture<Void> latch = new CompletableFuture<>();
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null) {
                    latch.completeExceptionally(error);
                }
            });
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        latch.complete(null);
                    }
                });

        try {
            latch.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAll(tasks);
            log.error("[ContextRetrieval] Retrieval timed out after {}ms for user {}", timeout.toMillis(), userId);
            throw new ContextRetrievalException(ContextRetrievalException.Code.TIMEOUT,
                    "Context retrieval timed out after " + timeout.toMillis() + "ms", userId, category, e);
        } catch (ExecutionException e) {
            cancelAll(tasks);
            Throwable cause = unwrap(e);
            log.error("[ContextRetrieval] Retrieval failed for user {}: {}", userId, cause.getMessage());
            throw new ContextRetrievalException(ContextRetrievalException.Code.RETRIEVAL_FAILED,
                    "Failed to retrieve context: " + cause.getMessage(), userId, category, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(tasks);
            throw new ContextRetrievalException(ContextRetrievalException.Code.RETRIEVAL_FAILED,
                    "Context retrieval interrupted", userId, category, e);
        }
    }

    private void cancelAll(List<RetrievalTask<?>> tasks) {
        for (RetrievalTask<?> task : tasks) {
            task.cancel();
        }
    }

    private Duration resolveTimeout(RetrievalOptions opts) {
        Duration timeout = opts.getTimeout();
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return properties.getRetrieval().getTimeout();
        }
        return timeout;
    }

    private <T> CompletableFuture<T> submit(List<RetrievalTask<?>> tasks, Supplier<T> work) {
        RetrievalTask<T> task = start(work);
        tasks.add(task);
        return task.result();
    }

    /**
     * @throws RejectedExecutionException
     *             when the retrieval executor is saturated
     */
    private <T> RetrievalTask<T> start(Supplier<T> work) {
        RetrievalTask<T> task = new RetrievalTask<>();
        Runnable body = () -> task.run(work);
        task.handle = executor.submit(body);
        return task;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    /**
     * One sub-retrieval on the executor. The result future completes with the
     * work's outcome; cancelling the task also interrupts the worker thread.
     */
    private static final class RetrievalTask<T> {

        private final CompletableFuture<T> result = new CompletableFuture<>();
        private volatile Future<?> handle;

        CompletableFuture<T> result() {
            return result;
        }

        void run(Supplier<T> work) {
            try {
                result.complete(work.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } catch (Error e) {
                result.completeExceptionally(e);
                throw e;
            }
        }

        void cancel() {
            result.cancel(false);
            Future<?> running = handle;
            if (running != null) {
                running.cancel(true);
            }
        }
    }
}
