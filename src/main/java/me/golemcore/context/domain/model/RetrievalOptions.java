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

import java.time.Duration;
import java.util.List;

/**
 * Per-call retrieval parameters. Every field has a default, so
 * {@code RetrievalOptions.builder().build()} is a valid request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrievalOptions {

    private String conversationId;

    @Builder.Default
    private int maxPeople = 5;

    @Builder.Default
    private int maxEvents = 5;

    @Builder.Default
    private int maxTasks = 10;

    @Builder.Default
    private int maxDeadlines = 5;

    @Builder.Default
    private int maxPlaces = 3;

    @Builder.Default
    private int maxRoutines = 5;

    @Builder.Default
    private int maxOpenLoops = 5;

    @Builder.Default
    private int maxProjects = 5;

    @Builder.Default
    private int maxNotes = 5;

    @Builder.Default
    private int maxOpportunities = 5;

    @Builder.Default
    private int maxSemanticMatches = 10;

    @Builder.Default
    private int maxConversationMessages = 10;

    @Builder.Default
    private int maxRecentInteractions = 5;

    @Builder.Default
    private boolean useSemanticSearch = true;

    @Builder.Default
    private double minSimilarity = 0.5;

    private List<EntityType> focusEntityTypes;

    @Builder.Default
    private boolean includeRelated = true;

    /** Overall deadline; {@code null} uses the configured default. */
    private Duration timeout;

    public static RetrievalOptions defaults() {
        return RetrievalOptions.builder().build();
    }

    public int limitFor(EntityType type) {
        return switch (type) {
        case PERSON -> maxPeople;
        case PLACE -> maxPlaces;
        case EVENT -> maxEvents;
        case TASK -> maxTasks;
        case DEADLINE -> maxDeadlines;
        case ROUTINE -> maxRoutines;
        case OPEN_LOOP -> maxOpenLoops;
        case PROJECT -> maxProjects;
        case NOTE -> maxNotes;
        case OPPORTUNITY -> maxOpportunities;
        };
    }
}
