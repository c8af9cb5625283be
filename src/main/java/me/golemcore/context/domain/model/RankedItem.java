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
 * Merged and scored form of every retrieval hit sharing one identity.
 * Relevance is the best score any contributing hit achieved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RankedItem {

    private EntityType entityType;
    private String entityId;
    private String displayName;
    private double relevance;

    @Builder.Default
    private List<String> relevanceReasons = new ArrayList<>();

    @Builder.Default
    private List<ContextSource> sources = new ArrayList<>();

    private String summary;
    private ContextEntity entity;
}
