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

package me.golemcore.context.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the context engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code context-engine.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local workspace layout</li>
 * <li>{@link RetrievalProperties} - deadlines, executor sizing, time
 * windows</li>
 * <li>{@link RankingProperties} - weight table overrides</li>
 * <li>{@link SummaryProperties} - token budget and section limits</li>
 * <li>{@link EmbeddingProperties} - embedding provider credentials</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "context-engine")
@Data
public class ContextEngineProperties {

    private StorageProperties storage = new StorageProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private RankingProperties ranking = new RankingProperties();
    private SummaryProperties summary = new SummaryProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/context";
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class DirectoriesProperties {
        private String entities = "entities";
        private String conversations = "conversations";
        private String audit = "audit";
    }

    @Data
    public static class RetrievalProperties {
        private Duration timeout = Duration.ofSeconds(15);
        private Duration semanticTimeout = Duration.ofSeconds(5);
        private int upcomingEventDays = 7;
        private int corePoolSize = 5;
        private int maxPoolSize = 20;
        private int queueCapacity = 100;
    }

    /**
     * Overrides for the default weight tables. Keys are wire values; keys with
     * underscores need bracket notation, for example
     * {@code context-engine.ranking.source-weights[semantic_search]=0.9} or
     * {@code context-engine.ranking.intent-weights.schedule.event=1.5}.
     */
    @Data
    public static class RankingProperties {
        private Map<String, Double> sourceWeights = new HashMap<>();
        private Map<String, Map<String, Double>> intentWeights = new HashMap<>();
        private double mentionBoost = 1.2;
    }

    @Data
    public static class SummaryProperties {
        private int maxTokens = 2000;
        private double relevanceThreshold = 0.6;
        private int maxItems = 10;
        private int maxMessages = 5;
        private int maxInteractions = 5;
        private int messageContentLength = 100;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String model = "text-embedding-3-small";
    }
}
