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

package me.golemcore.context;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the context engine.
 *
 * <p>
 * The engine enriches a conversational assistant's turn with the user's
 * personal data: people, events, tasks, deadlines and the rest. For a
 * classified intent it retrieves candidates from several sources in parallel,
 * merges and scores them, and renders a token-budgeted digest for the model.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → ContextRetrievalService, ContextRankingService, RelevanceScorer
 * Outbound Ports     → EntityStorePort, SemanticSearchPort, ConversationPort, InteractionLogPort
 * Infrastructure     → JSONL workspace storage, langchain4j embeddings
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code context-engine.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextEngineApplication.class, args);
    }

}
