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

package me.golemcore.context.adapter.outbound.embedding;

import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Embeds search queries and entity summaries for the semantic search adapter.
 * The model is created lazily on first use; without an API key the adapter
 * reports itself unavailable and every call fails.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code context-engine.embedding.api-key} - OpenAI API key
 * <li>{@code context-engine.embedding.model} - Embedding model name
 * </ul>
 *
 * @see me.golemcore.context.adapter.outbound.search.EmbeddingSemanticSearchAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final ContextEngineProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        String apiKey = properties.getEmbedding().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key not configured, semantic search unavailable");
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            embeddingModel = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .build();
            log.info("[Embedding] Model initialized: {}", model);
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize model {}", model, e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            Response<Embedding> response = model.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = model.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        if (embeddingModel == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return embeddingModel;
    }
}
