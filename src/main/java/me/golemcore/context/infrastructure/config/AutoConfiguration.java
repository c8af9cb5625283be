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

import me.golemcore.context.domain.service.RelevanceWeights;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Bean wiring for the context engine.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>the system {@link Clock} used for time windows and date rendering</li>
 * <li>the Jackson {@link ObjectMapper} for JSONL records</li>
 * <li>{@link RelevanceWeights} with configured overrides applied</li>
 * <li>the bounded executor the retrieval fan-out runs on</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    public static final String RETRIEVAL_EXECUTOR = "contextRetrievalExecutor";

    private final ContextEngineProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public RelevanceWeights relevanceWeights() {
        ContextEngineProperties.RankingProperties ranking = properties.getRanking();
        return RelevanceWeights.defaults().withOverrides(ranking.getSourceWeights(), ranking.getIntentWeights(),
                ranking.getMentionBoost());
    }

    @Bean(name = RETRIEVAL_EXECUTOR)
    public ThreadPoolTaskExecutor contextRetrievalExecutor() {
        ContextEngineProperties.RetrievalProperties retrieval = properties.getRetrieval();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(retrieval.getCorePoolSize());
        executor.setMaxPoolSize(retrieval.getMaxPoolSize());
        executor.setQueueCapacity(retrieval.getQueueCapacity());
        executor.setThreadNamePrefix("context-retrieval-");
        executor.initialize();
        return executor;
    }

    @PostConstruct
    public void init() {
        log.info("Context engine starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Retrieval timeout: {}, semantic timeout: {}", properties.getRetrieval().getTimeout(),
                properties.getRetrieval().getSemanticTimeout());
        log.info("Summary budget: {} tokens", properties.getSummary().getMaxTokens());
    }
}
