package me.golemcore.context.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.context.domain.model.ContextSource;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.IntentCategory;
import me.golemcore.context.domain.model.Task;
import me.golemcore.context.domain.service.RelevanceWeights;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    private static final double EPSILON = 1e-9;

    @Test
    void shouldApplyRankingOverridesOnTopOfDefaults() {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getRanking().setSourceWeights(Map.of("semantic_search", 0.9));
        properties.getRanking().setIntentWeights(Map.of("schedule", Map.of("event", 1.5)));
        properties.getRanking().setMentionBoost(1.5);

        RelevanceWeights weights = new AutoConfiguration(properties).relevanceWeights();

        assertEquals(0.9, weights.sourceWeight(ContextSource.SEMANTIC_SEARCH), EPSILON);
        assertEquals(1.0, weights.sourceWeight(ContextSource.RESOLVED_ENTITY), EPSILON);
        assertEquals(1.5, weights.intentWeight(IntentCategory.SCHEDULE, EntityType.EVENT), EPSILON);
        assertEquals(1.1, weights.intentWeight(IntentCategory.SCHEDULE, EntityType.PERSON), EPSILON);
        assertEquals(1.5, weights.getMentionBoost(), EPSILON);
    }

    @Test
    void shouldSizeRetrievalExecutorFromProperties() {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getRetrieval().setCorePoolSize(2);
        properties.getRetrieval().setMaxPoolSize(4);

        Executor executor = new AutoConfiguration(properties).contextRetrievalExecutor();

        ThreadPoolTaskExecutor pool = assertInstanceOf(ThreadPoolTaskExecutor.class, executor);
        try {
            assertEquals(2, pool.getCorePoolSize());
            assertEquals(4, pool.getMaxPoolSize());
            assertEquals("context-retrieval-", pool.getThreadNamePrefix());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void shouldReadIsoInstantsAndIgnoreUnknownFields() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        Task task = mapper.readValue(
                "{\"id\":\"t1\",\"title\":\"Report\",\"dueDate\":\"2026-03-05T00:00:00Z\",\"userId\":\"u1\"}",
                Task.class);

        assertEquals(Instant.parse("2026-03-05T00:00:00Z"), task.getDueDate());
        assertTrue(mapper.writeValueAsString(task).contains("\"dueDate\":\"2026-03-05T00:00:00Z\""));
    }
}
