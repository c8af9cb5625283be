package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextSource;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.IntentCategory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RelevanceWeightsTest {

    private static final double EPSILON = 1e-9;

    @Test
    void shouldExposeDefaultSourceWeightsInTrustOrder() {
        RelevanceWeights weights = RelevanceWeights.defaults();

        assertEquals(1.0, weights.sourceWeight(ContextSource.RESOLVED_ENTITY), EPSILON);
        assertEquals(0.8, weights.sourceWeight(ContextSource.SEMANTIC_SEARCH), EPSILON);
        assertEquals(0.7, weights.sourceWeight(ContextSource.TEXT_SEARCH), EPSILON);
        assertEquals(0.6, weights.sourceWeight(ContextSource.CONVERSATION), EPSILON);
        assertEquals(0.5, weights.sourceWeight(ContextSource.RELATED_ENTITY), EPSILON);
        assertEquals(0.4, weights.sourceWeight(ContextSource.RECENT_INTERACTION), EPSILON);
        assertEquals(0.3, weights.sourceWeight(ContextSource.TIME_BASED), EPSILON);
        assertEquals(1.2, weights.getMentionBoost(), EPSILON);
    }

    @Test
    void shouldExposeDefaultIntentMultipliers() {
        RelevanceWeights weights = RelevanceWeights.defaults();

        assertEquals(1.3, weights.intentWeight(IntentCategory.TASK, EntityType.TASK), EPSILON);
        assertEquals(1.2, weights.intentWeight(IntentCategory.COMMUNICATE, EntityType.PERSON), EPSILON);
        assertEquals(1.1, weights.intentWeight(IntentCategory.REMIND, EntityType.ROUTINE), EPSILON);
        assertEquals(1.1, weights.intentWeight(IntentCategory.SUMMARIZE, EntityType.NOTE), EPSILON);
        assertEquals(1.0, weights.intentWeight(IntentCategory.QUERY, EntityType.EVENT), EPSILON);
        assertEquals(1.0, weights.intentWeight(IntentCategory.TASK, EntityType.PERSON), EPSILON);
        assertEquals(1.0, weights.intentWeight(null, EntityType.PERSON), EPSILON);
    }

    @Test
    void shouldApplyOverridesWithoutChangingDefaults() {
        RelevanceWeights defaults = RelevanceWeights.defaults();

        RelevanceWeights tuned = defaults.withOverrides(
                Map.of("semantic_search", 0.9),
                Map.of("query", Map.of("open_loop", 1.4), "schedule", Map.of("event", 1.5)),
                1.5);

        assertEquals(0.9, tuned.sourceWeight(ContextSource.SEMANTIC_SEARCH), EPSILON);
        assertEquals(1.0, tuned.sourceWeight(ContextSource.RESOLVED_ENTITY), EPSILON);
        assertEquals(1.4, tuned.intentWeight(IntentCategory.QUERY, EntityType.OPEN_LOOP), EPSILON);
        assertEquals(1.5, tuned.intentWeight(IntentCategory.SCHEDULE, EntityType.EVENT), EPSILON);
        assertEquals(1.1, tuned.intentWeight(IntentCategory.SCHEDULE, EntityType.PERSON), EPSILON);
        assertEquals(1.5, tuned.getMentionBoost(), EPSILON);

        assertEquals(0.8, defaults.sourceWeight(ContextSource.SEMANTIC_SEARCH), EPSILON);
        assertEquals(1.2, defaults.intentWeight(IntentCategory.SCHEDULE, EntityType.EVENT), EPSILON);
    }

    @Test
    void shouldRejectUnknownOverrideKeys() {
        RelevanceWeights defaults = RelevanceWeights.defaults();

        assertThrows(IllegalArgumentException.class,
                () -> defaults.withOverrides(Map.of("gossip", 0.1), Map.of(), 1.2));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withOverrides(Map.of(), Map.of("dance", Map.of("event", 1.0)), 1.2));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withOverrides(Map.of(), Map.of("task", Map.of("email", 1.0)), 1.2));
    }
}
