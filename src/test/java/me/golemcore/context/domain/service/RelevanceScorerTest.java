package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextSource;
import me.golemcore.context.domain.model.EntityMention;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.Intent;
import me.golemcore.context.domain.model.IntentCategory;
import me.golemcore.context.domain.model.SemanticMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelevanceScorerTest {

    private static final double EPSILON = 1e-9;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private RelevanceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RelevanceScorer(RelevanceWeights.defaults());
    }

    @Test
    void shouldApplySourceAndIntentWeights() {
        Intent schedule = intent(IntentCategory.SCHEDULE);

        assertEquals(0.18, scorer.score(0.5, ContextSource.TIME_BASED, EntityType.EVENT, schedule), EPSILON);
        assertEquals(0.44, scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.PERSON, schedule), EPSILON);
    }

    @Test
    void shouldTreatUnmappedPairsAsNeutral() {
        Intent query = intent(IntentCategory.QUERY);

        assertEquals(0.4, scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.NOTE, query), EPSILON);
        assertEquals(0.35, scorer.score(0.5, ContextSource.TEXT_SEARCH, EntityType.OPPORTUNITY, query), EPSILON);
    }

    @Test
    void shouldBoostWhenEntityTypeIsMentioned() {
        Intent mentioned = intent(IntentCategory.QUERY, mention("person", "Alice"));
        Intent other = intent(IntentCategory.QUERY, mention("date", "tomorrow"));

        double boosted = scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.PERSON, mentioned);
        double plain = scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.PERSON, other);

        assertEquals(0.48, boosted, EPSILON);
        assertEquals(0.4, plain, EPSILON);
        assertEquals(plain * 1.2, boosted, EPSILON);
    }

    @Test
    void shouldBoostEveryTypeForGenericReference() {
        Intent reference = intent(IntentCategory.QUERY, mention("reference", "that"));

        assertEquals(0.48, scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.NOTE, reference), EPSILON);
        assertEquals(0.48, scorer.score(0.5, ContextSource.SEMANTIC_SEARCH, EntityType.PLACE, reference), EPSILON);
    }

    @Test
    void shouldClampScoresToUnitInterval() {
        Intent schedule = intent(IntentCategory.SCHEDULE, mention("event", "standup"));

        assertEquals(1.0, scorer.score(0.9, ContextSource.RESOLVED_ENTITY, EntityType.EVENT, schedule), EPSILON);
        assertEquals(1.0, scorer.score(5.0, ContextSource.RESOLVED_ENTITY, EntityType.EVENT, schedule), EPSILON);
        assertEquals(0.0, scorer.score(-0.3, ContextSource.RESOLVED_ENTITY, EntityType.EVENT, schedule), EPSILON);
    }

    @Test
    void shouldKeepScoresInBoundsForAllCombinations() {
        Intent intent = intent(IntentCategory.TASK, mention("task", "report"));
        for (ContextSource source : ContextSource.values()) {
            for (EntityType type : EntityType.values()) {
                for (double raw : new double[] { 0.0, 0.3, 0.77, 1.0 }) {
                    double score = scorer.score(raw, source, type, intent);
                    assertTrue(score >= 0.0 && score <= 1.0, source + "/" + type + "/" + raw);
                }
            }
        }
    }

    @Test
    void shouldHandleMissingIntent() {
        assertEquals(0.8, scorer.score(1.0, ContextSource.SEMANTIC_SEARCH, EntityType.TASK, null), EPSILON);
    }

    @Test
    void shouldRankSemanticMatchesByIntentWeightedSimilarity() {
        List<SemanticMatch> matches = List.of(
                match(EntityType.NOTE, "n1", 0.7),
                match(EntityType.TASK, "t1", 0.6),
                match(EntityType.DEADLINE, "d1", 0.9));

        List<SemanticMatch> ranked = scorer.rankSemanticMatches(matches, intent(IntentCategory.TASK));

        assertEquals(List.of("d1", "t1", "n1"), ranked.stream().map(SemanticMatch::getEntityId).toList());
        assertEquals(1.0, ranked.get(0).getSimilarity(), EPSILON);
        assertEquals(0.78, ranked.get(1).getSimilarity(), EPSILON);
        assertEquals(0.7, ranked.get(2).getSimilarity(), EPSILON);
        assertEquals(0.7, matches.get(0).getSimilarity(), EPSILON);
    }

    @Test
    void shouldKeepInputOrderForEqualSimilarities() {
        List<SemanticMatch> matches = List.of(
                match(EntityType.NOTE, "first", 0.6),
                match(EntityType.PLACE, "second", 0.6),
                match(EntityType.PERSON, "third", 0.6));

        List<SemanticMatch> ranked = scorer.rankSemanticMatches(matches, intent(IntentCategory.SEARCH));

        assertEquals(List.of("first", "second", "third"), ranked.stream().map(SemanticMatch::getEntityId).toList());
    }

    @Test
    void shouldReturnEmptyListForNoSemanticMatches() {
        assertTrue(scorer.rankSemanticMatches(List.of(), intent(IntentCategory.TASK)).isEmpty());
        assertTrue(scorer.rankSemanticMatches(null, intent(IntentCategory.TASK)).isEmpty());
    }

    @Test
    void shouldBucketTimeRelevanceByDistance() {
        assertEquals(1.0, scorer.timeRelevance(NOW.plus(Duration.ofHours(12)), NOW), EPSILON);
        assertEquals(1.0, scorer.timeRelevance(NOW.plus(Duration.ofDays(1)), NOW), EPSILON);
        assertEquals(0.8, scorer.timeRelevance(NOW.plus(Duration.ofDays(3)), NOW), EPSILON);
        assertEquals(0.6, scorer.timeRelevance(NOW.minus(Duration.ofDays(20)), NOW), EPSILON);
        assertEquals(0.4, scorer.timeRelevance(NOW.plus(Duration.ofDays(60)), NOW), EPSILON);
        assertEquals(0.2, scorer.timeRelevance(NOW.plus(Duration.ofDays(200)), NOW), EPSILON);
    }

    @Test
    void shouldBucketInteractionRecencyByHours() {
        assertEquals(1.0, scorer.recencyRelevance(NOW.minus(Duration.ofMinutes(30)), NOW), EPSILON);
        assertEquals(0.8, scorer.recencyRelevance(NOW.minus(Duration.ofHours(5)), NOW), EPSILON);
        assertEquals(0.6, scorer.recencyRelevance(NOW.minus(Duration.ofDays(6)), NOW), EPSILON);
        assertEquals(0.4, scorer.recencyRelevance(NOW.minus(Duration.ofDays(29)), NOW), EPSILON);
        assertEquals(0.2, scorer.recencyRelevance(NOW.minus(Duration.ofDays(31)), NOW), EPSILON);
    }

    private static Intent intent(IntentCategory category, EntityMention... mentions) {
        return Intent.builder()
                .category(category)
                .entities(List.of(mentions))
                .build();
    }

    private static EntityMention mention(String type, String text) {
        return EntityMention.builder().type(type).text(text).confidence(0.9).build();
    }

    private static SemanticMatch match(EntityType type, String id, double similarity) {
        return SemanticMatch.builder().entityType(type).entityId(id).similarity(similarity).content("").build();
    }
}
