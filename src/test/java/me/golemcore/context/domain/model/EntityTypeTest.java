package me.golemcore.context.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityTypeTest {

    @Test
    void shouldResolveWireValues() {
        assertEquals(EntityType.OPEN_LOOP, EntityType.fromValue("open_loop"));
        assertEquals(EntityType.PERSON, EntityType.fromValue(" Person "));
        assertNull(EntityType.fromValue("date"));
        assertNull(EntityType.fromValue(null));
        assertEquals("open_loop", EntityType.OPEN_LOOP.toString());
    }

    @Test
    void shouldMapEachKindToItsModelClass() {
        for (EntityType type : EntityType.values()) {
            assertTrue(ContextEntity.class.isAssignableFrom(type.getEntityClass()));
        }
        assertEquals(Deadline.class, EntityType.DEADLINE.getEntityClass());
    }

    @Test
    void shouldResolveSourcesAndCategories() {
        assertEquals(ContextSource.SEMANTIC_SEARCH, ContextSource.fromValue("semantic_search"));
        assertThrows(IllegalArgumentException.class, () -> ContextSource.fromValue("gossip"));
        assertEquals(IntentCategory.REMIND, IntentCategory.fromValue("remind"));
        assertEquals(IntentCategory.UNKNOWN, IntentCategory.fromValue("chit-chat"));
    }

    @Test
    void shouldDetectMentionedKindsAndReferences() {
        Intent intent = Intent.builder()
                .entities(List.of(EntityMention.builder().type("task").text("report").build()))
                .build();
        assertTrue(intent.mentions(EntityType.TASK));
        assertFalse(intent.mentions(EntityType.PERSON));

        Intent reference = Intent.builder()
                .entities(List.of(EntityMention.builder().type("reference").text("that").build()))
                .build();
        assertTrue(reference.mentions(EntityType.PERSON));
        assertFalse(new Intent().mentions(EntityType.PERSON));
    }

    @Test
    void shouldTreatRecordsWithDeletionTimestampAsDeleted() {
        Person person = Person.builder().id("p1").name("Alice").build();
        assertFalse(person.isDeleted());

        person.setDeletedAt(Instant.parse("2026-01-01T00:00:00Z"));
        assertTrue(person.isDeleted());
    }
}
