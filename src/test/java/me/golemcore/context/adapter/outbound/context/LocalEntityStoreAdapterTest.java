package me.golemcore.context.adapter.outbound.context;

import me.golemcore.context.adapter.outbound.storage.JsonlRecordReader;
import me.golemcore.context.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.context.domain.model.ContextEntity;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.Event;
import me.golemcore.context.domain.model.Person;
import me.golemcore.context.infrastructure.config.AutoConfiguration;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalEntityStoreAdapterTest {

    private static final String USER_ID = "user-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalEntityStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new LocalEntityStoreAdapter(new JsonlRecordReader(storage, AutoConfiguration.objectMapper()),
                properties);
    }

    @Test
    void shouldListLiveRecordsOnly() throws IOException {
        writeEntities("person",
                "{\"id\":\"p1\",\"name\":\"Alice Smith\"}",
                "{\"id\":\"p2\",\"name\":\"Bob\",\"deletedAt\":\"2026-01-01T00:00:00Z\"}",
                "{\"name\":\"No Id\"}");

        List<ContextEntity> people = adapter.listAll(USER_ID, EntityType.PERSON);

        assertEquals(1, people.size());
        assertInstanceOf(Person.class, people.get(0));
        assertEquals("p1", people.get(0).getId());
    }

    @Test
    void shouldReturnEmptyWhenUserHasNoRecords() {
        assertTrue(adapter.listAll(USER_ID, EntityType.NOTE).isEmpty());
    }

    @Test
    void shouldFindByNameCaseInsensitively() throws IOException {
        writeEntities("person",
                "{\"id\":\"p1\",\"name\":\"Alice Smith\"}",
                "{\"id\":\"p2\",\"name\":\"Bob Jones\"}",
                "{\"id\":\"p3\",\"name\":\"Alicia Keys\"}");

        List<ContextEntity> found = adapter.findByNames(USER_ID, List.of("ALICE", "jones"), EntityType.PERSON, 5);
        assertEquals(List.of("p1", "p2"), ids(found));

        List<ContextEntity> limited = adapter.findByNames(USER_ID, List.of("ali"), EntityType.PERSON, 1);
        assertEquals(List.of("p1"), ids(limited));
    }

    @Test
    void shouldMatchTitlesForTitledKinds() throws IOException {
        writeEntities("project",
                "{\"id\":\"pr1\",\"name\":\"Website Redesign\"}");
        writeEntities("note",
                "{\"id\":\"n1\",\"title\":\"Packing list\",\"content\":\"socks\"}",
                "{\"id\":\"n2\",\"content\":\"untitled\"}");

        assertEquals(List.of("pr1"), ids(adapter.findByNames(USER_ID, List.of("website"), EntityType.PROJECT, 5)));
        assertEquals(List.of("n1"), ids(adapter.findByNames(USER_ID, List.of("packing"), EntityType.NOTE, 5)));
    }

    @Test
    void shouldFindUpcomingEventsInsideWindowSortedByStart() throws IOException {
        writeEntities("event",
                event("e1", "Later", NOW.plus(Duration.ofDays(3))),
                event("e2", "Past", NOW.minus(Duration.ofHours(1))),
                event("e3", "Soon", NOW.plus(Duration.ofHours(2))),
                event("e4", "Too far", NOW.plus(Duration.ofDays(30))));

        List<ContextEntity> upcoming = adapter.findUpcoming(USER_ID, EntityType.EVENT, NOW,
                NOW.plus(Duration.ofDays(7)), 5);

        assertEquals(List.of("e3", "e1"), ids(upcoming));
    }

    @Test
    void shouldFindOnlyOpenTasksWithFutureDueDates() throws IOException {
        writeEntities("task",
                "{\"id\":\"t1\",\"title\":\"Pending\",\"status\":\"pending\",\"dueDate\":\"2026-03-05T00:00:00Z\"}",
                "{\"id\":\"t2\",\"title\":\"Active\",\"status\":\"in_progress\",\"dueDate\":\"2026-03-02T00:00:00Z\"}",
                "{\"id\":\"t3\",\"title\":\"Done\",\"status\":\"completed\",\"dueDate\":\"2026-03-03T00:00:00Z\"}",
                "{\"id\":\"t4\",\"title\":\"Undated\",\"status\":\"pending\"}",
                "{\"id\":\"t5\",\"title\":\"Overdue\",\"status\":\"pending\",\"dueDate\":\"2026-02-01T00:00:00Z\"}");

        List<ContextEntity> upcoming = adapter.findUpcoming(USER_ID, EntityType.TASK, NOW, null, 10);

        assertEquals(List.of("t2", "t1"), ids(upcoming));
    }

    @Test
    void shouldFindOnlyPendingDeadlines() throws IOException {
        writeEntities("deadline",
                "{\"id\":\"d1\",\"title\":\"Taxes\",\"status\":\"pending\",\"dueAt\":\"2026-04-15T00:00:00Z\"}",
                "{\"id\":\"d2\",\"title\":\"Visa\",\"status\":\"met\",\"dueAt\":\"2026-03-15T00:00:00Z\"}");

        assertEquals(List.of("d1"), ids(adapter.findUpcoming(USER_ID, EntityType.DEADLINE, NOW, null, 5)));
    }

    @Test
    void shouldFindFutureEventsMentioningNames() throws IOException {
        writeEntities("event",
                "{\"id\":\"e1\",\"title\":\"Dinner\",\"description\":\"with Alice Smith\","
                        + "\"startsAt\":\"2026-03-04T19:00:00Z\"}",
                "{\"id\":\"e2\",\"title\":\"Review\",\"notes\":\"ask alice smith about Q2\","
                        + "\"startsAt\":\"2026-03-02T09:00:00Z\"}",
                "{\"id\":\"e3\",\"title\":\"Old\",\"description\":\"Alice Smith\","
                        + "\"startsAt\":\"2026-02-01T09:00:00Z\"}",
                "{\"id\":\"e4\",\"title\":\"Alice Smith sync\",\"startsAt\":\"2026-03-03T09:00:00Z\"}");

        List<Event> events = adapter.findEventsMentioning(USER_ID, List.of("Alice Smith"), NOW, 5);

        assertEquals(List.of("e2", "e1"), events.stream().map(Event::getId).toList());
    }

    @Test
    void shouldRejectUnsafeUserIds() {
        assertThrows(IllegalArgumentException.class, () -> adapter.listAll("../other", EntityType.PERSON));
    }

    private void writeEntities(String type, String... lines) throws IOException {
        Path file = tempDir.resolve("entities").resolve(USER_ID).resolve(type + ".jsonl");
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
    }

    private static String event(String id, String title, Instant startsAt) {
        return "{\"id\":\"" + id + "\",\"title\":\"" + title + "\",\"startsAt\":\"" + startsAt + "\"}";
    }

    private static List<String> ids(List<ContextEntity> entities) {
        return entities.stream().map(ContextEntity::getId).toList();
    }
}
