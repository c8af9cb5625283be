package me.golemcore.context.adapter.outbound.context;

import me.golemcore.context.adapter.outbound.storage.JsonlRecordReader;
import me.golemcore.context.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.context.domain.model.Interaction;
import me.golemcore.context.domain.model.InteractionType;
import me.golemcore.context.infrastructure.config.AutoConfiguration;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalInteractionLogAdapterTest {

    @TempDir
    Path tempDir;

    private LocalInteractionLogAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new LocalInteractionLogAdapter(new JsonlRecordReader(storage, AutoConfiguration.objectMapper()),
                properties);

        Files.writeString(tempDir.resolve("audit").resolve("user-1.jsonl"), String.join("\n",
                "{\"id\":\"a1\",\"actionType\":\"create\",\"entityType\":\"task\",\"entityId\":\"t1\","
                        + "\"outputSummary\":\"Created task Report\",\"intent\":\"add a task\","
                        + "\"createdAt\":\"2026-03-01T08:00:00Z\"}",
                "{\"id\":\"a2\",\"actionType\":\"query\",\"entityType\":\"person\","
                        + "\"createdAt\":\"2026-03-01T09:00:00Z\"}",
                "{\"id\":\"a3\",\"actionType\":\"login\",\"entityType\":\"session\","
                        + "\"createdAt\":\"2026-03-01T09:30:00Z\"}",
                "{\"id\":\"a4\",\"actionType\":\"update\",\"createdAt\":\"2026-03-01T09:45:00Z\"}",
                "{\"id\":\"a5\",\"actionType\":\"delete\",\"entityType\":\"note\",\"entityId\":\"n1\"}",
                "{\"id\":\"a6\",\"actionType\":\"update\",\"entityType\":\"event\",\"entityId\":\"e1\","
                        + "\"outputSummary\":\"Moved standup\",\"createdAt\":\"2026-03-01T07:00:00Z\"}") + "\n");
    }

    @Test
    void shouldReturnTrackedActionsNewestFirst() {
        List<Interaction> interactions = adapter.recentActions("user-1", 10);

        assertEquals(List.of("person", "task", "event", "note"),
                interactions.stream().map(Interaction::getEntityType).toList());

        Interaction query = interactions.get(0);
        assertEquals(InteractionType.QUERIED, query.getType());
        assertEquals("person", query.getDisplayName());
        assertEquals("", query.getEntityId());
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), query.getTimestamp());

        Interaction created = interactions.get(1);
        assertEquals(InteractionType.CREATED, created.getType());
        assertEquals("Created task Report", created.getDisplayName());
        assertEquals("add a task", created.getContext());
    }

    @Test
    void shouldApplyLimit() {
        assertEquals(2, adapter.recentActions("user-1", 2).size());
        assertTrue(adapter.recentActions("user-1", 0).isEmpty());
    }

    @Test
    void shouldReturnEmptyWithoutAuditLog() {
        assertTrue(adapter.recentActions("user-2", 5).isEmpty());
    }

    @Test
    void shouldMapActionTypes() {
        assertEquals(InteractionType.UPDATED, LocalInteractionLogAdapter.mapActionType("update"));
        assertEquals(InteractionType.DELETED, LocalInteractionLogAdapter.mapActionType("delete"));
        assertEquals(InteractionType.VIEWED, LocalInteractionLogAdapter.mapActionType("export"));
        assertEquals(InteractionType.VIEWED, LocalInteractionLogAdapter.mapActionType(null));
    }
}
