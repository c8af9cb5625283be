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

package me.golemcore.context.adapter.outbound.context;

import me.golemcore.context.adapter.outbound.storage.JsonlRecordReader;
import me.golemcore.context.domain.model.ContextEntity;
import me.golemcore.context.domain.model.Deadline;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.Event;
import me.golemcore.context.domain.model.Note;
import me.golemcore.context.domain.model.OpenLoop;
import me.golemcore.context.domain.model.Opportunity;
import me.golemcore.context.domain.model.Person;
import me.golemcore.context.domain.model.Place;
import me.golemcore.context.domain.model.Project;
import me.golemcore.context.domain.model.Routine;
import me.golemcore.context.domain.model.Task;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.port.outbound.EntityStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entity store backed by JSONL files in the workspace, one file per user and
 * kind: {@code entities/<userId>/<type>.jsonl}. Soft-deleted records are
 * filtered on read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalEntityStoreAdapter implements EntityStorePort {

    private static final Set<String> OPEN_TASK_STATUSES = Set.of("pending", "in_progress");
    private static final String PENDING = "pending";

    private final JsonlRecordReader reader;
    private final ContextEngineProperties properties;

    @Override
    public List<ContextEntity> findByNames(String userId, List<String> names, EntityType type, int limit) {
        if (names == null || names.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> needles = names.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();

        List<ContextEntity> result = new ArrayList<>();
        for (ContextEntity entity : listAll(userId, type)) {
            if (result.size() >= limit) {
                break;
            }
            String label = primaryLabel(entity);
            if (label != null && containsAny(label, needles)) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public List<ContextEntity> findUpcoming(String userId, EntityType type, Instant from, Instant until, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return listAll(userId, type).stream()
                .filter(this::isOpen)
                .filter(entity -> {
                    Instant anchor = timeAnchor(entity);
                    return anchor != null && !anchor.isBefore(from) && (until == null || !anchor.isAfter(until));
                })
                .sorted(Comparator.comparing(this::timeAnchor))
                .limit(limit)
                .toList();
    }

    @Override
    public List<Event> findEventsMentioning(String userId, List<String> names, Instant from, int limit) {
        if (names == null || names.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> needles = names.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();

        return listAll(userId, EntityType.EVENT).stream()
                .map(Event.class::cast)
                .filter(event -> event.getStartsAt() != null && !event.getStartsAt().isBefore(from))
                .filter(event -> (event.getDescription() != null && containsAny(event.getDescription(), needles))
                        || (event.getNotes() != null && containsAny(event.getNotes(), needles)))
                .sorted(Comparator.comparing(Event::getStartsAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<ContextEntity> listAll(String userId, EntityType type) {
        String path = JsonlRecordReader.requireSafeId(userId, "user id") + "/" + type.getValue() + ".jsonl";
        List<? extends ContextEntity> records = reader.readAll(properties.getStorage().getDirectories().getEntities(),
                path, type.getEntityClass());

        List<ContextEntity> live = new ArrayList<>(records.size());
        for (ContextEntity entity : records) {
            if (!entity.isDeleted() && entity.getId() != null) {
                live.add(entity);
            }
        }
        log.trace("[EntityStore] Loaded {} live {} records for user {}", live.size(), type, userId);
        return live;
    }

    private String primaryLabel(ContextEntity entity) {
        return switch (entity.getKind()) {
        case PERSON -> ((Person) entity).getName();
        case PLACE -> ((Place) entity).getName();
        case EVENT -> ((Event) entity).getTitle();
        case TASK -> ((Task) entity).getTitle();
        case DEADLINE -> ((Deadline) entity).getTitle();
        case ROUTINE -> ((Routine) entity).getName();
        case OPEN_LOOP -> ((OpenLoop) entity).getTitle();
        case PROJECT -> ((Project) entity).getName();
        case NOTE -> ((Note) entity).getTitle();
        case OPPORTUNITY -> ((Opportunity) entity).getTitle();
        };
    }

    private Instant timeAnchor(ContextEntity entity) {
        return switch (entity.getKind()) {
        case EVENT -> ((Event) entity).getStartsAt();
        case TASK -> ((Task) entity).getDueDate();
        case DEADLINE -> ((Deadline) entity).getDueAt();
        case ROUTINE -> ((Routine) entity).getNextRunAt();
        case OPEN_LOOP -> ((OpenLoop) entity).getDueAt();
        case PROJECT -> ((Project) entity).getDueDate();
        case OPPORTUNITY -> ((Opportunity) entity).getExpiresAt();
        case PERSON, PLACE, NOTE -> null;
        };
    }

    private boolean isOpen(ContextEntity entity) {
        return switch (entity.getKind()) {
        case TASK -> OPEN_TASK_STATUSES.contains(((Task) entity).getStatus());
        case DEADLINE -> PENDING.equals(((Deadline) entity).getStatus());
        default -> true;
        };
    }

    private boolean containsAny(String text, List<String> needles) {
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
