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

package me.golemcore.context.domain.service;

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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders display names and one-line summaries of entities for the prompt.
 * Dates are ISO local dates in the clock's zone.
 */
@Service
@RequiredArgsConstructor
public class EntitySummarizer {

    private static final String UNTITLED = "Untitled";
    private static final String GENERAL_OPPORTUNITY = "general";
    private static final int NOTE_PREVIEW_LENGTH = 50;

    private final Clock clock;

    /**
     * Primary label of the entity, or a per-kind placeholder such as
     * {@code Untitled Note} when the record has none.
     */
    public String displayName(ContextEntity entity) {
        String label = primaryLabel(entity);
        return hasText(label) ? label : UNTITLED + " " + kindLabel(entity.getKind());
    }

    public String summarize(ContextEntity entity) {
        return switch (entity.getKind()) {
        case PERSON -> summarizePerson((Person) entity);
        case PLACE -> summarizePlace((Place) entity);
        case EVENT -> summarizeEvent((Event) entity);
        case TASK -> summarizeTask((Task) entity);
        case DEADLINE -> summarizeDeadline((Deadline) entity);
        case ROUTINE -> summarizeRoutine((Routine) entity);
        case OPEN_LOOP -> summarizeOpenLoop((OpenLoop) entity);
        case PROJECT -> summarizeProject((Project) entity);
        case NOTE -> summarizeNote((Note) entity);
        case OPPORTUNITY -> summarizeOpportunity((Opportunity) entity);
        };
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

    private String summarizePerson(Person person) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(person.getName()));
        addIfPresent(parts, person.getTitle());
        if (hasText(person.getCompany())) {
            parts.add("at " + person.getCompany());
        }
        if (hasText(person.getEmail())) {
            parts.add("(" + person.getEmail() + ")");
        }
        return String.join(" ", parts);
    }

    private String summarizePlace(Place place) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(place.getName()));
        addIfPresent(parts, place.getAddress());
        addIfPresent(parts, place.getCity());
        return String.join(", ", parts);
    }

    private String summarizeEvent(Event event) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(event.getTitle()));
        if (event.getStartsAt() != null) {
            parts.add("on " + formatDate(event.getStartsAt()));
        }
        if (hasText(event.getLocation())) {
            parts.add("at " + event.getLocation());
        }
        return String.join(" ", parts);
    }

    private String summarizeTask(Task task) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(task.getTitle()));
        addStatus(parts, task.getStatus());
        addDue(parts, task.getDueDate());
        return String.join(" ", parts);
    }

    private String summarizeDeadline(Deadline deadline) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(deadline.getTitle()));
        addDue(parts, deadline.getDueAt());
        addStatus(parts, deadline.getStatus());
        return String.join(" ", parts);
    }

    private String summarizeRoutine(Routine routine) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(routine.getName()));
        if (hasText(routine.getFrequency())) {
            parts.add("(" + routine.getFrequency() + ")");
        }
        addStatus(parts, routine.getStatus());
        return String.join(" ", parts);
    }

    private String summarizeOpenLoop(OpenLoop openLoop) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(openLoop.getTitle()));
        addDue(parts, openLoop.getDueAt());
        addStatus(parts, openLoop.getStatus());
        return String.join(" ", parts);
    }

    private String summarizeProject(Project project) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(project.getName()));
        addStatus(parts, project.getStatus());
        addDue(parts, project.getDueDate());
        return String.join(" ", parts);
    }

    private String summarizeNote(Note note) {
        String title = labelOrUntitled(note.getTitle());
        String content = note.getContent() != null ? note.getContent() : "";
        String preview = content.length() > NOTE_PREVIEW_LENGTH
                ? content.substring(0, NOTE_PREVIEW_LENGTH) + "..."
                : content;
        return title + ": " + preview;
    }

    private String summarizeOpportunity(Opportunity opportunity) {
        List<String> parts = new ArrayList<>();
        parts.add(labelOrUntitled(opportunity.getTitle()));
        addStatus(parts, opportunity.getStatus());
        if (hasText(opportunity.getType()) && !GENERAL_OPPORTUNITY.equals(opportunity.getType())) {
            parts.add("(" + opportunity.getType() + ")");
        }
        if (opportunity.getExpiresAt() != null) {
            parts.add("expires " + formatDate(opportunity.getExpiresAt()));
        }
        return String.join(" ", parts);
    }

    private void addStatus(List<String> parts, String status) {
        if (hasText(status)) {
            parts.add("[" + status + "]");
        }
    }

    private void addDue(List<String> parts, Instant due) {
        if (due != null) {
            parts.add("due " + formatDate(due));
        }
    }

    private void addIfPresent(List<String> parts, String value) {
        if (hasText(value)) {
            parts.add(value);
        }
    }

    private String labelOrUntitled(String label) {
        return hasText(label) ? label : UNTITLED;
    }

    private String kindLabel(EntityType type) {
        StringBuilder label = new StringBuilder();
        for (String word : type.getValue().split("_")) {
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }

    private String formatDate(Instant instant) {
        return LocalDate.ofInstant(instant, clock.getZone()).toString();
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
