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

package me.golemcore.context.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Something the user is waiting on or still owes somebody.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OpenLoop implements ContextEntity {

    private String id;
    private String title;
    private String description;
    private String type;
    private String context;
    private String trigger;
    private String status;
    private Instant resolvedAt;
    private String resolution;
    private String priority;
    private Integer importance;
    private Instant dueAt;
    private Instant reminderAt;
    private String relatedPersonId;
    private String relatedTaskId;
    private String relatedEventId;
    private String source;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Override
    @JsonIgnore
    public EntityType getKind() {
        return EntityType.OPEN_LOOP;
    }
}
