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
 * A dated commitment. Status is one of pending, completed, missed, extended.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Deadline implements ContextEntity {

    private String id;
    private String title;
    private String description;
    private String type;
    private Instant dueAt;
    private Instant reminderAt;
    private String status;
    private Integer importance;
    private String taskId;
    private String eventId;
    private String notes;
    private String consequences;
    private String source;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Override
    @JsonIgnore
    public EntityType getKind() {
        return EntityType.DEADLINE;
    }
}
