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
 * A calendar event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event implements ContextEntity {

    private String id;
    private String title;
    private String description;
    private String type;
    private Instant startsAt;
    private Instant endsAt;
    private boolean allDay;
    private String location;
    private String placeId;
    private String virtualUrl;
    private String status;
    private String notes;
    private Integer importance;
    private String source;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Override
    @JsonIgnore
    public EntityType getKind() {
        return EntityType.EVENT;
    }
}
