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
import me.golemcore.context.domain.model.Interaction;
import me.golemcore.context.domain.model.InteractionType;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.port.outbound.InteractionLogPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Recent user actions read from the per-user audit log
 * ({@code audit/<userId>.jsonl}). Only entity-related queries and mutations
 * are reported.
 */
@Component
@RequiredArgsConstructor
public class LocalInteractionLogAdapter implements InteractionLogPort {

    private static final Set<String> TRACKED_ACTIONS = Set.of("query", "create", "update", "delete");

    private final JsonlRecordReader reader;
    private final ContextEngineProperties properties;

    @Override
    public List<Interaction> recentActions(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String path = JsonlRecordReader.requireSafeId(userId, "user id") + ".jsonl";
        List<AuditRecord> records = reader.readAll(properties.getStorage().getDirectories().getAudit(), path,
                AuditRecord.class);

        return records.stream()
                .filter(auditRecord -> TRACKED_ACTIONS.contains(auditRecord.getActionType()))
                .filter(auditRecord -> auditRecord.getEntityType() != null && !auditRecord.getEntityType().isBlank())
                .sorted(Comparator.comparing(AuditRecord::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .map(this::toInteraction)
                .toList();
    }

    private Interaction toInteraction(AuditRecord auditRecord) {
        String displayName = auditRecord.getOutputSummary();
        if (displayName == null || displayName.isBlank()) {
            displayName = auditRecord.getEntityType();
        }
        return Interaction.builder()
                .type(mapActionType(auditRecord.getActionType()))
                .entityType(auditRecord.getEntityType())
                .entityId(auditRecord.getEntityId() != null ? auditRecord.getEntityId() : "")
                .displayName(displayName)
                .timestamp(auditRecord.getCreatedAt())
                .context(auditRecord.getIntent())
                .build();
    }

    static InteractionType mapActionType(String actionType) {
        if (actionType == null) {
            return InteractionType.VIEWED;
        }
        return switch (actionType) {
        case "query" -> InteractionType.QUERIED;
        case "create" -> InteractionType.CREATED;
        case "update" -> InteractionType.UPDATED;
        case "delete" -> InteractionType.DELETED;
        default -> InteractionType.VIEWED;
        };
    }
}
