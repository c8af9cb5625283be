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
import me.golemcore.context.domain.model.ConversationMessage;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import me.golemcore.context.port.outbound.ConversationPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chat history stored as one append-only JSONL file per conversation:
 * {@code conversations/<conversationId>.jsonl}.
 */
@Component
@RequiredArgsConstructor
public class LocalConversationAdapter implements ConversationPort {

    private final JsonlRecordReader reader;
    private final ContextEngineProperties properties;

    @Override
    public List<ConversationMessage> listMessages(String conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String path = JsonlRecordReader.requireSafeId(conversationId, "conversation id") + ".jsonl";
        List<ConversationMessage> messages = reader.readAll(
                properties.getStorage().getDirectories().getConversations(), path, ConversationMessage.class);
        return List.copyOf(messages.subList(Math.max(0, messages.size() - limit), messages.size()));
    }
}
