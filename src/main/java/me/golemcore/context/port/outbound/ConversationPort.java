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

package me.golemcore.context.port.outbound;

import me.golemcore.context.domain.model.ConversationMessage;

import java.util.List;

/**
 * Read access to chat history.
 */
public interface ConversationPort {

    /**
     * Returns the most recent {@code limit} messages of a conversation, oldest
     * first.
     */
    List<ConversationMessage> listMessages(String conversationId, int limit);
}
