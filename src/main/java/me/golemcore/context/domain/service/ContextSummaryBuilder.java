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

import me.golemcore.context.domain.model.ContextSummary;
import me.golemcore.context.domain.model.ConversationMessage;
import me.golemcore.context.domain.model.Interaction;
import me.golemcore.context.domain.model.RankedItem;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs ranked context, recent conversation and recent activity into a
 * markdown digest that fits a token budget.
 *
 * <p>
 * Sections are tried in fixed order and each is kept or dropped whole. A
 * section that does not fit is skipped, later (smaller) sections may still be
 * added.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextSummaryBuilder {

    private static final String SECTION_SEPARATOR = "\n\n";
    private static final int CHARS_PER_TOKEN = 4;

    private final ContextEngineProperties properties;

    public ContextSummary buildSummary(List<RankedItem> rankedItems, List<ConversationMessage> conversation,
            List<Interaction> interactions) {
        return buildSummary(rankedItems, conversation, interactions, properties.getSummary().getMaxTokens());
    }

    public ContextSummary buildSummary(List<RankedItem> rankedItems, List<ConversationMessage> conversation,
            List<Interaction> interactions, int maxTokens) {
        if (maxTokens <= 0) {
            return ContextSummary.empty();
        }

        List<String> sections = new ArrayList<>();
        int usedTokens = 0;

        for (String section : List.of(
                renderRelevantContext(rankedItems),
                renderConversation(conversation),
                renderActivity(interactions))) {
            if (section.isEmpty()) {
                continue;
            }
            int sectionTokens = estimateTokens(sections.isEmpty() ? section : SECTION_SEPARATOR + section);
            if (usedTokens + sectionTokens > maxTokens) {
                log.debug("[ContextSummary] Skipping section ({} tokens, {} of {} used)", sectionTokens,
                        usedTokens, maxTokens);
                continue;
            }
            sections.add(section);
            usedTokens += sectionTokens;
        }

        return new ContextSummary(String.join(SECTION_SEPARATOR, sections), usedTokens);
    }

    /**
     * Rough token estimate: one token per four characters, rounded up.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private String renderRelevantContext(List<RankedItem> rankedItems) {
        if (rankedItems == null || rankedItems.isEmpty()) {
            return "";
        }
        ContextEngineProperties.SummaryProperties summary = properties.getSummary();
        List<String> lines = new ArrayList<>();
        for (RankedItem item : rankedItems) {
            if (lines.size() >= summary.getMaxItems()) {
                break;
            }
            if (item.getRelevance() >= summary.getRelevanceThreshold()) {
                lines.add("- " + item.getEntityType() + ": " + item.getSummary());
            }
        }
        return renderSection("## Relevant Context", lines);
    }

    private String renderConversation(List<ConversationMessage> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return "";
        }
        int maxMessages = properties.getSummary().getMaxMessages();
        List<ConversationMessage> recent = conversation.subList(Math.max(0, conversation.size() - maxMessages),
                conversation.size());
        List<String> lines = new ArrayList<>();
        for (ConversationMessage message : recent) {
            lines.add(message.getRole() + ": " + truncate(message.getContent()));
        }
        return renderSection("## Recent Conversation", lines);
    }

    private String renderActivity(List<Interaction> interactions) {
        if (interactions == null || interactions.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (Interaction interaction : interactions) {
            if (lines.size() >= properties.getSummary().getMaxInteractions()) {
                break;
            }
            lines.add("- " + interaction.getType() + " " + interaction.getEntityType() + ": "
                    + interaction.getDisplayName());
        }
        return renderSection("## Recent Activity", lines);
    }

    private String renderSection(String heading, List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return heading + "\n" + String.join("\n", lines);
    }

    private String truncate(String content) {
        if (content == null) {
            return "";
        }
        int maxLen = properties.getSummary().getMessageContentLength();
        if (content.length() <= maxLen) {
            return content;
        }
        return content.substring(0, maxLen) + "...";
    }
}
