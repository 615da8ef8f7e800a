package me.golemcore.apollo.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.exception.ConversationNotFoundException;
import me.golemcore.apollo.domain.model.Conversation;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.port.outbound.ConversationPort;
import me.golemcore.apollo.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-backed conversation store. Each conversation is one JSON document under
 * {@code conversations/}, cached in memory and written through on every
 * append.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService implements ConversationPort {

    static final String CONVERSATIONS_DIR = "conversations";
    static final int TITLE_MAX_CHARS = 50;
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Conversation> conversationCache = new ConcurrentHashMap<>();

    @Override
    public String getOrCreateConversation(String userId, String conversationId) {
        if (conversationId != null && !conversationId.isBlank()) {
            Conversation existing = findConversation(conversationId)
                    .filter(conversation -> conversation.isOwnedBy(userId))
                    .orElseThrow(() -> new ConversationNotFoundException(conversationId));
            return existing.getId();
        }

        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        persist(conversation);
        conversationCache.put(conversation.getId(), conversation);
        log.info("[Store] Created conversation {} for user {}", conversation.getId(), userId);
        return conversation.getId();
    }

    @Override
    public String appendMessage(String conversationId, Message message) {
        if (message.getRole() == null || !Message.PERSISTED_ROLES.contains(message.getRole())) {
            throw new IllegalArgumentException("Unsupported message role: " + message.getRole());
        }
        boolean blank = message.getContent() == null || message.getContent().isEmpty();
        if (blank && !(message.isAssistantMessage() && message.hasToolInvocations())) {
            throw new IllegalArgumentException("Message content must not be empty");
        }

        Conversation conversation = findConversation(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));

        synchronized (conversation) {
            List<Message> messages = conversation.getMessages();
            Instant now = clock.instant();
            Instant previousActivity = conversation.getLastActivityAt();
            Instant timestamp = previousActivity != null && now.isBefore(previousActivity) ? previousActivity : now;
            String previousTitle = conversation.getTitle();

            Message stored = Message.builder()
                    .id(UUID.randomUUID().toString())
                    .conversationId(conversationId)
                    .role(message.getRole())
                    .content(message.getContent() != null ? message.getContent() : "")
                    .toolInvocations(message.getToolInvocations())
                    .timestamp(timestamp)
                    .build();

            messages.add(stored);
            conversation.setLastActivityAt(timestamp);
            if (previousTitle == null && stored.isUserMessage()) {
                conversation.setTitle(deriveTitle(stored.getContent()));
            }

            try {
                persist(conversation);
            } catch (RuntimeException e) {
                messages.remove(messages.size() - 1);
                conversation.setLastActivityAt(previousActivity);
                conversation.setTitle(previousTitle);
                throw e;
            }
            log.debug("[Store] Appended {} message {} to conversation {}", stored.getRole(), stored.getId(),
                    conversationId);
            return stored.getId();
        }
    }

    @Override
    public List<Message> getRecentMessages(String conversationId, int limit) {
        Conversation conversation = findConversation(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        synchronized (conversation) {
            List<Message> messages = conversation.getMessages();
            int from = Math.max(0, messages.size() - Math.max(0, limit));
            return List.copyOf(messages.subList(from, messages.size()));
        }
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        Conversation cached = conversationCache.get(conversationId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Conversation> loaded = load(conversationId + JSON_EXTENSION);
        loaded.ifPresent(conversation -> conversationCache.putIfAbsent(conversationId, conversation));
        return loaded.map(conversation -> conversationCache.get(conversationId));
    }

    @Override
    public List<Conversation> listConversations(String userId) {
        try {
            List<String> files = storagePort.listObjects(CONVERSATIONS_DIR, "").join();
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                if (!conversationCache.containsKey(id)) {
                    load(file).ifPresent(conversation -> conversationCache.putIfAbsent(id, conversation));
                }
            }
        } catch (RuntimeException e) { // NOSONAR - fall back to cached conversations
            log.warn("[Store] Failed to scan conversations directory: {}", e.getMessage());
        }
        return conversationCache.values().stream()
                .filter(conversation -> conversation.isOwnedBy(userId))
                .sorted(Comparator.comparing(Conversation::getLastActivityAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    static String deriveTitle(String firstMessage) {
        String compact = firstMessage.strip().replaceAll("\\s+", " ");
        if (compact.length() <= TITLE_MAX_CHARS) {
            return compact;
        }
        return compact.substring(0, TITLE_MAX_CHARS) + "...";
    }

    private void persist(Conversation conversation) {
        String json;
        try {
            json = objectMapper.writeValueAsString(conversation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation " + conversation.getId(), e);
        }
        storagePort.putTextAtomic(CONVERSATIONS_DIR, conversation.getId() + JSON_EXTENSION, json, false).join();
    }

    private Optional<Conversation> load(String fileName) {
        try {
            String json = storagePort.getText(CONVERSATIONS_DIR, fileName).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            Conversation conversation = objectMapper.readValue(json, Conversation.class);
            if (conversation.getMessages() == null) {
                conversation.setMessages(new ArrayList<>());
            }
            return Optional.of(conversation);
        } catch (JsonProcessingException e) {
            log.warn("[Store] Failed to load conversation file {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }
}
