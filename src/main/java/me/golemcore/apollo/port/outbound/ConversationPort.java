package me.golemcore.apollo.port.outbound;

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

import me.golemcore.apollo.domain.model.Conversation;
import me.golemcore.apollo.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Port for append-only conversation persistence.
 */
public interface ConversationPort {

    /**
     * Returns the id of the caller's conversation, creating a new one when
     * {@code conversationId} is null or blank.
     *
     * @throws me.golemcore.apollo.domain.exception.ConversationNotFoundException
     *             if the id is unknown or owned by another user
     */
    String getOrCreateConversation(String userId, String conversationId);

    /**
     * Appends a message and bumps the conversation's last activity. Returns the
     * id of the stored message.
     */
    String appendMessage(String conversationId, Message message);

    /**
     * Returns up to {@code limit} most recent messages, oldest first.
     */
    List<Message> getRecentMessages(String conversationId, int limit);

    Optional<Conversation> findConversation(String conversationId);

    /**
     * Lists a user's conversations, most recent activity first.
     */
    List<Conversation> listConversations(String userId);
}
