package me.golemcore.apollo.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.apollo.adapter.inbound.web.dto.ConversationSummaryDto;
import me.golemcore.apollo.adapter.inbound.web.dto.MessageDto;
import me.golemcore.apollo.domain.exception.ConversationNotFoundException;
import me.golemcore.apollo.domain.model.Conversation;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.port.outbound.ConversationPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.Principal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only conversation browser for the authenticated user.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationsController {

    private static final int MAX_MESSAGES_LIMIT = 200;

    private final ConversationPort conversationPort;

    @GetMapping
    public Mono<ResponseEntity<List<ConversationSummaryDto>>> listConversations(Principal principal) {
        return Mono.fromCallable(() -> {
            List<ConversationSummaryDto> dtos = conversationPort.listConversations(principal.getName()).stream()
                    .map(this::toSummary)
                    .toList();
            return ResponseEntity.ok(dtos);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/messages")
    public Mono<ResponseEntity<List<MessageDto>>> getMessages(@PathVariable String id,
            @RequestParam(defaultValue = "50") int limit, Principal principal) {
        return Mono.fromCallable(() -> {
            // Foreign conversations answer exactly like missing ones
            conversationPort.findConversation(id)
                    .filter(conversation -> conversation.isOwnedBy(principal.getName()))
                    .orElseThrow(() -> new ConversationNotFoundException(id));

            int normalizedLimit = Math.max(1, Math.min(limit, MAX_MESSAGES_LIMIT));
            List<MessageDto> dtos = conversationPort.getRecentMessages(id, normalizedLimit).stream()
                    .map(this::toDto)
                    .toList();
            return ResponseEntity.ok(dtos);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private ConversationSummaryDto toSummary(Conversation conversation) {
        return ConversationSummaryDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .messageCount(conversation.getMessages() != null ? conversation.getMessages().size() : 0)
                .createdAt(format(conversation.getCreatedAt()))
                .lastActivityAt(format(conversation.getLastActivityAt()))
                .build();
    }

    private MessageDto toDto(Message message) {
        return MessageDto.builder()
                .id(message.getId())
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(format(message.getTimestamp()))
                .toolInvocations(message.getToolInvocations())
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
