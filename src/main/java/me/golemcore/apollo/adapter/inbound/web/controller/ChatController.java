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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.StreamEvent;
import me.golemcore.apollo.domain.model.TurnRequest;
import me.golemcore.apollo.domain.system.turn.TurnCoordinator;
import me.golemcore.apollo.domain.system.turn.TurnHandle;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.Principal;
import java.util.List;

/**
 * Streaming chat endpoint. Each turn answers with server-sent events named
 * after their type: {@code chunk}, {@code progress}, then exactly one of
 * {@code done} or {@code error}.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String CONVERSATION_ID_HEADER = "X-Conversation-Id";

    private final TurnCoordinator turnCoordinator;

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<StreamEvent>>>> stream(@RequestBody ChatRequest request,
            Principal principal) {
        TurnRequest turnRequest = TurnRequest.builder()
                .userId(principal.getName())
                .conversationId(blankToNull(request.getConversationId()))
                .message(request.getMessage())
                .clientHistory(toClientHistory(request.getHistory()))
                .build();
        // submit resolves the conversation through the blocking store
        return Mono.fromCallable(() -> turnCoordinator.submit(turnRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponse);
    }

    private ResponseEntity<Flux<ServerSentEvent<StreamEvent>>> toResponse(TurnHandle handle) {
        log.info("[API] Chat turn accepted for conversation {}", handle.conversationId());
        Flux<ServerSentEvent<StreamEvent>> events = handle.events()
                .map(event -> ServerSentEvent.builder(event)
                        .event(event.type().wireName())
                        .build());
        return ResponseEntity.ok()
                .header(CONVERSATION_ID_HEADER, handle.conversationId())
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(events);
    }

    private List<Message> toClientHistory(List<ChatRequest.HistoryEntry> history) {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .filter(entry -> Message.ROLE_USER.equals(entry.getRole())
                        || Message.ROLE_ASSISTANT.equals(entry.getRole()))
                .filter(entry -> entry.getContent() != null && !entry.getContent().isBlank())
                .map(entry -> Message.builder().role(entry.getRole()).content(entry.getContent()).build())
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
