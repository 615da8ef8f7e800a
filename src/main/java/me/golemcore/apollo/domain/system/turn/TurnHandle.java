package me.golemcore.apollo.domain.system.turn;

import me.golemcore.apollo.domain.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * An accepted turn: the conversation it runs in and its event stream.
 */
public record TurnHandle(String conversationId, Flux<StreamEvent> events) {
}
