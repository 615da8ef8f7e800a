package me.golemcore.apollo.domain.system.turn;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.StreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Ordered event channel of one turn.
 *
 * <p>
 * Exactly one terminal event ({@code done} or {@code error}) is ever emitted;
 * everything offered after it is dropped. The returned {@link Flux} accepts a
 * single subscriber and buffers events until it subscribes. A subscriber that
 * cancels does not affect the turn: later emissions are silently discarded.
 */
@Slf4j
public class TurnEventEmitter {

    private final Sinks.Many<StreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private boolean terminated;

    public Flux<StreamEvent> events() {
        return sink.asFlux();
    }

    public boolean chunk(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return emit(StreamEvent.chunk(text));
    }

    public boolean progress(String text) {
        return emit(StreamEvent.progress(text));
    }

    public boolean done() {
        return emit(StreamEvent.done());
    }

    public boolean error(String message) {
        return emit(StreamEvent.error(message));
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    /**
     * @return false if the event was dropped because a terminal event was
     *         already emitted
     */
    private synchronized boolean emit(StreamEvent event) {
        if (terminated) {
            log.debug("[Turn] Dropping {} event after terminal event", event.type().wireName());
            return false;
        }
        terminated = event.isTerminal();

        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.debug("[Turn] {} event not delivered: {}", event.type().wireName(), result);
        }
        if (terminated) {
            sink.tryEmitComplete();
        }
        return true;
    }
}
