package me.golemcore.apollo.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One element of the turn's outbound event stream. Serializes as
 * {@code {"type":"chunk","content":"..."}}; the terminal {@code done} event has
 * no content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(Type type, String content) {

    public static StreamEvent chunk(String text) {
        return new StreamEvent(Type.CHUNK, text);
    }

    public static StreamEvent progress(String text) {
        return new StreamEvent(Type.PROGRESS, text);
    }

    public static StreamEvent done() {
        return new StreamEvent(Type.DONE, null);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, message);
    }

    public boolean isTerminal() {
        return type == Type.DONE || type == Type.ERROR;
    }

    public enum Type {
        CHUNK, PROGRESS, DONE, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
