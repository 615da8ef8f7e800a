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

import lombok.Builder;
import lombok.Data;

/**
 * One element of a streamed model response. Intermediate chunks carry a text
 * delta; the last chunk has {@code done} set and carries the assembled
 * response, including any tool calls.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private boolean done;
    private LlmResponse response;

    public static LlmChunk delta(String text) {
        return LlmChunk.builder().text(text).build();
    }

    public static LlmChunk complete(LlmResponse response) {
        return LlmChunk.builder().done(true).response(response).build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
