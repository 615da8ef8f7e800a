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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.TokenEstimate;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.TokenizerPort;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Estimates token counts per model.
 *
 * <p>
 * Tokenizer handles are cached by model identifier in a small LRU map, so
 * repeated estimates for the same model reuse one handle. Models without an
 * exact tokenizer fall back to a character-based heuristic that over-counts,
 * and the estimate is flagged as approximate. Estimation never throws.
 */
@Service
@Slf4j
public class TokenEstimationService {

    /** Characters per token for the fallback heuristic. Lower than typical to over-count. */
    static final int FALLBACK_CHARS_PER_TOKEN = 3;

    /** Framing cost per chat message (role markers, separators). */
    public static final int MESSAGE_OVERHEAD_TOKENS = 8;

    /** Framing cost per tool definition offered to the model. */
    static final int TOOL_OVERHEAD_TOKENS = 8;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TokenizerPort tokenizerPort;
    private final Map<String, Optional<ToIntFunction<String>>> tokenizers;

    public TokenEstimationService(TokenizerPort tokenizerPort, ApolloProperties properties) {
        this.tokenizerPort = tokenizerPort;
        int capacity = Math.max(1, properties.getContext().getTokenizerCacheSize());
        this.tokenizers = new LinkedHashMap<>(capacity, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Optional<ToIntFunction<String>>> eldest) {
                return size() > capacity;
            }
        };
    }

    public TokenEstimate estimate(String model, String text) {
        if (text == null || text.isEmpty()) {
            return TokenEstimate.ZERO;
        }
        Optional<ToIntFunction<String>> tokenizer = tokenizerFor(model);
        if (tokenizer.isPresent()) {
            try {
                return new TokenEstimate(Math.max(0, tokenizer.get().applyAsInt(text)), false);
            } catch (RuntimeException e) { // NOSONAR - estimation must never fail the caller
                log.debug("[Context] Tokenizer for {} failed, using heuristic: {}", model, e.getMessage());
            }
        }
        return new TokenEstimate(heuristic(text), true);
    }

    public int count(String model, String text) {
        return estimate(model, text).tokens();
    }

    /**
     * Estimates a chat message including its framing overhead.
     */
    public int countMessage(String model, Message message) {
        int tokens = MESSAGE_OVERHEAD_TOKENS + count(model, message.getContent());
        if (message.hasToolCalls()) {
            for (Message.ToolCall toolCall : message.getToolCalls()) {
                tokens += count(model, toolCall.getId()) + count(model, toolCall.getName())
                        + count(model, toJson(toolCall.getArguments()));
            }
        }
        return tokens;
    }

    public int countMessages(String model, List<Message> messages) {
        return messages.stream().mapToInt(message -> countMessage(model, message)).sum();
    }

    /**
     * Estimates the tool catalog as the model receives it: name, description
     * and JSON schema of every definition.
     */
    public int countTools(String model, List<ToolDefinition> tools) {
        int tokens = 0;
        for (ToolDefinition tool : tools) {
            tokens += TOOL_OVERHEAD_TOKENS + count(model, tool.getName()) + count(model, tool.getDescription())
                    + count(model, toJson(tool.getInputSchema()));
        }
        return tokens;
    }

    /**
     * Cuts text down to the longest prefix that, with the marker appended,
     * costs at most {@code maxTokens}. Returns the text unchanged if it fits
     * and an empty string if not even the marker fits.
     */
    public String truncateToTokens(String model, String text, int maxTokens, String marker) {
        if (text == null || count(model, text) <= maxTokens) {
            return text;
        }
        if (count(model, marker) > maxTokens) {
            return "";
        }
        int low = 0;
        int high = text.length();
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (count(model, text.substring(0, mid) + marker) <= maxTokens) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return text.substring(0, low) + marker;
    }

    /**
     * Keeps the newest messages whose combined cost fits the budget, preserving
     * chronological order.
     */
    public List<Message> fitNewest(String model, List<Message> messages, int budget) {
        Deque<Message> kept = new ArrayDeque<>();
        int used = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            int cost = countMessage(model, messages.get(i));
            if (used + cost > budget) {
                break;
            }
            used += cost;
            kept.addFirst(messages.get(i));
        }
        return List.copyOf(kept);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Context] Could not serialize {} for estimation: {}", value.getClass().getSimpleName(),
                    e.getMessage());
            return String.valueOf(value);
        }
    }

    int cachedTokenizerCount() {
        synchronized (tokenizers) {
            return tokenizers.size();
        }
    }

    private Optional<ToIntFunction<String>> tokenizerFor(String model) {
        String key = model != null ? model : "";
        synchronized (tokenizers) {
            Optional<ToIntFunction<String>> cached = tokenizers.get(key);
            if (cached != null) {
                return cached;
            }
        }
        Optional<ToIntFunction<String>> created = createTokenizer(key);
        synchronized (tokenizers) {
            tokenizers.putIfAbsent(key, created);
            return tokenizers.get(key);
        }
    }

    private Optional<ToIntFunction<String>> createTokenizer(String model) {
        try {
            Optional<ToIntFunction<String>> tokenizer = tokenizerPort.createTokenizer(model);
            if (tokenizer.isEmpty()) {
                log.info("[Context] No exact tokenizer for model '{}', estimates will be approximate", model);
            }
            return tokenizer;
        } catch (RuntimeException e) { // NOSONAR - fall back to heuristic
            log.warn("[Context] Failed to create tokenizer for model '{}': {}", model, e.getMessage());
            return Optional.empty();
        }
    }

    private static int heuristic(String text) {
        return (text.length() + FALLBACK_CHARS_PER_TOKEN - 1) / FALLBACK_CHARS_PER_TOKEN;
    }
}
